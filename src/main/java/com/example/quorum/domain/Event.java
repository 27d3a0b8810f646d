package com.example.quorum.domain;

import com.fasterxml.jackson.annotation.JsonRawValue;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Append-only record of something that happened: a chat turn, an agent
 * analysis, a collected item. No setters; the only mutation is the bulk
 * thread-title rename in {@code EventRepository#renameThread}.
 */
@Entity
@Table(name = "events", indexes = {
        @Index(name = "idx_event_type_created", columnList = "event_type, created_at"),
        @Index(name = "idx_event_thread", columnList = "thread_id"),
        @Index(name = "idx_event_ref", columnList = "ref_id")
})
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Event {

    public static final String CHAT_MESSAGE = "chat_message";
    public static final String CHAT_RESPONSE = "chat_response";
    public static final String COUNCIL_MESSAGE = "quorum_chat";
    public static final String COUNCIL_RESPONSE = "quorum_response";
    public static final String AGENT_ANALYSIS = "agent_analysis";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "event_type", nullable = false, updatable = false, length = 64)
    private String eventType;

    @Column(nullable = false, updatable = false)
    private String title;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String description;

    @JsonRawValue
    @Column(name = "metadata", columnDefinition = "TEXT", updatable = false)
    private String metadata;

    @Column(name = "agent_name", updatable = false, length = 64)
    private String agentName;

    @Column(name = "ref_id", updatable = false)
    private String refId;

    @Column(name = "thread_id", updatable = false, length = 64)
    private String threadId;

    @Column(name = "thread_title")
    private String threadTitle;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
