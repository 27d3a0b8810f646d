package com.example.quorum.domain;

import com.fasterxml.jackson.annotation.JsonRawValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A judgment one agent makes about the shared store: a critique, a risk, an
 * insight. Identity is the fingerprint of (category, source agent, content),
 * so resubmitting the same judgment updates the existing row.
 */
@Entity
@Table(name = "observations", indexes = {
        @Index(name = "idx_obs_fingerprint", columnList = "fingerprint", unique = true),
        @Index(name = "idx_obs_status", columnList = "status"),
        @Index(name = "idx_obs_source_agent", columnList = "source_agent"),
        @Index(name = "idx_obs_ref", columnList = "ref_type, ref_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Observation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ObservationCategory category;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private ObservationSeverity severity = ObservationSeverity.INFO;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private ObservationStatus status = ObservationStatus.OPEN;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String content;

    @Column(name = "source_agent", nullable = false, length = 64)
    private String sourceAgent;

    @Column(name = "ref_id")
    private String refId;

    @Enumerated(EnumType.STRING)
    @Column(name = "ref_type", length = 32)
    private ObservationRefType refType;

    @JsonRawValue
    @Column(name = "metadata", columnDefinition = "TEXT")
    private String metadata;

    @Column(nullable = false, length = 64)
    private String fingerprint;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
