package com.example.quorum.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One invocation of a scheduled agent.
 */
@Entity
@Table(name = "agent_runs", indexes = {
        @Index(name = "idx_run_agent_started", columnList = "agent_name, started_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "agent_name", nullable = false, length = 64)
    private String agentName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AgentTier tier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AgentRunStatus status;

    @Column(columnDefinition = "TEXT")
    private String summary;

    @Column(name = "records_written")
    private int recordsWritten;

    @Column(name = "records_rejected")
    private int recordsRejected;

    @Enumerated(EnumType.STRING)
    @Column(name = "notification", length = 16)
    @Builder.Default
    private NotificationOutcome notification = NotificationOutcome.NONE;

    @Column(name = "error_message", length = 2048)
    private String errorMessage;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
