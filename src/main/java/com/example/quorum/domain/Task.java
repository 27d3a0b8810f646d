package com.example.quorum.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonRawValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A unit of work proposed by an agent or a user. Tasks are never removed as a
 * side effect of deleting anything else.
 */
@Entity
@Table(name = "tasks", indexes = {
        @Index(name = "idx_task_status", columnList = "status"),
        @Index(name = "idx_task_order", columnList = "priority_rank, due_at, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private TaskStatus status = TaskStatus.OPEN;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private TaskPriority priority = TaskPriority.MEDIUM;

    /** Mirrors {@link TaskPriority#rank()} so the database can order by it. */
    @JsonIgnore
    @Column(name = "priority_rank", nullable = false)
    private int priorityRank;

    private String owner;

    @Column(name = "due_at")
    private Instant dueAt;

    @JsonRawValue
    @Column(name = "metadata", columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        updatedAt = createdAt;
        priorityRank = priority.rank();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
        priorityRank = priority.rank();
    }
}
