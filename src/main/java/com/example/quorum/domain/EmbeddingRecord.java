package com.example.quorum.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persists one embedding vector per (ref_id, ref_type). The ref type is a base
 * ("document", "event") for content embedded whole, or a chunk variant
 * ("document_chunk_3") for one slice of long content. The vector is stored as
 * a comma-separated float array; similarity is computed in Java.
 */
@Entity
@Table(name = "embedding_records", indexes = {
        @Index(name = "idx_emb_ref_id", columnList = "ref_id"),
        @Index(name = "idx_emb_ref_type_id", columnList = "ref_type, ref_id", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "ref_id", nullable = false)
    private String refId;

    @Column(name = "ref_type", nullable = false, length = 64)
    private String refType;

    /** SHA-256 of the embedded text; equal hash means the vector can be reused */
    @Column(name = "content_hash", length = 64, nullable = false)
    private String contentHash;

    @Column(name = "dimensions", nullable = false)
    private int dimensions;

    @Column(name = "embedding", columnDefinition = "TEXT", nullable = false)
    private String embedding;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
