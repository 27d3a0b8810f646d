package com.example.quorum.repository;

import com.example.quorum.domain.Document;
import com.example.quorum.domain.DocumentType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface DocumentRepository extends JpaRepository<Document, String> {

    @Query("SELECT DISTINCT d FROM Document d LEFT JOIN d.tags t WHERE " +
            "(:docType IS NULL OR d.docType = :docType) AND " +
            "(:tag IS NULL OR t = :tag) AND " +
            "(:since IS NULL OR d.createdAt >= :since) " +
            "ORDER BY d.updatedAt DESC")
    List<Document> findFiltered(DocumentType docType, String tag, Instant since, Pageable pageable);

    /** Id-only variant of {@link #findFiltered}, used to narrow vector search. */
    @Query("SELECT DISTINCT d.id FROM Document d LEFT JOIN d.tags t WHERE " +
            "(:docType IS NULL OR d.docType = :docType) AND " +
            "(:tag IS NULL OR t = :tag) AND " +
            "(:since IS NULL OR d.createdAt >= :since)")
    List<String> findIdsFiltered(DocumentType docType, String tag, Instant since);

    /** {@code query} must already be escaped with {@code '!'} as the LIKE escape character. */
    @Query("SELECT d FROM Document d WHERE " +
            "LOWER(d.title) LIKE LOWER(CONCAT('%', :query, '%')) ESCAPE '!' OR " +
            "LOWER(d.content) LIKE LOWER(CONCAT('%', :query, '%')) ESCAPE '!' " +
            "ORDER BY d.updatedAt DESC")
    List<Document> searchKeyword(String query, Pageable pageable);

    @Query("SELECT d FROM Document d WHERE NOT EXISTS (" +
            "SELECT 1 FROM EmbeddingRecord e WHERE e.refId = d.id AND " +
            "(e.refType = 'document' OR e.refType LIKE 'document!_chunk!_%' ESCAPE '!'))")
    List<Document> findUnembedded();

    @Query("SELECT COUNT(d) FROM Document d WHERE NOT EXISTS (" +
            "SELECT 1 FROM EmbeddingRecord e WHERE e.refId = d.id AND " +
            "(e.refType = 'document' OR e.refType LIKE 'document!_chunk!_%' ESCAPE '!'))")
    long countUnembedded();

    long countByDocType(DocumentType docType);
}
