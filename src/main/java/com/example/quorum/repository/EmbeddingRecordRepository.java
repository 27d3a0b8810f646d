package com.example.quorum.repository;

import com.example.quorum.domain.EmbeddingRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Embedding rows are addressed by family: every row of one reference whose
 * ref type is the base ("document") or one of its chunk variants
 * ("document_chunk_0"). The chunk pattern is a LIKE pattern escaped with '!',
 * see {@code EmbeddingRefTypes#chunkPattern}.
 */
@Repository
public interface EmbeddingRecordRepository extends JpaRepository<EmbeddingRecord, String> {

    @Query("SELECT e FROM EmbeddingRecord e WHERE e.refId = :refId AND " +
            "(e.refType = :base OR e.refType LIKE :chunkPattern ESCAPE '!')")
    List<EmbeddingRecord> findFamily(String refId, String base, String chunkPattern);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM EmbeddingRecord e WHERE e.refId = :refId AND " +
            "(e.refType = :base OR e.refType LIKE :chunkPattern ESCAPE '!')")
    int deleteFamily(String refId, String base, String chunkPattern);

    @Query("SELECT COUNT(DISTINCT e.refId) FROM EmbeddingRecord e WHERE " +
            "e.refType = :base OR e.refType LIKE :chunkPattern ESCAPE '!'")
    long countReferences(String base, String chunkPattern);

    @Query("SELECT COUNT(e) FROM EmbeddingRecord e WHERE e.refType LIKE :chunkPattern ESCAPE '!'")
    long countChunks(String chunkPattern);
}
