package com.example.quorum.repository;

import com.example.quorum.domain.*;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ObservationRepository extends JpaRepository<Observation, String> {

    Optional<Observation> findByFingerprint(String fingerprint);

    @Query(value = "SELECT o FROM Observation o WHERE " +
            "(:category IS NULL OR o.category = :category) AND " +
            "(:severity IS NULL OR o.severity = :severity) AND " +
            "(:status IS NULL OR o.status = :status) AND " +
            "(:sourceAgent IS NULL OR o.sourceAgent = :sourceAgent) AND " +
            "(:refType IS NULL OR o.refType = :refType) AND " +
            "(:refId IS NULL OR o.refId = :refId) " +
            "ORDER BY o.createdAt DESC",
            countQuery = "SELECT COUNT(o) FROM Observation o WHERE " +
                    "(:category IS NULL OR o.category = :category) AND " +
                    "(:severity IS NULL OR o.severity = :severity) AND " +
                    "(:status IS NULL OR o.status = :status) AND " +
                    "(:sourceAgent IS NULL OR o.sourceAgent = :sourceAgent) AND " +
                    "(:refType IS NULL OR o.refType = :refType) AND " +
                    "(:refId IS NULL OR o.refId = :refId)")
    Page<Observation> findFiltered(ObservationCategory category,
                                   ObservationSeverity severity,
                                   ObservationStatus status,
                                   String sourceAgent,
                                   ObservationRefType refType,
                                   String refId,
                                   Pageable pageable);

    long countByStatus(ObservationStatus status);
}
