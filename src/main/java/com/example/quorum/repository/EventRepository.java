package com.example.quorum.repository;

import com.example.quorum.domain.Event;
import com.example.quorum.domain.ThreadSummary;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface EventRepository extends JpaRepository<Event, String> {

    @Query("SELECT e FROM Event e WHERE " +
            "(:eventType IS NULL OR e.eventType = :eventType) AND " +
            "(:agentName IS NULL OR e.agentName = :agentName) AND " +
            "(:since IS NULL OR e.createdAt >= :since) " +
            "ORDER BY e.createdAt DESC")
    List<Event> findFiltered(String eventType, String agentName, Instant since, Pageable pageable);

    @Query("SELECT e.id FROM Event e WHERE " +
            "(:eventType IS NULL OR e.eventType = :eventType) AND " +
            "(:since IS NULL OR e.createdAt >= :since)")
    List<String> findIdsFiltered(String eventType, Instant since);

    List<Event> findByAgentNameAndEventTypeInOrderByCreatedAtAsc(String agentName, Collection<String> eventTypes);

    List<Event> findByThreadIdAndEventTypeInOrderByCreatedAtAsc(String threadId, Collection<String> eventTypes);

    List<Event> findByEventTypeAndRefIdOrderByCreatedAtDesc(String eventType, String refId);

    List<Event> findByThreadId(String threadId);

    @Query("SELECT new com.example.quorum.domain.ThreadSummary(" +
            "e.threadId, MAX(e.threadTitle), COUNT(e), MAX(e.createdAt)) " +
            "FROM Event e WHERE e.threadId IS NOT NULL AND e.eventType IN :eventTypes " +
            "GROUP BY e.threadId ORDER BY MAX(e.createdAt) DESC")
    List<ThreadSummary> summarizeThreads(Collection<String> eventTypes);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Event e SET e.threadTitle = :title WHERE e.threadId = :threadId")
    int renameThread(String threadId, String title);

    @Query("SELECT e FROM Event e WHERE NOT EXISTS (" +
            "SELECT 1 FROM EmbeddingRecord r WHERE r.refId = e.id AND " +
            "(r.refType = 'event' OR r.refType LIKE 'event!_chunk!_%' ESCAPE '!'))")
    List<Event> findUnembedded();

    @Query("SELECT COUNT(e) FROM Event e WHERE NOT EXISTS (" +
            "SELECT 1 FROM EmbeddingRecord r WHERE r.refId = e.id AND " +
            "(r.refType = 'event' OR r.refType LIKE 'event!_chunk!_%' ESCAPE '!'))")
    long countUnembedded();

    long countByCreatedAtAfter(Instant since);
}
