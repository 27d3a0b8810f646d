package com.example.quorum.repository;

import com.example.quorum.domain.Task;
import com.example.quorum.domain.TaskPriority;
import com.example.quorum.domain.TaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TaskRepository extends JpaRepository<Task, String> {

    /**
     * Most urgent first: priority rank, then due date with undated tasks last,
     * then newest.
     */
    @Query("SELECT t FROM Task t WHERE " +
            "(:status IS NULL OR t.status = :status) AND " +
            "(:priority IS NULL OR t.priority = :priority) AND " +
            "(:owner IS NULL OR t.owner = :owner) " +
            "ORDER BY t.priorityRank ASC, t.dueAt ASC NULLS LAST, t.createdAt DESC")
    List<Task> findFiltered(TaskStatus status, TaskPriority priority, String owner, Pageable pageable);

    long countByStatus(TaskStatus status);
}
