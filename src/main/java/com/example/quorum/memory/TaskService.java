package com.example.quorum.memory;

import com.example.quorum.domain.MemoryContext;
import com.example.quorum.domain.Task;
import com.example.quorum.domain.TaskPriority;
import com.example.quorum.domain.TaskStatus;
import com.example.quorum.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class TaskService {

    private final TaskRepository taskRepository;
    private final MetadataJson metadataJson;

    public Task create(MemoryContext ctx, NewTask request) {
        if (request.title() == null || request.title().isBlank()) {
            throw new IllegalArgumentException("Task title is required");
        }
        Task saved = taskRepository.save(Task.builder()
                .title(request.title().trim())
                .description(request.description())
                .status(request.status() != null ? request.status() : TaskStatus.OPEN)
                .priority(request.priority() != null ? request.priority() : TaskPriority.MEDIUM)
                .owner(DocumentService.blankToNull(request.owner()))
                .dueAt(request.dueAt())
                .metadata(metadataJson.write(withCreator(request.metadata(), ctx)))
                .build());
        log.info("Task {} '{}' created by {} ({})", saved.getId(), saved.getTitle(), ctx.actor(),
                saved.getPriority().value());
        return saved;
    }

    public Task get(String id) {
        return taskRepository.findById(id).orElseThrow(() -> NotFound.of("Task", id));
    }

    /**
     * Tasks ordered by priority rank, due date (undated last), then newest.
     */
    public List<Task> list(TaskStatus status, TaskPriority priority, String owner, int limit) {
        return taskRepository.findFiltered(status, priority, DocumentService.blankToNull(owner),
                PageRequest.of(0, DocumentService.clampLimit(limit)));
    }

    /**
     * Apply only the fields present in the patch.
     */
    @Transactional
    public Task update(MemoryContext ctx, String id, TaskPatch patch) {
        Task task = get(id);
        if (patch.title() != null) {
            if (patch.title().isBlank()) throw new IllegalArgumentException("Task title cannot be blank");
            task.setTitle(patch.title().trim());
        }
        if (patch.description() != null) task.setDescription(patch.description());
        if (patch.status() != null) task.setStatus(patch.status());
        if (patch.priority() != null) task.setPriority(patch.priority());
        if (patch.clearOwner()) {
            task.setOwner(null);
        } else if (patch.owner() != null) {
            task.setOwner(patch.owner());
        }
        if (patch.clearDueAt()) {
            task.setDueAt(null);
        } else if (patch.dueAt() != null) {
            task.setDueAt(patch.dueAt());
        }
        if (patch.metadata() != null) task.setMetadata(metadataJson.merge(task.getMetadata(), patch.metadata()));
        Task saved = taskRepository.saveAndFlush(task);
        log.info("Task {} updated by {} (status={}, priority={})", id, ctx.actor(),
                saved.getStatus().value(), saved.getPriority().value());
        return saved;
    }

    public void delete(MemoryContext ctx, String id) {
        taskRepository.delete(get(id));
        log.info("Task {} deleted by {}", id, ctx.actor());
    }

    private static Map<String, Object> withCreator(Map<String, Object> metadata, MemoryContext ctx) {
        Map<String, Object> copy = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        copy.putIfAbsent("created_by", ctx.actor());
        return copy;
    }

    public record NewTask(String title, String description, TaskStatus status, TaskPriority priority,
                          String owner, Instant dueAt, Map<String, Object> metadata) {
    }

    /**
     * Partial update. Null fields are left unchanged; the clear flags null out
     * the optional owner and due date.
     */
    public record TaskPatch(String title, String description, TaskStatus status, TaskPriority priority,
                            String owner, boolean clearOwner, Instant dueAt, boolean clearDueAt,
                            Map<String, Object> metadata) {

        public static TaskPatch status(TaskStatus status) {
            return new TaskPatch(null, null, status, null, null, false, null, false, null);
        }
    }
}
