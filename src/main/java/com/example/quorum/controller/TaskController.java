package com.example.quorum.controller;

import com.example.quorum.domain.MemoryContext;
import com.example.quorum.domain.Task;
import com.example.quorum.domain.TaskPriority;
import com.example.quorum.domain.TaskStatus;
import com.example.quorum.memory.TaskService;
import com.example.quorum.memory.TaskService.NewTask;
import com.example.quorum.memory.TaskService.TaskPatch;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final TaskService taskService;

    @GetMapping
    public ResponseEntity<List<Task>> list(@RequestParam(required = false) String status,
                                           @RequestParam(required = false) String priority,
                                           @RequestParam(required = false) String owner,
                                           @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(taskService.list(
                Requests.optional(status, TaskStatus::fromValue),
                Requests.optional(priority, TaskPriority::fromValue),
                owner, limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Task> get(@PathVariable String id) {
        return ResponseEntity.ok(taskService.get(id));
    }

    @PostMapping
    public ResponseEntity<Task> create(@RequestBody Map<String, Object> body) {
        NewTask request = new NewTask(
                Requests.string(body, "title"),
                Requests.string(body, "description"),
                Requests.optional(Requests.string(body, "status"), TaskStatus::fromValue),
                Requests.optional(Requests.string(body, "priority"), TaskPriority::fromValue),
                Requests.string(body, "owner"),
                Requests.instant(body, "due_at"),
                Requests.map(body, "metadata"));
        return ResponseEntity.status(HttpStatus.CREATED).body(taskService.create(MemoryContext.user(), request));
    }

    /**
     * Partial update. An explicit null for owner or due_at clears it.
     */
    @PatchMapping("/{id}")
    public ResponseEntity<Task> update(@PathVariable String id, @RequestBody Map<String, Object> body) {
        TaskPatch patch = new TaskPatch(
                body.get("title") instanceof String title ? title : null,
                Requests.string(body, "description"),
                Requests.optional(Requests.string(body, "status"), TaskStatus::fromValue),
                Requests.optional(Requests.string(body, "priority"), TaskPriority::fromValue),
                Requests.string(body, "owner"),
                Requests.has(body, "owner") && body.get("owner") == null,
                Requests.instant(body, "due_at"),
                Requests.has(body, "due_at") && body.get("due_at") == null,
                Requests.map(body, "metadata"));
        return ResponseEntity.ok(taskService.update(MemoryContext.user(), id, patch));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String id) {
        taskService.delete(MemoryContext.user(), id);
        return ResponseEntity.ok(Map.of("deleted", id));
    }
}
