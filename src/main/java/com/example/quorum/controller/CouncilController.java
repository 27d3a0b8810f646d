package com.example.quorum.controller;

import com.example.quorum.domain.Event;
import com.example.quorum.domain.ThreadSummary;
import com.example.quorum.service.CouncilChatService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;

/**
 * Council chat and its conversation threads.
 */
@RestController
@RequestMapping("/api/council")
@RequiredArgsConstructor
public class CouncilController {

    private final CouncilChatService councilChatService;

    @PostMapping(produces = MediaType.TEXT_PLAIN_VALUE)
    public Flux<String> chat(@RequestBody Map<String, Object> body) {
        return councilChatService.chat(Requests.string(body, "message"),
                Requests.string(body, "thread_id"), Requests.string(body, "thread_title"));
    }

    @GetMapping("/threads")
    public ResponseEntity<List<ThreadSummary>> listThreads() {
        return ResponseEntity.ok(councilChatService.listThreads());
    }

    @PostMapping("/threads")
    public ResponseEntity<ThreadSummary> createThread(@RequestBody(required = false) Map<String, Object> body) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(councilChatService.createThread(Requests.string(body, "title")));
    }

    @GetMapping("/threads/{threadId}")
    public ResponseEntity<List<Event>> messages(@PathVariable String threadId) {
        return ResponseEntity.ok(councilChatService.messages(threadId));
    }

    @PatchMapping("/threads/{threadId}")
    public ResponseEntity<Map<String, Object>> rename(@PathVariable String threadId,
                                                      @RequestBody Map<String, Object> body) {
        int updated = councilChatService.renameThread(threadId, Requests.string(body, "title"));
        return ResponseEntity.ok(Map.of("thread_id", threadId, "updated", updated));
    }

    @DeleteMapping("/threads/{threadId}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String threadId) {
        int deleted = councilChatService.deleteThread(threadId);
        return ResponseEntity.ok(Map.of("thread_id", threadId, "deleted", deleted));
    }
}
