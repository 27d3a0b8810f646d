package com.example.quorum.controller;

import com.example.quorum.domain.Event;
import com.example.quorum.service.ChatService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;

/**
 * Streaming chat with a single agent. The reply body is plain text, flushed
 * fragment by fragment as the reasoning process writes it.
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatController {

    private final ChatService chatService;

    @PostMapping(produces = MediaType.TEXT_PLAIN_VALUE)
    public Flux<String> chat(@RequestBody Map<String, Object> body) {
        return chatService.chat(Requests.string(body, "agent"), Requests.string(body, "message"));
    }

    @GetMapping("/{agent}/history")
    public ResponseEntity<List<Event>> history(@PathVariable String agent) {
        return ResponseEntity.ok(chatService.history(agent));
    }
}
