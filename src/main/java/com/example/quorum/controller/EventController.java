package com.example.quorum.controller;

import com.example.quorum.domain.Event;
import com.example.quorum.domain.MemoryContext;
import com.example.quorum.memory.EventService;
import com.example.quorum.memory.EventService.NewEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventController {

    private final EventService eventService;

    @GetMapping
    public ResponseEntity<List<Event>> list(@RequestParam(value = "event_type", required = false) String eventType,
                                            @RequestParam(value = "agent", required = false) String agentName,
                                            @RequestParam(required = false) Instant since,
                                            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(eventService.list(eventType, agentName, since, limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Event> get(@PathVariable String id) {
        return ResponseEntity.ok(eventService.get(id));
    }

    @PostMapping
    public ResponseEntity<Event> append(@RequestBody Map<String, Object> body) {
        NewEvent request = new NewEvent(
                Requests.string(body, "event_type"),
                Requests.string(body, "title"),
                Requests.string(body, "description"),
                Requests.map(body, "metadata"),
                Requests.string(body, "agent_name"),
                Requests.string(body, "ref_id"),
                null, null);
        return ResponseEntity.status(HttpStatus.CREATED).body(eventService.append(MemoryContext.user(), request));
    }
}
