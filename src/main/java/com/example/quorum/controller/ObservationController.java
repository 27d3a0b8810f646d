package com.example.quorum.controller;

import com.example.quorum.domain.*;
import com.example.quorum.memory.ObservationService;
import com.example.quorum.memory.ObservationService.NewObservation;
import com.example.quorum.memory.ObservationService.ObservationFilter;
import com.example.quorum.memory.ObservationService.UpsertResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Observations: critiques, risks and insights recorded by agents or users.
 */
@RestController
@RequestMapping("/api/observations")
@RequiredArgsConstructor
public class ObservationController {

    private final ObservationService observationService;

    @GetMapping
    public ResponseEntity<Map<String, Object>> list(@RequestParam(required = false) String category,
                                                    @RequestParam(required = false) String severity,
                                                    @RequestParam(required = false) String status,
                                                    @RequestParam(value = "source_agent", required = false) String sourceAgent,
                                                    @RequestParam(value = "ref_type", required = false) String refType,
                                                    @RequestParam(value = "ref_id", required = false) String refId,
                                                    @RequestParam(defaultValue = "0") int page,
                                                    @RequestParam(defaultValue = "20") int size) {
        ObservationFilter filter = new ObservationFilter(
                Requests.optional(category, ObservationCategory::fromValue),
                Requests.optional(severity, ObservationSeverity::fromValue),
                Requests.optional(status, ObservationStatus::fromValue),
                sourceAgent,
                Requests.optional(refType, ObservationRefType::fromValue),
                refId);
        Page<Observation> result = observationService.list(filter, page, size);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("observations", result.getContent());
        body.put("page", result.getNumber());
        body.put("size", result.getSize());
        body.put("total", result.getTotalElements());
        body.put("total_pages", result.getTotalPages());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Observation> get(@PathVariable String id) {
        return ResponseEntity.ok(observationService.get(id));
    }

    /**
     * Record an observation. Resubmitting the same category, source and
     * content refreshes the existing row and answers 200 instead of 201.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestBody Map<String, Object> body) {
        NewObservation request = new NewObservation(
                ObservationCategory.fromValue(Requests.string(body, "category")),
                Requests.optional(Requests.string(body, "severity"), ObservationSeverity::fromValue),
                Requests.optional(Requests.string(body, "status"), ObservationStatus::fromValue),
                Requests.string(body, "content"),
                Requests.string(body, "source_agent"),
                Requests.string(body, "ref_id"),
                Requests.optional(Requests.string(body, "ref_type"), ObservationRefType::fromValue),
                Requests.map(body, "metadata"));
        UpsertResult result = observationService.create(MemoryContext.user(), request);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("observation", result.observation());
        response.put("created", result.created());
        return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK).body(response);
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<Observation> updateStatus(@PathVariable String id, @RequestBody Map<String, Object> body) {
        ObservationStatus status = ObservationStatus.fromValue(Requests.string(body, "status"));
        return ResponseEntity.ok(observationService.updateStatus(MemoryContext.user(), id, status));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String id) {
        observationService.delete(MemoryContext.user(), id);
        return ResponseEntity.ok(Map.of("deleted", id));
    }
}
