package com.example.quorum.controller;

import com.example.quorum.embedding.EmbeddingMigrationService;
import com.example.quorum.embedding.VectorStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API for embedding status, backfill and reindexing.
 */
@RestController
@RequestMapping("/api/embeddings")
@RequiredArgsConstructor
public class EmbeddingController {

    private final EmbeddingMigrationService migrationService;
    private final VectorStore vectorStore;

    /**
     * Provider, stored and in-memory counts, and whether a migration is running.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>(migrationService.getStatus());
        status.put("inMemoryCount", vectorStore.size());
        status.put("inMemoryByType", vectorStore.countByBase());
        return ResponseEntity.ok(status);
    }

    /**
     * Start a background re-embed of every document and event. With
     * {@code purge=true} the index is dropped first and nothing is reused.
     */
    @PostMapping("/reindex")
    public ResponseEntity<Map<String, Object>> reindex(@RequestParam(defaultValue = "false") boolean purge) {
        if (migrationService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "An embedding migration is already running"));
        }
        migrationService.reindexAsync(purge);
        return ResponseEntity.accepted().body(Map.of("message", "Reindex started", "purge", purge));
    }

    /**
     * Embed records that have no embeddings yet.
     */
    @PostMapping("/backfill")
    public ResponseEntity<Map<String, Object>> backfill() {
        EmbeddingMigrationService.MigrationResult result = migrationService.backfill();
        return ResponseEntity.ok(Map.of(
                "message", "Backfill complete",
                "documents", result.documents(),
                "events", result.events(),
                "failed", result.failed()
        ));
    }
}
