package com.example.quorum.controller;

import com.example.quorum.domain.DocumentType;
import com.example.quorum.service.SearchService;
import com.example.quorum.service.SearchService.SearchQuery;
import com.example.quorum.service.SearchService.SearchResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Set;

@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
public class SearchController {

    private final SearchService searchService;

    /**
     * Semantic search over documents and events, falling back to keyword
     * matching on documents when the embedding provider is down.
     */
    @GetMapping
    public ResponseEntity<SearchResponse> search(@RequestParam("q") String text,
                                                 @RequestParam(required = false) Set<String> types,
                                                 @RequestParam(value = "doc_type", required = false) String docType,
                                                 @RequestParam(required = false) String tag,
                                                 @RequestParam(value = "event_type", required = false) String eventType,
                                                 @RequestParam(required = false) Instant since,
                                                 @RequestParam(defaultValue = "10") int limit,
                                                 @RequestParam(value = "min_score", defaultValue = "0") double minScore,
                                                 @RequestParam(value = "include_chunks", defaultValue = "true") boolean includeChunks) {
        SearchQuery query = new SearchQuery(text, types, Requests.optional(docType, DocumentType::fromValue),
                blankToNull(tag), blankToNull(eventType), since, limit, minScore, includeChunks);
        return ResponseEntity.ok(searchService.search(query));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
