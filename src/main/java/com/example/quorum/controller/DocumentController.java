package com.example.quorum.controller;

import com.example.quorum.domain.Document;
import com.example.quorum.domain.DocumentType;
import com.example.quorum.domain.Event;
import com.example.quorum.domain.MemoryContext;
import com.example.quorum.memory.DocumentService;
import com.example.quorum.memory.DocumentService.IngestResult;
import com.example.quorum.memory.DocumentService.NewDocument;
import com.example.quorum.service.DocumentAnalysisService;
import com.example.quorum.service.DocumentAnalysisService.AnalysisResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.*;

/**
 * Document upload, retrieval and per-document agent analysis.
 */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentService documentService;
    private final DocumentAnalysisService analysisService;
    private final ObjectMapper objectMapper;

    /**
     * Store a text document from a JSON body.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> upload(@RequestBody Map<String, Object> body) {
        String title = Requests.string(body, "title");
        String content = Requests.string(body, "content");
        String docType = Requests.string(body, "doc_type");
        if (title == null || content == null || docType == null) {
            throw new IllegalArgumentException("Missing required fields: title, content, doc_type");
        }
        IngestResult result = documentService.create(MemoryContext.user(), new NewDocument(
                DocumentType.fromValue(docType), title, content,
                Requests.stringSet(body, "tags"), Requests.map(body, "metadata")));
        return ResponseEntity.ok(ingestBody(result));
    }

    /**
     * Store an uploaded text file. Binary formats are not converted.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> uploadFile(@RequestParam("file") MultipartFile file,
                                                          @RequestParam(required = false) String title,
                                                          @RequestParam(value = "doc_type", required = false) String docType,
                                                          @RequestParam(required = false) String tags) throws IOException {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("No file provided");
        }
        if (title == null || title.isBlank() || docType == null || docType.isBlank()) {
            throw new IllegalArgumentException("Missing required fields: title, doc_type");
        }
        String content = new String(file.getBytes(), StandardCharsets.UTF_8);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("filename", file.getOriginalFilename());
        metadata.put("file_type", file.getContentType());
        metadata.put("file_size", file.getSize());

        IngestResult result = documentService.create(MemoryContext.user(), new NewDocument(
                DocumentType.fromValue(docType), title, content, parseTags(tags), metadata));
        return ResponseEntity.ok(ingestBody(result));
    }

    @GetMapping
    public ResponseEntity<List<Document>> list(@RequestParam(value = "doc_type", required = false) String docType,
                                               @RequestParam(required = false) String tag,
                                               @RequestParam(required = false) Instant since,
                                               @RequestParam(defaultValue = "50") int limit) {
        DocumentType type = docType == null || docType.isBlank() ? null : DocumentType.fromValue(docType);
        return ResponseEntity.ok(documentService.list(type, tag, since, limit));
    }

    /**
     * A document together with its embedding status.
     */
    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String id) {
        Document document = documentService.get(id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("document", document);
        body.put("embedding", documentService.embeddingStatus(id));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{id}/chunks")
    public ResponseEntity<List<String>> chunks(@PathVariable String id) {
        return ResponseEntity.ok(documentService.chunks(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String id) {
        documentService.delete(MemoryContext.user(), id);
        return ResponseEntity.ok(Map.of("deleted", id));
    }

    @PostMapping("/{id}/reembed")
    public ResponseEntity<Map<String, Object>> reembed(@PathVariable String id) {
        return ResponseEntity.ok(ingestBody(documentService.reembed(MemoryContext.user(), id)));
    }

    /**
     * Have one agent review the document. Blocks until the review is stored.
     */
    @PostMapping("/{id}/analyses")
    public ResponseEntity<Map<String, Object>> analyze(@PathVariable String id, @RequestBody Map<String, Object> body) {
        AnalysisResult result = analysisService.analyzeDocument(id, Requests.string(body, "agent"));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("event_id", result.eventId());
        response.put("analysis", result.analysis());
        response.put("outcome", result.outcome() != null ? result.outcome().value() : null);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{id}/analyses")
    public ResponseEntity<List<Event>> analyses(@PathVariable String id) {
        documentService.get(id);
        return ResponseEntity.ok(analysisService.analyses(id));
    }

    private Set<String> parseTags(String tags) {
        if (tags == null || tags.isBlank()) return Set.of();
        try {
            return new LinkedHashSet<>(objectMapper.readValue(tags, new TypeReference<List<String>>() {}));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("tags must be a JSON array of strings");
        }
    }

    private static Map<String, Object> ingestBody(IngestResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("document_id", result.document().getId());
        body.put("embedded", result.embedded());
        body.put("chunks", result.chunks());
        return body;
    }
}
