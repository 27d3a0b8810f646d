package com.example.quorum.memory;

import com.example.quorum.domain.Document;
import com.example.quorum.domain.DocumentType;
import com.example.quorum.domain.EmbeddingRecord;
import com.example.quorum.domain.MemoryContext;
import com.example.quorum.embedding.EmbeddingRefTypes;
import com.example.quorum.embedding.EmbeddingService;
import com.example.quorum.embedding.TextChunker;
import com.example.quorum.repository.DocumentRepository;
import com.example.quorum.repository.EmbeddingRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * Document writes and reads. Every write commits before embedding starts, so a
 * provider outage never loses the document itself.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentService {

    private final DocumentRepository documentRepository;
    private final EmbeddingRecordRepository embeddingRepository;
    private final EmbeddingService embeddingService;
    private final TextChunker chunker;
    private final MetadataJson metadataJson;

    public IngestResult create(MemoryContext ctx, NewDocument request) {
        if (request.title() == null || request.title().isBlank()) {
            throw new IllegalArgumentException("Document title is required");
        }
        if (request.content() == null || request.content().isBlank()) {
            throw new IllegalArgumentException("Document content is required");
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (request.metadata() != null) metadata.putAll(request.metadata());
        metadata.putIfAbsent("source", ctx.actor());

        Document saved = documentRepository.save(Document.builder()
                .docType(request.docType() != null ? request.docType() : DocumentType.NOTE)
                .title(request.title().trim())
                .content(request.content())
                .tags(request.tags() != null ? new LinkedHashSet<>(request.tags()) : new LinkedHashSet<>())
                .metadata(metadataJson.write(metadata))
                .build());
        log.info("Document {} '{}' stored by {} ({} chars)", saved.getId(), saved.getTitle(), ctx.actor(),
                saved.getContent().length());
        return embed(saved);
    }

    public Document get(String id) {
        return documentRepository.findById(id).orElseThrow(() -> NotFound.of("Document", id));
    }

    public List<Document> list(DocumentType docType, String tag, Instant since, int limit) {
        return documentRepository.findFiltered(docType, blankToNull(tag), since, PageRequest.of(0, clampLimit(limit)));
    }

    /**
     * Replace a document's content and re-embed it. The only way content
     * changes after creation.
     */
    public IngestResult replaceContent(MemoryContext ctx, String id, String content) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Document content is required");
        }
        Document document = get(id);
        document.setContent(content);
        Document saved = documentRepository.save(document);
        log.info("Document {} content replaced by {}", id, ctx.actor());
        return embed(saved);
    }

    public IngestResult reembed(MemoryContext ctx, String id) {
        Document document = get(id);
        log.info("Re-embedding document {} requested by {}", id, ctx.actor());
        return embed(document);
    }

    public void delete(MemoryContext ctx, String id) {
        Document document = get(id);
        embeddingService.removeFamily(id, EmbeddingRefTypes.DOCUMENT);
        documentRepository.delete(document);
        log.info("Document {} deleted by {}", id, ctx.actor());
    }

    public EmbeddingStatus embeddingStatus(String id) {
        get(id);
        List<EmbeddingRecord> rows = embeddingRepository.findFamily(id, EmbeddingRefTypes.DOCUMENT,
                EmbeddingRefTypes.chunkPattern(EmbeddingRefTypes.DOCUMENT));
        boolean chunked = rows.stream().anyMatch(r -> EmbeddingRefTypes.isChunk(r.getRefType()));
        return new EmbeddingStatus(!rows.isEmpty(), rows.size(), chunked);
    }

    /** The document's chunks, rebuilt from its content. */
    public List<String> chunks(String id) {
        return chunker.chunk(get(id).getContent());
    }

    public Map<String, Object> metadata(Document document) {
        return metadataJson.read(document.getMetadata());
    }

    private IngestResult embed(Document document) {
        boolean embedded = embeddingService.embedAndStore(document.getId(), EmbeddingRefTypes.DOCUMENT,
                document.getContent());
        if (!embedded) {
            log.warn("Document {} stored without embeddings", document.getId());
        }
        return new IngestResult(document, embedded, chunker.chunk(document.getContent()).size());
    }

    static int clampLimit(int limit) {
        return limit <= 0 ? 50 : Math.min(limit, 500);
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public record NewDocument(DocumentType docType, String title, String content, Set<String> tags,
                              Map<String, Object> metadata) {
    }

    /**
     * @param embedded false when the provider failed; the document is stored regardless
     */
    public record IngestResult(Document document, boolean embedded, int chunks) {
    }

    public record EmbeddingStatus(boolean embedded, int rows, boolean chunked) {
    }
}
