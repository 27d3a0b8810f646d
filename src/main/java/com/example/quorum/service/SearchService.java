package com.example.quorum.service;

import com.example.quorum.domain.Document;
import com.example.quorum.domain.DocumentType;
import com.example.quorum.domain.Event;
import com.example.quorum.embedding.*;
import com.example.quorum.repository.DocumentRepository;
import com.example.quorum.repository.EventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Semantic recall over documents and events. Chunk hits are collapsed to their
 * parent reference keeping the best score. Falls back to keyword matching on
 * documents when the embedding provider is unavailable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchService {

    public static final String MODE_SEMANTIC = "semantic";
    public static final String MODE_KEYWORD = "keyword";

    private static final int MAX_LIMIT = 100;
    private static final int SNIPPET_LENGTH = 300;
    /** Extra candidates per requested hit, since several chunks may collapse into one document. */
    private static final int CHUNK_OVERSAMPLE = 4;

    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final TextChunker chunker;
    private final DocumentRepository documentRepository;
    private final EventRepository eventRepository;

    public SearchResponse search(SearchQuery query) {
        if (query.text() == null || query.text().isBlank()) {
            throw new IllegalArgumentException("Search query text is required");
        }
        int limit = Math.max(1, Math.min(query.limit(), MAX_LIMIT));

        float[] vector;
        try {
            vector = embeddingService.embed(query.text());
        } catch (EmbeddingProviderException e) {
            log.warn("Semantic search unavailable, falling back to keyword search: {}", e.getMessage());
            return keywordSearch(query, limit);
        }

        List<VectorStore.ScoredResult> candidates = new ArrayList<>();
        for (String base : query.types()) {
            SearchFilter filter = new SearchFilter(Set.of(base), query.includeChunks(), allowedIds(base, query),
                    query.minScore());
            int topK = query.includeChunks() ? limit * CHUNK_OVERSAMPLE : limit;
            candidates.addAll(vectorStore.search(vector, filter, topK));
        }

        Map<String, VectorStore.ScoredResult> best = new LinkedHashMap<>();
        candidates.stream()
                .sorted(Comparator.comparingDouble(VectorStore.ScoredResult::score).reversed())
                .forEach(r -> best.putIfAbsent(r.base() + ":" + r.refId(), r));

        List<VectorStore.ScoredResult> top = best.values().stream().limit(limit).toList();
        return new SearchResponse(MODE_SEMANTIC, toHits(top));
    }

    /**
     * Documents most similar to {@code text}, one hit per document.
     */
    public SearchResponse searchDocuments(String text, DocumentType docType, String tag, Instant since, int limit) {
        return search(new SearchQuery(text, Set.of(EmbeddingRefTypes.DOCUMENT), docType, tag, null, since,
                limit, 0.0, true));
    }

    // ── Internal ──

    /** Ids allowed by the predicates that apply to {@code base}, or null when none apply. */
    private Set<String> allowedIds(String base, SearchQuery query) {
        if (EmbeddingRefTypes.DOCUMENT.equals(base)
                && (query.docType() != null || query.tag() != null || query.since() != null)) {
            return new HashSet<>(documentRepository.findIdsFiltered(query.docType(), query.tag(), query.since()));
        }
        if (EmbeddingRefTypes.EVENT.equals(base) && (query.eventType() != null || query.since() != null)) {
            return new HashSet<>(eventRepository.findIdsFiltered(query.eventType(), query.since()));
        }
        return null;
    }

    private List<SearchHit> toHits(List<VectorStore.ScoredResult> results) {
        Set<String> docIds = results.stream().filter(r -> r.base().equals(EmbeddingRefTypes.DOCUMENT))
                .map(VectorStore.ScoredResult::refId).collect(Collectors.toSet());
        Set<String> eventIds = results.stream().filter(r -> r.base().equals(EmbeddingRefTypes.EVENT))
                .map(VectorStore.ScoredResult::refId).collect(Collectors.toSet());

        Map<String, Document> documents = documentRepository.findAllById(docIds).stream()
                .collect(Collectors.toMap(Document::getId, Function.identity()));
        Map<String, Event> events = eventRepository.findAllById(eventIds).stream()
                .collect(Collectors.toMap(Event::getId, Function.identity()));

        List<SearchHit> hits = new ArrayList<>(results.size());
        for (VectorStore.ScoredResult r : results) {
            Integer chunkIndex = r.chunkIndex() >= 0 ? r.chunkIndex() : null;
            if (r.base().equals(EmbeddingRefTypes.DOCUMENT)) {
                Document doc = documents.get(r.refId());
                if (doc == null) continue;
                hits.add(new SearchHit(EmbeddingRefTypes.DOCUMENT, doc.getId(), r.score(), doc.getTitle(),
                        documentSnippet(doc, r.chunkIndex()), chunkIndex, doc.getCreatedAt()));
            } else {
                Event event = events.get(r.refId());
                if (event == null) continue;
                hits.add(new SearchHit(EmbeddingRefTypes.EVENT, event.getId(), r.score(), event.getTitle(),
                        snippet(event.getDescription()), chunkIndex, event.getCreatedAt()));
            }
        }
        return hits;
    }

    private String documentSnippet(Document doc, int chunkIndex) {
        if (chunkIndex < 0) return snippet(doc.getContent());
        List<String> chunks = chunker.chunk(doc.getContent());
        return chunkIndex < chunks.size() ? snippet(chunks.get(chunkIndex)) : snippet(doc.getContent());
    }

    private SearchResponse keywordSearch(SearchQuery query, int limit) {
        if (!query.types().contains(EmbeddingRefTypes.DOCUMENT)) {
            return new SearchResponse(MODE_KEYWORD, List.of());
        }
        List<SearchHit> hits = documentRepository.searchKeyword(EmbeddingRefTypes.escapeLike(query.text().trim()), PageRequest.of(0, MAX_LIMIT))
                .stream()
                .filter(d -> query.docType() == null || d.getDocType() == query.docType())
                .filter(d -> query.tag() == null || d.getTags().contains(query.tag()))
                .filter(d -> query.since() == null || !d.getCreatedAt().isBefore(query.since()))
                .limit(limit)
                .map(d -> new SearchHit(EmbeddingRefTypes.DOCUMENT, d.getId(), 0.0, d.getTitle(),
                        snippet(d.getContent()), null, d.getCreatedAt()))
                .toList();
        return new SearchResponse(MODE_KEYWORD, hits);
    }

    private static String snippet(String text) {
        if (text == null) return null;
        return text.length() <= SNIPPET_LENGTH ? text : text.substring(0, SNIPPET_LENGTH) + "...";
    }

    /**
     * @param types         reference-type bases to search ("document", "event")
     * @param includeChunks match chunk rows of long content
     */
    public record SearchQuery(String text, Set<String> types, DocumentType docType, String tag,
                              String eventType, Instant since, int limit, double minScore, boolean includeChunks) {

        public SearchQuery {
            types = types == null || types.isEmpty() ? Set.of(EmbeddingRefTypes.DOCUMENT) : Set.copyOf(types);
            types.forEach(EmbeddingRefTypes::requireBase);
        }
    }

    public record SearchHit(String refType, String refId, double score, String title, String snippet,
                            Integer chunkIndex, Instant createdAt) {
    }

    public record SearchResponse(String mode, List<SearchHit> results) {
    }
}
