package com.example.quorum.embedding;

import java.util.Set;

/**
 * Narrows a vector search.
 *
 * @param bases         reference-type bases to include ("document", "event")
 * @param includeChunks whether chunk rows ("document_chunk_3") count as hits
 * @param allowedRefIds when non-null, only these reference ids may match
 * @param minScore      cosine similarity floor
 */
public record SearchFilter(Set<String> bases, boolean includeChunks, Set<String> allowedRefIds, double minScore) {

    public SearchFilter {
        if (bases == null || bases.isEmpty()) {
            throw new IllegalArgumentException("SearchFilter needs at least one reference type");
        }
        bases = Set.copyOf(bases);
        allowedRefIds = allowedRefIds == null ? null : Set.copyOf(allowedRefIds);
    }

    public static SearchFilter documents() {
        return new SearchFilter(Set.of(EmbeddingRefTypes.DOCUMENT), true, null, 0.0);
    }

    public static SearchFilter of(String... bases) {
        return new SearchFilter(Set.of(bases), true, null, 0.0);
    }

    public SearchFilter withAllowedRefIds(Set<String> refIds) {
        return new SearchFilter(bases, includeChunks, refIds, minScore);
    }

    public SearchFilter withMinScore(double score) {
        return new SearchFilter(bases, includeChunks, allowedRefIds, score);
    }

    public SearchFilter withoutChunks() {
        return new SearchFilter(bases, false, allowedRefIds, minScore);
    }

    boolean accepts(String refType, String refId) {
        if (!includeChunks && EmbeddingRefTypes.isChunk(refType)) return false;
        if (!bases.contains(EmbeddingRefTypes.baseOf(refType))) return false;
        return allowedRefIds == null || allowedRefIds.contains(refId);
    }
}
