package com.example.quorum.embedding;

/**
 * Naming of embedding ref types. A reference embedded whole uses its base
 * ("document"); a chunked one uses "document_chunk_&lt;i&gt;" per chunk.
 */
public final class EmbeddingRefTypes {

    public static final String DOCUMENT = "document";
    public static final String EVENT = "event";

    private static final String CHUNK_INFIX = "_chunk_";

    private EmbeddingRefTypes() {
    }

    public static String chunk(String base, int index) {
        return base + CHUNK_INFIX + index;
    }

    /** LIKE pattern matching every chunk ref type of {@code base}, escaped with '!'. */
    public static String chunkPattern(String base) {
        return escapeLike(base + CHUNK_INFIX) + "%";
    }

    public static String baseOf(String refType) {
        int idx = refType.indexOf(CHUNK_INFIX);
        return idx < 0 ? refType : refType.substring(0, idx);
    }

    public static boolean isChunk(String refType) {
        return refType.contains(CHUNK_INFIX);
    }

    /** Chunk index encoded in the ref type, or -1 for a base ref type. */
    public static int chunkIndex(String refType) {
        int idx = refType.indexOf(CHUNK_INFIX);
        if (idx < 0) return -1;
        return Integer.parseInt(refType.substring(idx + CHUNK_INFIX.length()));
    }

    public static void requireBase(String base) {
        if (!DOCUMENT.equals(base) && !EVENT.equals(base)) {
            throw new IllegalArgumentException("Unsupported embedding ref type '" + base
                    + "'. Must be one of: document, event");
        }
    }

    public static String escapeLike(String value) {
        return value.replace("!", "!!").replace("_", "!_").replace("%", "!%");
    }
}
