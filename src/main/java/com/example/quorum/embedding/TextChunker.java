package com.example.quorum.embedding;

import com.example.quorum.config.QuorumProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits long text into overlapping fixed-size spans for embedding.
 * <p>
 * Deterministic: the same text and policy always give the same spans, which is
 * what lets a document's chunks be rebuilt from its content instead of stored.
 */
@Component
public class TextChunker {

    private final QuorumProperties properties;

    public TextChunker(QuorumProperties properties) {
        this.properties = properties;
    }

    /**
     * Apply the configured policy: content up to the threshold is one span,
     * longer content is split with the configured size and overlap.
     */
    public List<String> chunk(String text) {
        QuorumProperties.EmbeddingConfig.ChunkingConfig cfg = properties.getEmbedding().getChunking();
        if (text.length() <= cfg.getThreshold()) {
            return List.of(text);
        }
        return split(text, cfg.getTargetSize(), cfg.getOverlap());
    }

    /**
     * Spans {@code text[start, min(start + targetSize, len))} with {@code start}
     * advancing by {@code targetSize - overlap}, ending with the span that
     * reaches the end of the text.
     */
    public static List<String> split(String text, int targetSize, int overlap) {
        if (targetSize <= 0) {
            throw new IllegalArgumentException("targetSize must be positive, got " + targetSize);
        }
        if (overlap < 0 || overlap >= targetSize) {
            throw new IllegalArgumentException(
                    "overlap must be in [0, targetSize), got " + overlap + " for targetSize " + targetSize);
        }
        int length = text.length();
        if (length <= targetSize) {
            return List.of(text);
        }

        int step = targetSize - overlap;
        List<String> spans = new ArrayList<>((length - overlap + step - 1) / step);
        int start = 0;
        while (true) {
            int end = Math.min(start + targetSize, length);
            spans.add(text.substring(start, end));
            if (end == length) break;
            start += step;
        }
        return spans;
    }
}
