package com.example.quorum.embedding;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Vector helpers: CSV storage form, JSON parsing and cosine similarity.
 */
public final class EmbeddingVectors {

    private EmbeddingVectors() {
    }

    public static String serialize(float[] vector) {
        StringBuilder sb = new StringBuilder(vector.length * 10);
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(vector[i]);
        }
        return sb.toString();
    }

    public static float[] parse(String csv) {
        if (csv == null || csv.isBlank()) return null;
        String[] parts = csv.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            vector[i] = Float.parseFloat(parts[i].trim());
        }
        return vector;
    }

    static float[] fromJson(JsonNode array, String providerName) throws EmbeddingProviderException {
        if (array == null || !array.isArray() || array.isEmpty()) {
            throw new EmbeddingProviderException(providerName + " response has no embedding array");
        }
        float[] vector = new float[array.size()];
        for (int i = 0; i < array.size(); i++) {
            vector[i] = (float) array.get(i).asDouble();
        }
        return vector;
    }

    /**
     * Cosine similarity between two vectors.  Returns a value in [-1, 1].
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) return 0.0;
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        double denom = Math.sqrt(normA) * Math.sqrt(normB);
        return denom == 0 ? 0.0 : dot / denom;
    }
}
