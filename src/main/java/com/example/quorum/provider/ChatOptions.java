package com.example.quorum.provider;

/**
 * Per-call sampling options. Null fields fall back to the provider's configured
 * defaults.
 */
public record ChatOptions(Double temperature, Integer maxTokens, Double topP) {

    public static ChatOptions defaults() {
        return new ChatOptions(null, null, null);
    }

    public static ChatOptions maxTokens(int maxTokens) {
        return new ChatOptions(null, maxTokens, null);
    }

    double temperatureOr(double fallback) {
        return temperature != null ? temperature : fallback;
    }

    int maxTokensOr(int fallback) {
        return maxTokens != null ? maxTokens : fallback;
    }
}
