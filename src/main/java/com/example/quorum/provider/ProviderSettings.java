package com.example.quorum.provider;

/**
 * Connection settings for one chat provider instance.
 */
public record ProviderSettings(ProviderType type, String baseUrl, String model, String apiKey,
                               double temperature, int maxTokens, int timeoutSeconds) {

    /** Explicit base URL, or the variant's default. */
    public String effectiveBaseUrl() {
        String url = baseUrl != null && !baseUrl.isBlank() ? baseUrl : type.getDefaultBaseUrl();
        if (url == null) {
            throw new IllegalArgumentException("Provider type " + type.value() + " requires a base URL");
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
