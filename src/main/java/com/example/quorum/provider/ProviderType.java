package com.example.quorum.provider;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The closed set of chat provider variants.
 */
public enum ProviderType {
    OPENAI("https://api.openai.com/v1"),
    ANTHROPIC("https://api.anthropic.com/v1"),
    GOOGLE("https://generativelanguage.googleapis.com/v1beta"),
    OPENROUTER("https://openrouter.ai/api/v1"),
    /** Any OpenAI-compatible server; base URL is required. */
    CUSTOM(null);

    private final String defaultBaseUrl;

    ProviderType(String defaultBaseUrl) {
        this.defaultBaseUrl = defaultBaseUrl;
    }

    public String getDefaultBaseUrl() {
        return defaultBaseUrl;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProviderType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing provider type");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown provider type '" + value + "'");
        }
    }
}
