package com.example.quorum.provider;

public record ChatResult(String content, int promptTokens, int completionTokens) {
}
