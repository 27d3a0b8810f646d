package com.example.quorum.domain;

import java.time.Instant;

/**
 * One council conversation thread as seen in the thread list.
 */
public record ThreadSummary(String threadId, String title, Long messageCount, Instant lastActivity) {
}
