package com.example.quorum.scheduling;

/**
 * Something an agent run wants a human to see.
 */
public record AgentNotification(String title, String message) {
}
