package com.example.quorum;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Quorum - persistent memory and conscience layer for scheduled LLM agents.
 *
 * Architecture:
 * - Memory Store → documents, events, tasks, observations, agent runs (JPA)
 * - Ingestion Pipeline → chunking, embedding, content-hash dedup
 * - Retrieval Index → in-memory cosine search over persisted embeddings
 * - Process Orchestrator → streams a reasoning subprocess to the caller and
 *   persists exactly one transcript per request
 * - Scheduler Policy → observe/act/reflect tiers, quiet hours, notification gate
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
public class QuorumApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuorumApplication.class, args);
    }
}
