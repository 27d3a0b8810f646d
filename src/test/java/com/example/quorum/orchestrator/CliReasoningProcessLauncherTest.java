package com.example.quorum.orchestrator;

import com.example.quorum.config.QuorumProperties;
import com.example.quorum.domain.MemoryContext;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CliReasoningProcessLauncherTest {

    @TempDir
    Path tmp;

    @Test
    void buildsTheAgentCommandLine() {
        List<String> command = CliReasoningProcessLauncher.command("/usr/local/bin/openclaw",
                "What is overdue?", "quorum-chat-closer", Duration.ofSeconds(120));

        assertEquals(List.of("/usr/local/bin/openclaw", "agent", "--message", "What is overdue?",
                "--session-id", "quorum-chat-closer", "--timeout", "120"), command);
    }

    @Test
    void unresolvedBinaryFailsTheLaunch() {
        QuorumProperties.ReasoningConfig cfg = new QuorumProperties.ReasoningConfig();
        cfg.setBinaryPath(tmp.resolve("absent").toString());
        CliReasoningProcessLauncher launcher = new CliReasoningProcessLauncher(
                new ReasoningBinaryResolver(cfg, new ReasoningBinaryDiscovery(Map.of())));

        assertThrows(IOException.class, () -> launcher.launch("hi", "s", Duration.ofSeconds(5)));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void streamsARealChildProcess() throws IOException {
        Path script = Files.writeString(tmp.resolve("openclaw"),
                "#!/bin/sh\necho \"session $5 says: $3\"\necho \"debug line\" >&2\n");
        assertTrue(script.toFile().setExecutable(true));
        QuorumProperties properties = new QuorumProperties();
        properties.getReasoning().setBinaryPath(script.toString());
        CliReasoningProcessLauncher launcher = new CliReasoningProcessLauncher(
                new ReasoningBinaryResolver(properties.getReasoning(), new ReasoningBinaryDiscovery(Map.of())));

        ExecutorService executor = Executors.newCachedThreadPool();
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.initialize();
        List<OrchestrationOutcome> outcomes = new CopyOnWriteArrayList<>();
        try {
            ReasoningOrchestrator orchestrator = new ReasoningOrchestrator(launcher, executor, scheduler,
                    properties, new SimpleMeterRegistry());
            OrchestrationRequest request = new OrchestrationRequest("hello there", "quorum-chat-closer",
                    Duration.ofSeconds(30), MemoryContext.user(), "OpenClaw", (text, outcome) -> outcomes.add(outcome));

            StepVerifier.create(orchestrator.run(request).collect(Collectors.joining()))
                    .expectNext("session quorum-chat-closer says: hello there\n")
                    .expectComplete()
                    .verify(Duration.ofSeconds(20));
        } finally {
            executor.shutdownNow();
            scheduler.shutdown();
        }
        assertEquals(List.of(OrchestrationOutcome.COMPLETED), outcomes);
    }
}
