package com.example.quorum.orchestrator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;

/**
 * Runs {@code <binary> agent --message <m> --session-id <s> --timeout <seconds>}
 * as a child process.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CliReasoningProcessLauncher implements ReasoningProcessLauncher {

    private final ReasoningBinaryResolver binaryResolver;

    @Override
    public ReasoningProcess launch(String message, String sessionId, Duration timeout) throws IOException {
        String binary = binaryResolver.binary()
                .orElseThrow(() -> new IOException("Reasoning binary not found"));
        List<String> command = command(binary, message, sessionId, timeout);
        log.debug("Launching reasoning process for session {}: {} agent ...", sessionId, binary);

        Process process = new ProcessBuilder(command).start();
        // the child never reads stdin
        process.getOutputStream().close();
        return new LocalProcess(process);
    }

    static List<String> command(String binary, String message, String sessionId, Duration timeout) {
        return List.of(binary, "agent",
                "--message", message,
                "--session-id", sessionId,
                "--timeout", String.valueOf(timeout.toSeconds()));
    }

    private static final class LocalProcess implements ReasoningProcess {

        private final Process process;

        LocalProcess(Process process) {
            this.process = process;
        }

        @Override
        public InputStream output() {
            return process.getInputStream();
        }

        @Override
        public InputStream diagnostics() {
            return process.getErrorStream();
        }

        @Override
        public int waitFor() throws InterruptedException {
            return process.waitFor();
        }

        @Override
        public void terminate() {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }
    }
}
