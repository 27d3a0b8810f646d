package com.example.quorum.orchestrator;

import java.io.IOException;
import java.time.Duration;

/**
 * Starts one reasoning process per request.
 */
public interface ReasoningProcessLauncher {

    /**
     * @throws IOException when the process cannot be started (binary missing, not executable)
     */
    ReasoningProcess launch(String message, String sessionId, Duration timeout) throws IOException;
}
