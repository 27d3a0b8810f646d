package com.example.quorum.orchestrator;

import java.io.InputStream;

/**
 * A running reasoning process: stdout carries the answer, stderr diagnostics.
 */
public interface ReasoningProcess {

    InputStream output();

    InputStream diagnostics();

    /** Block until the process exits and return its exit status. */
    int waitFor() throws InterruptedException;

    /** Forcibly stop the process and everything it spawned. Safe to call more than once. */
    void terminate();

    boolean isAlive();
}
