package com.example.quorum.orchestrator;

/**
 * Text of the fragments synthesized when a run produces no output of its own.
 */
public final class FallbackMessages {

    private FallbackMessages() {
    }

    public static String notAvailable(String label) {
        return label + " is not available on this machine. To enable agent chat, install " + label
                + " and ensure the gateway is running.";
    }

    public static String exited(String label, int code) {
        return label + " exited with code " + code + ". The agent may be unavailable. Please try again.";
    }

    public static String streamFailed(String label) {
        return label + " stopped responding before producing output. Please try again.";
    }

    public static String timedOut(String label, long seconds) {
        return label + " did not respond within " + seconds + " seconds. Please try again.";
    }

    public static String emptyResult(String label) {
        return label + " finished without producing a response.";
    }

    public static String cancelled(String label) {
        return "[Request cancelled before " + label + " produced any output.]";
    }
}
