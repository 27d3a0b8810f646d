package com.example.quorum.provider;

/**
 * A chat provider call failed. Unchecked so it can travel through a Flux.
 */
public class ChatProviderException extends RuntimeException {

    private final int statusCode;

    public ChatProviderException(String message) {
        this(message, 0, null);
    }

    public ChatProviderException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public ChatProviderException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failed call, 0 when the call never got a response. */
    public int getStatusCode() {
        return statusCode;
    }
}
