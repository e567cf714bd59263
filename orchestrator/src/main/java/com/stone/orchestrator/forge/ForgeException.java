package com.stone.orchestrator.forge;

/**
 * Thrown when the forge API returns an error status or cannot be reached.
 *
 * statusCode is 0 when no HTTP response was received at all.
 */
public class ForgeException extends RuntimeException {

    private final int statusCode;

    public ForgeException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ForgeException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int statusCode() { return statusCode; }

    public boolean isNotFound() { return statusCode == 404; }
}
