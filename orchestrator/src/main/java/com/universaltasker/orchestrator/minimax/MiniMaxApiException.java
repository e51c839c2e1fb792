package com.universaltasker.orchestrator.minimax;

/**
 * The engine answered with an HTTP error or a non-zero {@code base_resp} code.
 */
public class MiniMaxApiException extends RuntimeException {

    private final int statusCode;

    public MiniMaxApiException(int statusCode, String body) {
        super("MiniMax API error %d: %s".formatted(statusCode, body));
        this.statusCode = statusCode;
    }

    public int statusCode() { return statusCode; }
}
