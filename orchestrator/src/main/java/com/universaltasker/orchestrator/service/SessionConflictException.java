package com.universaltasker.orchestrator.service;

/**
 * Thrown when a session is started while another one still occupies the
 * active slot, or when a step is requested while one is already running.
 */
public class SessionConflictException extends RuntimeException {

    public SessionConflictException(String message) {
        super(message);
    }
}
