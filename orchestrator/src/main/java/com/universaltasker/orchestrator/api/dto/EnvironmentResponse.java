package com.universaltasker.orchestrator.api.dto;

/**
 * Response body for GET /environment.
 * {@code message} explains why control is unavailable; null when it is.
 */
public record EnvironmentResponse(String context, boolean controlAvailable, String message) {}
