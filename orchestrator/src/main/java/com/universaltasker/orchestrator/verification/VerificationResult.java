package com.universaltasker.orchestrator.verification;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A verifier's yes/no judgment with its reason.
 * "Unknown" is never represented here: callers get Optional.empty() instead.
 */
public record VerificationResult(boolean achieved, String reason) {

    public static final String DEFAULT_REASON = "No reason given.";

    /**
     * {@code achieved} counts as true for boolean true, the strings "true"/"yes",
     * or the number 1. Anything else is false.
     */
    public static VerificationResult fromReply(JsonNode reply) {
        JsonNode achieved = reply.get("achieved");
        boolean yes = achieved != null && (
                (achieved.isBoolean() && achieved.booleanValue())
                || (achieved.isTextual() && ("true".equals(achieved.textValue()) || "yes".equals(achieved.textValue())))
                || (achieved.isNumber() && achieved.doubleValue() == 1.0));

        JsonNode reasonNode = reply.get("reason");
        String reason = reasonNode == null || reasonNode.isNull() ? "" : reasonNode.asText().strip();
        return new VerificationResult(yes, reason.isEmpty() ? DEFAULT_REASON : reason);
    }
}
