package com.universaltasker.orchestrator.translator;

/**
 * Thrown when the rule file cannot be parsed for rewriting, or cannot be written.
 */
public class RuleFileException extends RuntimeException {

    public RuleFileException(String message) {
        super(message);
    }

    public RuleFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
