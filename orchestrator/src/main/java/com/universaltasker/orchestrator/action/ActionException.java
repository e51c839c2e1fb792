package com.universaltasker.orchestrator.action;

/**
 * Thrown when an instruction cannot be parsed or fails while it runs.
 *
 * Unchecked so the pipeline catches it in one place and records the message
 * verbatim as the step's failure detail.
 */
public class ActionException extends RuntimeException {

    public enum Kind { PARSE_ERROR, UNKNOWN_PRIMITIVE, BAD_ARGUMENT, DEVICE_ERROR }

    private final Kind kind;

    public ActionException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public ActionException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
