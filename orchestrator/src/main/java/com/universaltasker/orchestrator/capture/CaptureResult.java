package com.universaltasker.orchestrator.capture;

import java.nio.file.Path;

/**
 * Outcome of one snapshot request: either the written image path or an error.
 */
public record CaptureResult(boolean success, Path path, String error) {

    public static CaptureResult ok(Path path) {
        return new CaptureResult(true, path, null);
    }

    public static CaptureResult failed(String error) {
        return new CaptureResult(false, null, error);
    }

    /** Path as stored in the audit trail, or "screenshot_failed". */
    public String pathOrMarker() {
        return success ? path.toString() : "screenshot_failed";
    }
}
