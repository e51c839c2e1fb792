package com.universaltasker.orchestrator.capture;

import java.nio.file.Path;

/**
 * Capture collaborator: writes an image of the current screen to a file.
 * Implementations never throw; failures come back as {@link CaptureResult#failed}.
 */
public interface ScreenCapture {

    CaptureResult capture(Path target);
}
