package com.universaltasker.orchestrator.capture;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Names and takes the snapshots of a session:
 * {@code <data-dir>/screenshots/<session>/step_<n>_<phase>.png}.
 */
@Component
public class SnapshotStore {

    public enum Phase { BEFORE, AFTER, VALIDATION }

    private final ScreenCapture capture;
    private final Path          root;

    public SnapshotStore(ScreenCapture capture,
                         @Value("${tasker.data-dir:data}") String dataDir) {
        this.capture = capture;
        this.root    = Path.of(dataDir, "screenshots");
    }

    public Path pathFor(UUID sessionId, int step, Phase phase) {
        return root.resolve(sessionId.toString())
                   .resolve("step_" + step + "_" + phase.name().toLowerCase() + ".png");
    }

    public CaptureResult take(UUID sessionId, int step, Phase phase) {
        return capture.capture(pathFor(sessionId, step, phase));
    }
}
