package com.universaltasker.orchestrator.action.impl;

import com.universaltasker.orchestrator.action.*;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class WaitPrimitive implements ActionPrimitive {

    static final int MAX_WAIT_MS = 10_000;

    private static final PrimitiveManifest MANIFEST = new PrimitiveManifest(
            PrimitiveKind.WAIT, "wait(ms)",
            "Pause for ms milliseconds (0 to 10000) so the UI can catch up.");

    @Override public PrimitiveManifest manifest() { return MANIFEST; }

    @Override
    public void validate(List<String> args) {
        ActionPrimitive.requireArity(args, MANIFEST, 1);
        int ms = ActionPrimitive.parseInt(args, 0, "ms");
        if (ms < 0 || ms > MAX_WAIT_MS) {
            throw new ActionException(ActionException.Kind.BAD_ARGUMENT,
                    "wait must be between 0 and " + MAX_WAIT_MS + " ms, got " + ms);
        }
    }

    @Override
    public void execute(List<String> args, InputDevice device) {
        device.pause(ActionPrimitive.parseInt(args, 0, "ms"));
    }
}
