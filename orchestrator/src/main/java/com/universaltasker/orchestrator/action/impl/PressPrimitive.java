package com.universaltasker.orchestrator.action.impl;

import com.universaltasker.orchestrator.action.*;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class PressPrimitive implements ActionPrimitive {

    private static final PrimitiveManifest MANIFEST = new PrimitiveManifest(
            PrimitiveKind.PRESS, "press(key)",
            "Press and release one key, e.g. enter, tab, esc, backspace, up, f5, a.");

    @Override public PrimitiveManifest manifest() { return MANIFEST; }

    @Override
    public void validate(List<String> args) {
        ActionPrimitive.requireArity(args, MANIFEST, 1);
        HotkeyPrimitive.requireKnownKey(args.get(0));
    }

    @Override
    public void execute(List<String> args, InputDevice device) {
        device.press(args.get(0).strip().toLowerCase());
    }
}
