package com.universaltasker.orchestrator.action.impl;

import com.universaltasker.orchestrator.action.*;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TypePrimitive implements ActionPrimitive {

    private static final PrimitiveManifest MANIFEST = new PrimitiveManifest(
            PrimitiveKind.TYPE, "type(\"text\")",
            "Type the quoted text at the keyboard focus.");

    @Override public PrimitiveManifest manifest() { return MANIFEST; }

    @Override
    public void validate(List<String> args) {
        ActionPrimitive.requireArity(args, MANIFEST, 1);
    }

    @Override
    public void execute(List<String> args, InputDevice device) {
        device.typeText(args.get(0));
    }
}
