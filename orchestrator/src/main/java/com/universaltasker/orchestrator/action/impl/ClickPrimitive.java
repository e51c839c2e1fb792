package com.universaltasker.orchestrator.action.impl;

import com.universaltasker.orchestrator.action.*;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Clicks at the current pointer position, or moves first when coordinates are given.
 */
@Component
public class ClickPrimitive implements ActionPrimitive {

    private static final PrimitiveManifest MANIFEST = new PrimitiveManifest(
            PrimitiveKind.CLICK, "click() | click(x, y) | click(x, y, \"right\")",
            "Click a mouse button, optionally after moving to (x, y). Button is left, right or middle.");

    @Override public PrimitiveManifest manifest() { return MANIFEST; }

    @Override
    public void validate(List<String> args) {
        ActionPrimitive.requireArity(args, MANIFEST, 0, 2, 3);
        if (args.size() >= 2) {
            ActionPrimitive.parseInt(args, 0, "x");
            ActionPrimitive.parseInt(args, 1, "y");
        }
        if (args.size() == 3) button(args.get(2));
    }

    @Override
    public void execute(List<String> args, InputDevice device) {
        if (args.size() >= 2) {
            device.moveTo(ActionPrimitive.parseInt(args, 0, "x"), ActionPrimitive.parseInt(args, 1, "y"));
        }
        device.click(args.size() == 3 ? button(args.get(2)) : InputDevice.Button.LEFT);
    }

    private static InputDevice.Button button(String raw) {
        try {
            return InputDevice.Button.valueOf(raw.strip().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ActionException(ActionException.Kind.BAD_ARGUMENT,
                    "Unknown mouse button '" + raw + "' (expected left, right or middle)");
        }
    }
}
