package com.universaltasker.orchestrator.action.impl;

import com.universaltasker.orchestrator.action.*;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class MovePrimitive implements ActionPrimitive {

    private static final PrimitiveManifest MANIFEST = new PrimitiveManifest(
            PrimitiveKind.MOVE, "move(x, y)",
            "Move the mouse pointer to screen coordinates (x, y) in pixels.");

    @Override public PrimitiveManifest manifest() { return MANIFEST; }

    @Override
    public void validate(List<String> args) {
        ActionPrimitive.requireArity(args, MANIFEST, 2);
        int x = ActionPrimitive.parseInt(args, 0, "x");
        int y = ActionPrimitive.parseInt(args, 1, "y");
        if (x < 0 || y < 0) {
            throw new ActionException(ActionException.Kind.BAD_ARGUMENT,
                    "Coordinates must not be negative: (" + x + ", " + y + ")");
        }
    }

    @Override
    public void execute(List<String> args, InputDevice device) {
        device.moveTo(ActionPrimitive.parseInt(args, 0, "x"), ActionPrimitive.parseInt(args, 1, "y"));
    }
}
