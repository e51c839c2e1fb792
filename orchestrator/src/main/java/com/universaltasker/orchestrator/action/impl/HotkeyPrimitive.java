package com.universaltasker.orchestrator.action.impl;

import com.universaltasker.orchestrator.action.*;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class HotkeyPrimitive implements ActionPrimitive {

    private static final PrimitiveManifest MANIFEST = new PrimitiveManifest(
            PrimitiveKind.HOTKEY, "hotkey(key1, key2, ...)",
            "Hold the keys down in order and release them in reverse, e.g. hotkey(command, space) or hotkey(win, r).");

    @Override public PrimitiveManifest manifest() { return MANIFEST; }

    @Override
    public void validate(List<String> args) {
        if (args.isEmpty() || args.size() > 4) {
            throw new ActionException(ActionException.Kind.BAD_ARGUMENT,
                    "hotkey takes 1 to 4 keys, got " + args.size() + "; usage: " + MANIFEST.signature());
        }
        args.forEach(HotkeyPrimitive::requireKnownKey);
    }

    @Override
    public void execute(List<String> args, InputDevice device) {
        device.hotkey(args.stream().map(k -> k.strip().toLowerCase()).toList());
    }

    static void requireKnownKey(String key) {
        if (KeyNames.resolve(key).isEmpty()) {
            throw new ActionException(ActionException.Kind.BAD_ARGUMENT, "Unknown key name: " + key);
        }
    }
}
