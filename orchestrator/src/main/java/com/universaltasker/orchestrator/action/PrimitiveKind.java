package com.universaltasker.orchestrator.action;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of environment-control primitives an instruction may use.
 */
public enum PrimitiveKind {
    MOVE("move"),
    CLICK("click"),
    TYPE("type"),
    PRESS("press"),
    HOTKEY("hotkey"),
    WAIT("wait");

    private final String keyword;

    PrimitiveKind(String keyword) {
        this.keyword = keyword;
    }

    /** Name used in instruction text, e.g. {@code hotkey}. */
    public String keyword() {
        return keyword;
    }

    public static Optional<PrimitiveKind> byKeyword(String name) {
        if (name == null) return Optional.empty();
        String wanted = name.strip().toLowerCase();
        return Arrays.stream(values()).filter(k -> k.keyword.equals(wanted)).findFirst();
    }
}
