package com.universaltasker.orchestrator.action;

import java.awt.event.KeyEvent;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Maps key names used in instructions to AWT key codes, and characters to the
 * key strokes that produce them on a US layout.
 */
public final class KeyNames {

    /** A key code plus whether shift must be held. */
    public record Stroke(int keyCode, boolean shift) {}

    private static final Map<String, Integer> NAMED = Map.ofEntries(
            Map.entry("enter",     KeyEvent.VK_ENTER),
            Map.entry("return",    KeyEvent.VK_ENTER),
            Map.entry("tab",       KeyEvent.VK_TAB),
            Map.entry("space",     KeyEvent.VK_SPACE),
            Map.entry("esc",       KeyEvent.VK_ESCAPE),
            Map.entry("escape",    KeyEvent.VK_ESCAPE),
            Map.entry("backspace", KeyEvent.VK_BACK_SPACE),
            Map.entry("delete",    KeyEvent.VK_DELETE),
            Map.entry("home",      KeyEvent.VK_HOME),
            Map.entry("end",       KeyEvent.VK_END),
            Map.entry("pageup",    KeyEvent.VK_PAGE_UP),
            Map.entry("pagedown",  KeyEvent.VK_PAGE_DOWN),
            Map.entry("up",        KeyEvent.VK_UP),
            Map.entry("down",      KeyEvent.VK_DOWN),
            Map.entry("left",      KeyEvent.VK_LEFT),
            Map.entry("right",     KeyEvent.VK_RIGHT),
            Map.entry("shift",     KeyEvent.VK_SHIFT),
            Map.entry("ctrl",      KeyEvent.VK_CONTROL),
            Map.entry("control",   KeyEvent.VK_CONTROL),
            Map.entry("alt",       KeyEvent.VK_ALT),
            Map.entry("option",    KeyEvent.VK_ALT),
            Map.entry("command",   KeyEvent.VK_META),
            Map.entry("cmd",       KeyEvent.VK_META),
            Map.entry("meta",      KeyEvent.VK_META),
            Map.entry("win",       KeyEvent.VK_WINDOWS),
            Map.entry("super",     KeyEvent.VK_WINDOWS)
    );

    private static final String SHIFTED    = "~!@#$%^&*()_+{}|:\"<>?";
    private static final String UNSHIFTED  = "`1234567890-=[]\\;',./";

    private KeyNames() {}

    public static OptionalInt resolve(String name) {
        if (name == null) return OptionalInt.empty();
        String key = name.strip().toLowerCase();
        Integer named = NAMED.get(key);
        if (named != null) return OptionalInt.of(named);
        if (key.length() == 1) {
            char ch = key.charAt(0);
            if (Character.isLetterOrDigit(ch) && ch < 128) {
                return OptionalInt.of(KeyEvent.getExtendedKeyCodeForChar(ch));
            }
        }
        if (key.matches("f([1-9]|1[0-2])")) {
            return OptionalInt.of(KeyEvent.VK_F1 + Integer.parseInt(key.substring(1)) - 1);
        }
        return OptionalInt.empty();
    }

    /** The stroke that types {@code ch}, or empty when it needs a paste. */
    public static Optional<Stroke> strokeFor(char ch) {
        if (ch >= 'a' && ch <= 'z') return Optional.of(new Stroke(KeyEvent.getExtendedKeyCodeForChar(ch), false));
        if (ch >= 'A' && ch <= 'Z') return Optional.of(new Stroke(KeyEvent.getExtendedKeyCodeForChar(Character.toLowerCase(ch)), true));
        if (ch >= '0' && ch <= '9') return Optional.of(new Stroke(KeyEvent.getExtendedKeyCodeForChar(ch), false));
        if (ch == ' ')  return Optional.of(new Stroke(KeyEvent.VK_SPACE, false));
        if (ch == '\n') return Optional.of(new Stroke(KeyEvent.VK_ENTER, false));
        if (ch == '\t') return Optional.of(new Stroke(KeyEvent.VK_TAB, false));
        int shifted = SHIFTED.indexOf(ch);
        if (shifted >= 0) {
            return Optional.of(new Stroke(KeyEvent.getExtendedKeyCodeForChar(UNSHIFTED.charAt(shifted)), true));
        }
        if (UNSHIFTED.indexOf(ch) >= 0) {
            return Optional.of(new Stroke(KeyEvent.getExtendedKeyCodeForChar(ch), false));
        }
        return Optional.empty();
    }
}
