package com.universaltasker.orchestrator.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.AWTError;
import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.awt.Robot;
import java.awt.Toolkit;
import java.awt.datatransfer.StringSelection;
import java.awt.event.InputEvent;
import java.awt.event.KeyEvent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * {@link InputDevice} backed by {@link java.awt.Robot}.
 *
 * The Robot is created on first use so the service still starts on a headless
 * host; any action attempted there fails with DEVICE_ERROR.
 */
@Component
public class RobotInputDevice implements InputDevice {

    private static final Logger log = LoggerFactory.getLogger(RobotInputDevice.class);

    private static final int KEY_DELAY_MS = 20;

    private Robot robot;

    @Override
    public void moveTo(int x, int y) {
        robot().mouseMove(x, y);
    }

    @Override
    public void click(Button button) {
        int mask = switch (button) {
            case LEFT   -> InputEvent.BUTTON1_DOWN_MASK;
            case MIDDLE -> InputEvent.BUTTON2_DOWN_MASK;
            case RIGHT  -> InputEvent.BUTTON3_DOWN_MASK;
        };
        Robot r = robot();
        r.mousePress(mask);
        r.mouseRelease(mask);
    }

    @Override
    public void typeText(String text) {
        List<KeyNames.Stroke> strokes = new ArrayList<>();
        for (char ch : text.toCharArray()) {
            Optional<KeyNames.Stroke> stroke = KeyNames.strokeFor(ch);
            if (stroke.isEmpty()) {
                paste(text);
                return;
            }
            strokes.add(stroke.get());
        }
        Robot r = robot();
        KeySink keys = sink(r);
        for (KeyNames.Stroke s : strokes) {
            int[] codes = s.shift() ? new int[]{KeyEvent.VK_SHIFT, s.keyCode()} : new int[]{s.keyCode()};
            chord(codes, keys, () -> {});
            r.delay(KEY_DELAY_MS);
        }
    }

    @Override
    public void press(String key) {
        chord(new int[]{keyCode(key)}, sink(robot()), () -> {});
    }

    @Override
    public void hotkey(List<String> keys) {
        int[] codes = keys.stream().mapToInt(this::keyCode).toArray();
        Robot r = robot();
        chord(codes, sink(r), () -> r.delay(KEY_DELAY_MS));
    }

    @Override
    public void pause(long millis) {
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActionException(ActionException.Kind.DEVICE_ERROR, "Interrupted while waiting", e);
        }
    }

    @Override
    public Optional<String> checkControl() {
        try {
            robot();
            return Optional.empty();
        } catch (ActionException e) {
            return Optional.of(e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Key-level press and release, a {@link Robot} outside tests. */
    interface KeySink {
        void press(int keyCode);
        void release(int keyCode);
    }

    /**
     * Press the keys in order, then release them in reverse. Keys already down
     * are released even when a later press is rejected, e.g. a key code the
     * platform does not support.
     */
    static void chord(int[] codes, KeySink keys, Runnable afterPress) {
        Deque<Integer> held = new ArrayDeque<>();
        try {
            for (int code : codes) {
                keys.press(code);
                held.push(code);
                afterPress.run();
            }
        } finally {
            while (!held.isEmpty()) {
                keys.release(held.pop());
            }
        }
    }

    private static KeySink sink(Robot r) {
        return new KeySink() {
            @Override public void press(int keyCode)   { r.keyPress(keyCode); }
            @Override public void release(int keyCode) { r.keyRelease(keyCode); }
        };
    }

    private synchronized Robot robot() {
        if (robot != null) return robot;
        if (GraphicsEnvironment.isHeadless()) {
            throw new ActionException(ActionException.Kind.DEVICE_ERROR,
                    "No display available (headless JVM); input control is disabled.");
        }
        try {
            robot = new Robot();
            robot.setAutoWaitForIdle(true);
            log.info("Input device ready");
            return robot;
        } catch (AWTException | AWTError | SecurityException e) {
            throw new ActionException(ActionException.Kind.DEVICE_ERROR,
                    "Cannot control the display: " + e.getMessage()
                    + ". On macOS grant Accessibility and Input Monitoring permission to this process.", e);
        }
    }

    private int keyCode(String key) {
        return KeyNames.resolve(key).orElseThrow(() ->
                new ActionException(ActionException.Kind.BAD_ARGUMENT, "Unknown key name: " + key));
    }

    /** Types text the Robot has no key for by pasting it from the clipboard. */
    private void paste(String text) {
        try {
            Toolkit.getDefaultToolkit().getSystemClipboard()
                    .setContents(new StringSelection(text), null);
        } catch (IllegalStateException e) {
            throw new ActionException(ActionException.Kind.DEVICE_ERROR, "Clipboard unavailable: " + e.getMessage(), e);
        }
        boolean mac = System.getProperty("os.name", "").toLowerCase().contains("mac");
        hotkey(List.of(mac ? "command" : "ctrl", "v"));
    }
}
