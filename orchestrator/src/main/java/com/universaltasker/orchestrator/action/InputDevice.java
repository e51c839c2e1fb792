package com.universaltasker.orchestrator.action;

import java.util.List;
import java.util.Optional;

/**
 * Low-level mouse and keyboard control. Primitives only ever talk to this
 * interface, so tests can swap in a recording fake.
 */
public interface InputDevice {

    enum Button { LEFT, RIGHT, MIDDLE }

    void moveTo(int x, int y);

    void click(Button button);

    void typeText(String text);

    void press(String key);

    void hotkey(List<String> keys);

    void pause(long millis);

    /**
     * Whether the device can actually drive the display.
     *
     * @return empty when usable, otherwise a human-readable reason
     */
    Optional<String> checkControl();
}
