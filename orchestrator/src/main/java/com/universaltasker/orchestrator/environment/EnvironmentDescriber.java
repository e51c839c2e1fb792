package com.universaltasker.orchestrator.environment;

import org.springframework.stereotype.Component;

import java.awt.AWTError;
import java.awt.Dimension;
import java.awt.GraphicsEnvironment;
import java.awt.MouseInfo;
import java.awt.Point;
import java.awt.PointerInfo;
import java.awt.Toolkit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the one-line execution context passed to the reasoning engine and the
 * verifier, e.g.
 * {@code "macOS 14.2.1; aarch64; Browser: Firefox; Screen: 1920x1080 (width x height in pixels); Cursor: (10, 20)"}.
 */
@Component
public class EnvironmentDescriber {

    /** Display facts; absent when headless or not queryable. */
    public interface Display {
        Optional<Dimension> screenSize();
        Optional<Point>     cursor();
    }

    private final Display display;
    private final String  osName;
    private final String  osVersion;
    private final String  arch;

    public EnvironmentDescriber() {
        this(new AwtDisplay(),
             System.getProperty("os.name", ""),
             System.getProperty("os.version", ""),
             System.getProperty("os.arch", ""));
    }

    public EnvironmentDescriber(Display display, String osName, String osVersion, String arch) {
        this.display   = display;
        this.osName    = osName;
        this.osVersion = osVersion;
        this.arch      = arch;
    }

    public String describe(String browserHint) {
        List<String> parts = new ArrayList<>();
        parts.add(osPart());
        if (arch != null && !arch.isBlank()) parts.add(arch);
        String browser = browserHint == null || browserHint.isBlank() ? "unknown" : browserHint.strip();
        parts.add("Browser: " + browser);
        display.screenSize()
                .filter(d -> d.width > 0 && d.height > 0)
                .ifPresent(d -> parts.add("Screen: " + d.width + "x" + d.height + " (width x height in pixels)"));
        display.cursor()
                .ifPresent(p -> parts.add("Cursor: (" + p.x + ", " + p.y + ")"));
        return String.join("; ", parts);
    }

    /** True when the context names macOS or Darwin. */
    public static boolean isMacOs(String context) {
        String c = context == null ? "" : context.toLowerCase();
        return c.contains("macos") || c.contains("darwin");
    }

    private String osPart() {
        String name = osName == null ? "" : osName.strip();
        String lower = name.toLowerCase();
        if (lower.startsWith("mac") || lower.contains("darwin")) {
            return osVersion == null || osVersion.isBlank() ? "macOS" : "macOS " + osVersion.strip();
        }
        return (name + " " + (osVersion == null ? "" : osVersion.strip())).strip();
    }

    static final class AwtDisplay implements Display {

        @Override
        public Optional<Dimension> screenSize() {
            if (GraphicsEnvironment.isHeadless()) return Optional.empty();
            try {
                return Optional.of(Toolkit.getDefaultToolkit().getScreenSize());
            } catch (RuntimeException | AWTError e) {
                return Optional.empty();
            }
        }

        @Override
        public Optional<Point> cursor() {
            if (GraphicsEnvironment.isHeadless()) return Optional.empty();
            try {
                PointerInfo info = MouseInfo.getPointerInfo();
                return info == null ? Optional.empty() : Optional.of(info.getLocation());
            } catch (RuntimeException | AWTError e) {
                return Optional.empty();
            }
        }
    }
}
