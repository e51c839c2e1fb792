package com.universaltasker.orchestrator.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.AWTError;
import java.awt.GraphicsEnvironment;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.Toolkit;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Full-screen PNG capture via {@link java.awt.Robot}.
 */
@Component
public class RobotScreenCapture implements ScreenCapture {

    private static final Logger log = LoggerFactory.getLogger(RobotScreenCapture.class);

    @Override
    public CaptureResult capture(Path target) {
        if (GraphicsEnvironment.isHeadless()) {
            return CaptureResult.failed("No display available (headless JVM)");
        }
        try {
            Rectangle screen = new Rectangle(Toolkit.getDefaultToolkit().getScreenSize());
            BufferedImage image = new Robot().createScreenCapture(screen);
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            if (!ImageIO.write(image, "png", target.toFile())) {
                return CaptureResult.failed("No PNG writer available");
            }
            return CaptureResult.ok(target);
        } catch (Exception | AWTError e) {
            log.warn("Screenshot to {} failed: {}", target, e.getMessage());
            return CaptureResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
