package com.universaltasker.orchestrator;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        // Input control and screen capture need AWT with a real display.
        new SpringApplicationBuilder(OrchestratorApplication.class)
                .headless(false)
                .run(args);
    }
}
