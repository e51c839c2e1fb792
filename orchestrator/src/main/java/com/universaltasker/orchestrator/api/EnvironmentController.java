package com.universaltasker.orchestrator.api;

import com.universaltasker.orchestrator.action.ActionExecutor;
import com.universaltasker.orchestrator.api.dto.EnvironmentResponse;
import com.universaltasker.orchestrator.environment.EnvironmentDescriber;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * GET /environment: what the engine will be told about this machine, and
 * whether the input device can actually drive the display.
 */
@RestController
public class EnvironmentController {

    private final EnvironmentDescriber describer;
    private final ActionExecutor       executor;

    public EnvironmentController(EnvironmentDescriber describer, ActionExecutor executor) {
        this.describer = describer;
        this.executor  = executor;
    }

    @GetMapping("/environment")
    public EnvironmentResponse environment(@RequestParam(required = false) String browser) {
        Optional<String> problem = executor.checkControl();
        return new EnvironmentResponse(describer.describe(browser), problem.isEmpty(), problem.orElse(null));
    }
}
