package com.universaltasker.orchestrator.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Execution collaborator: runs one instruction against the input device.
 *
 * The whole instruction is parsed and validated first. Primitives then run in
 * order with a short pause between them so the UI can respond (a launcher needs
 * a moment to appear before text is typed into it), followed by a settle pause
 * before the caller takes its after-snapshot.
 */
@Component
public class ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);

    private final PrimitiveRegistry registry;
    private final InputDevice       device;
    private final Duration          interActionDelay;
    private final Duration          settleDelay;

    public ActionExecutor(PrimitiveRegistry registry,
                          InputDevice device,
                          @Value("${tasker.executor.inter-action-delay:600ms}") Duration interActionDelay,
                          @Value("${tasker.executor.settle-delay:400ms}") Duration settleDelay) {
        this.registry         = registry;
        this.device           = device;
        this.interActionDelay = interActionDelay;
        this.settleDelay      = settleDelay;
    }

    /**
     * Parse, validate, and run an instruction. A no-op returns immediately.
     *
     * @throws ActionException on any parse, validation, or device fault
     */
    public void execute(String instruction) {
        List<Instruction> calls = InstructionParser.parse(instruction);
        if (calls.isEmpty()) {
            log.debug("No-op instruction, nothing to execute");
            return;
        }
        for (Instruction call : calls) {
            registry.get(call.kind()).validate(call.args());
        }

        for (int i = 0; i < calls.size(); i++) {
            if (i > 0) device.pause(interActionDelay.toMillis());
            Instruction call = calls.get(i);
            log.debug("Executing {}", call.render());
            registry.execute(call, device);
        }
        device.pause(settleDelay.toMillis());
    }

    /** Whether the input device can drive the display; empty when it can. */
    public Optional<String> checkControl() {
        return device.checkControl();
    }
}
