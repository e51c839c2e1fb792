package com.universaltasker.orchestrator.action;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * In-process registry of the instruction vocabulary.
 *
 * All {@link ActionPrimitive} beans are collected at startup via constructor
 * injection.
 *
 * <p>Key responsibilities:
 * <ol>
 *   <li>Lookup by kind ({@link #get}).</li>
 *   <li>Metrics-instrumented execution ({@link #execute}): every call is timed
 *       and counted, with no per-primitive boilerplate.</li>
 *   <li>Vocabulary documentation ({@link #buildInstructionDocumentation}) for
 *       the reasoning prompts, always in sync with the registered primitives.</li>
 * </ol>
 */
@Component
public class PrimitiveRegistry {

    private static final Logger log = LoggerFactory.getLogger(PrimitiveRegistry.class);

    private final Map<PrimitiveKind, ActionPrimitive> primitives = new EnumMap<>(PrimitiveKind.class);
    private final MeterRegistry meterRegistry;

    public PrimitiveRegistry(List<ActionPrimitive> allPrimitives, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (ActionPrimitive p : allPrimitives) {
            primitives.put(p.manifest().kind(), p);
            log.info("Registered primitive '{}'", p.manifest().kind().keyword());
        }
    }

    public ActionPrimitive get(PrimitiveKind kind) {
        ActionPrimitive p = primitives.get(kind);
        if (p == null) {
            throw new ActionException(ActionException.Kind.UNKNOWN_PRIMITIVE,
                    "No primitive registered for '" + kind.keyword() + "'");
        }
        return p;
    }

    public List<String> keywords() {
        return primitives.keySet().stream().map(PrimitiveKind::keyword).sorted().toList();
    }

    /**
     * Run one primitive with full observability:
     * <pre>
     *   tasker.primitive.calls{primitive, status="success|bad_argument|device_error|..."}
     *   tasker.primitive.duration{primitive}
     * </pre>
     */
    public void execute(Instruction instruction, InputDevice device) {
        String name = instruction.kind().keyword();
        ActionPrimitive primitive = get(instruction.kind());

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            primitive.execute(instruction.args(), device);
        } catch (ActionException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (Exception e) {
            status = "device_error";
            throw new ActionException(ActionException.Kind.DEVICE_ERROR,
                    "Unexpected error in primitive '" + name + "': " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("tasker.primitive.duration", "primitive", name));
            meterRegistry.counter("tasker.primitive.calls", "primitive", name, "status", status).increment();
        }
    }

    /**
     * The AVAILABLE INSTRUCTIONS block embedded in the reasoning prompts.
     */
    public String buildInstructionDocumentation() {
        StringBuilder sb = new StringBuilder();
        sb.append("""
                Express every action as an instruction: one or more primitive calls
                separated by ';'. Text arguments must be quoted.

                AVAILABLE INSTRUCTIONS:
                """);
        primitives.values().stream()
                .map(ActionPrimitive::manifest)
                .sorted(Comparator.comparing(m -> m.kind().ordinal()))
                .forEach(m -> {
                    sb.append("  ").append(m.signature()).append("\n");
                    sb.append("      ").append(m.description()).append("\n\n");
                });
        sb.append("""
                RULES:
                  - One atomic action per step; keep instructions short.
                  - Use noop when nothing should be executed this step.
                  - Example: hotkey(command, space); type("Calculator"); press(enter)
                """);
        return sb.toString();
    }
}
