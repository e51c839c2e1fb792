package com.universaltasker.orchestrator.action;

import com.universaltasker.orchestrator.action.impl.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the primitive layer: registry, primitives and executor against a
 * recording device.
 */
class PrimitiveLayerTest {

    SimpleMeterRegistry  meters;
    PrimitiveRegistry    registry;
    RecordingInputDevice device;
    ActionExecutor       executor;

    @BeforeEach
    void setUp() {
        meters   = new SimpleMeterRegistry();
        registry = new PrimitiveRegistry(List.of(
                new MovePrimitive(), new ClickPrimitive(), new TypePrimitive(),
                new PressPrimitive(), new HotkeyPrimitive(), new WaitPrimitive()), meters);
        device   = new RecordingInputDevice();
        executor = new ActionExecutor(registry, device, Duration.ofMillis(600), Duration.ofMillis(400));
    }

    // ------------------------------------------------------------------
    // Registry
    // ------------------------------------------------------------------

    @Test
    void registry_listsWholeVocabulary() {
        assertThat(registry.keywords()).containsExactly("click", "hotkey", "move", "press", "type", "wait");
    }

    @Test
    void registry_documentation_coversEverySignature() {
        String docs = registry.buildInstructionDocumentation();

        assertThat(docs).contains("AVAILABLE INSTRUCTIONS:", "move(x, y)", "type(\"text\")",
                "hotkey(key1, key2, ...)", "wait(ms)", "noop");
        assertThat(docs.indexOf("move(x, y)")).isLessThan(docs.indexOf("wait(ms)"));
    }

    @Test
    void registry_missingPrimitive_throwsUnknown() {
        PrimitiveRegistry partial = new PrimitiveRegistry(List.of(new TypePrimitive()), meters);

        assertThatThrownBy(() -> partial.get(PrimitiveKind.CLICK))
                .isInstanceOf(ActionException.class)
                .hasMessageContaining("click");
    }

    @Test
    void registry_execute_recordsMetrics() {
        registry.execute(Instruction.of(PrimitiveKind.PRESS, "enter"), device);

        assertThat(meters.counter("tasker.primitive.calls", "primitive", "press", "status", "success").count())
                .isEqualTo(1.0);
        assertThat(meters.timer("tasker.primitive.duration", "primitive", "press").count()).isEqualTo(1);
    }

    @Test
    void registry_execute_wrapsDeviceFailures() {
        InputDevice broken = new RecordingInputDevice() {
            @Override public void press(String key) { throw new IllegalStateException("robot gone"); }
        };

        assertThatThrownBy(() -> registry.execute(Instruction.of(PrimitiveKind.PRESS, "enter"), broken))
                .isInstanceOf(ActionException.class)
                .hasMessageContaining("robot gone")
                .satisfies(e -> assertThat(((ActionException) e).getKind())
                        .isEqualTo(ActionException.Kind.DEVICE_ERROR));
        assertThat(meters.counter("tasker.primitive.calls", "primitive", "press", "status", "device_error").count())
                .isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Executor
    // ------------------------------------------------------------------

    @Test
    void execute_sequence_pausesBetweenAndAfter() {
        executor.execute("hotkey(win, r); type(\"calc\"); press(enter)");

        assertThat(device.calls).containsExactly(
                "hotkey win+r", "pause 600", "type calc", "pause 600", "press enter", "pause 400");
    }

    @Test
    void execute_clickWithCoordinates_movesFirst() {
        executor.execute("click(10, 20, \"right\")");

        assertThat(device.calls).containsExactly("move 10,20", "click RIGHT", "pause 400");
    }

    @Test
    void execute_noop_touchesNothing() {
        executor.execute("noop");

        assertThat(device.calls).isEmpty();
    }

    @Test
    void execute_invalidLaterCall_runsNothing() {
        assertThatThrownBy(() -> executor.execute("type(\"calc\"); press(nosuchkey)"))
                .isInstanceOf(ActionException.class)
                .hasMessageContaining("nosuchkey");

        assertThat(device.calls).isEmpty();
    }

    @Test
    void execute_badArguments_areRejected() {
        assertThatThrownBy(() -> executor.execute("move(-1, 5)")).hasMessageContaining("must not be negative");
        assertThatThrownBy(() -> executor.execute("move(a, 5)")).hasMessageContaining("x must be an integer");
        assertThatThrownBy(() -> executor.execute("wait(20000)")).hasMessageContaining("between 0 and");
        assertThatThrownBy(() -> executor.execute("click(1)")).hasMessageContaining("0, 2 or 3");
        assertThatThrownBy(() -> executor.execute("click(1, 2, \"side\")")).hasMessageContaining("side");
        assertThatThrownBy(() -> executor.execute("hotkey(a, b, c, d, e)")).hasMessageContaining("1 to 4");
    }

    @Test
    void execute_wait_pausesOnDevice() {
        executor.execute("wait(250)");

        assertThat(device.calls).containsExactly("pause 250", "pause 400");
    }

    @Test
    void checkControl_delegatesToDevice() {
        assertThat(executor.checkControl()).isEmpty();

        device.controlProblem = "headless";
        assertThat(executor.checkControl()).contains("headless");
    }

    // ------------------------------------------------------------------
    // Key names
    // ------------------------------------------------------------------

    @Test
    void keyNames_resolveNamedLettersAndFunctionKeys() {
        assertThat(KeyNames.resolve("Enter")).isPresent();
        assertThat(KeyNames.resolve("a")).isPresent();
        assertThat(KeyNames.resolve("f12")).isPresent();
        assertThat(KeyNames.resolve("f13")).isEmpty();
        assertThat(KeyNames.resolve("hyper")).isEmpty();
    }

    @Test
    void keyNames_strokeFor_shiftedSymbols() {
        assertThat(KeyNames.strokeFor('+').orElseThrow().shift()).isTrue();
        assertThat(KeyNames.strokeFor('=').orElseThrow().shift()).isFalse();
        assertThat(KeyNames.strokeFor('H').orElseThrow().shift()).isTrue();
        assertThat(KeyNames.strokeFor('é')).isEmpty();
    }
}
