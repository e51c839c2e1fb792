package com.universaltasker.orchestrator.action;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One parsed primitive call, e.g. {@code hotkey(command, space)}.
 *
 * @param kind which primitive to run
 * @param args raw argument values with quotes already removed
 */
public record Instruction(PrimitiveKind kind, List<String> args) {

    public Instruction {
        args = List.copyOf(args);
    }

    public static Instruction of(PrimitiveKind kind, String... args) {
        return new Instruction(kind, List.of(args));
    }

    /** Canonical text form; string arguments of TYPE are always quoted. */
    public String render() {
        String joined = args.stream()
                .map(a -> kind == PrimitiveKind.TYPE ? InstructionParser.quote(a) : a)
                .collect(Collectors.joining(", "));
        return kind.keyword() + "(" + joined + ")";
    }
}
