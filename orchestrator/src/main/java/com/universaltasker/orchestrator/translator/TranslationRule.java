package com.universaltasker.orchestrator.translator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One file-defined translation rule.
 *
 * A rule matches when any of its patterns is a case-insensitive substring of the
 * step description. {@code {modifier}} in the instruction is replaced with the
 * platform modifier key (command on macOS, win elsewhere).
 *
 * @param patterns         substrings to look for, checked in list order
 * @param instruction      default instruction
 * @param instructionMacos optional macOS-specific instruction
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranslationRule(
        @JsonProperty("patterns")          List<String> patterns,
        @JsonProperty("instruction")       String       instruction,
        @JsonProperty("instruction_macos") String       instructionMacos) {

    public static final String MODIFIER_PLACEHOLDER = "{modifier}";

    public TranslationRule {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }

    /** The instruction for this platform, falling back to the default one. */
    public String instructionFor(boolean macOs) {
        if (macOs && instructionMacos != null && !instructionMacos.isBlank()) {
            return instructionMacos;
        }
        return instruction;
    }

    public boolean hasInstruction() {
        return (instruction != null && !instruction.isBlank())
            || (instructionMacos != null && !instructionMacos.isBlank());
    }
}
