package com.universaltasker.orchestrator.translator;

import com.universaltasker.orchestrator.action.InstructionParser;
import com.universaltasker.orchestrator.environment.EnvironmentDescriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based step-description → instruction translator.
 *
 * Tried before the reasoning engine's translate call so phrasing seen before
 * never costs a round trip. Order:
 *   1. File-defined rules, in file order; patterns within a rule in list order.
 *   2. Built-in patterns: open calculator, type X and press enter, type hello world.
 * First match wins. Empty means "ask the engine".
 */
@Component
public class ActionTranslator {

    private static final Logger log = LoggerFactory.getLogger(ActionTranslator.class);

    // type "x" / type 'x'
    private static final Pattern QUOTED_PAYLOAD = Pattern.compile(
            "type\\s+[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE);

    // type 3+3, type 12 * 4
    private static final Pattern ARITHMETIC_PAYLOAD = Pattern.compile(
            "type\\s+(\\d+\\s*[+\\-*/]\\s*\\d+)", Pattern.CASE_INSENSITIVE);

    // type hello and press enter, type foo then enter
    private static final Pattern BARE_PAYLOAD = Pattern.compile(
            "type\\s+(.+?)\\s*(?:,\\s*)?(?:and\\s+|then\\s+)+(?:press\\s+|hit\\s+)?enter",
            Pattern.CASE_INSENSITIVE);

    private final RuleLoader ruleLoader;

    public ActionTranslator(RuleLoader ruleLoader) {
        this.ruleLoader = ruleLoader;
    }

    /**
     * Translate a natural-language step description into an instruction.
     *
     * @param description        e.g. "open calculator"
     * @param environmentContext output of {@link EnvironmentDescriber#describe}
     * @return the instruction, or empty when no rule matches
     */
    public Optional<String> translate(String description, String environmentContext) {
        if (description == null || description.isBlank()) return Optional.empty();
        String original = description.strip();
        String text = original.toLowerCase();
        boolean macOs = EnvironmentDescriber.isMacOs(environmentContext);

        Optional<String> fromFile = matchFileRules(ruleLoader.load(), text, macOs);
        if (fromFile.isPresent()) {
            log.debug("File rule matched '{}'", original);
            return fromFile;
        }
        return matchBuiltIns(original, text, macOs);
    }

    static Optional<String> matchFileRules(List<TranslationRule> rules, String text, boolean macOs) {
        String modifier = macOs ? "command" : "win";
        for (TranslationRule rule : rules) {
            for (String pattern : rule.patterns()) {
                if (!text.contains(pattern.toLowerCase())) continue;
                String instruction = rule.instructionFor(macOs);
                if (instruction != null && !instruction.isBlank()) {
                    return Optional.of(instruction.replace(TranslationRule.MODIFIER_PLACEHOLDER, modifier).strip());
                }
                break;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> matchBuiltIns(String original, String text, boolean macOs) {
        if (text.contains("calculator")
                && (text.contains("open") || text.contains("launch") || text.contains("run"))) {
            return Optional.of(macOs
                    ? "hotkey(command, space); type(\"Calculator\"); press(enter)"
                    : "hotkey(win, r); type(\"calc\"); press(enter)");
        }

        if (text.contains("type") && text.contains("enter")) {
            Optional<String> payload = firstGroup(QUOTED_PAYLOAD, original)
                    .or(() -> firstGroup(ARITHMETIC_PAYLOAD, original))
                    .or(() -> firstGroup(BARE_PAYLOAD, original));
            if (payload.isPresent()) {
                return Optional.of("type(" + InstructionParser.quote(payload.get()) + "); press(enter)");
            }
        }

        if (text.contains("type") && text.contains("hello world")) {
            return Optional.of("type(\"Hello World\")");
        }
        return Optional.empty();
    }

    private static Optional<String> firstGroup(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) return Optional.empty();
        String value = m.group(1).strip();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
