package com.universaltasker.orchestrator.translator;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ActionTranslatorTest {

    static final String MAC     = "macOS 14.2.1; aarch64; Browser: unknown";
    static final String WINDOWS = "Windows 11 10.0; amd64; Browser: Edge";

    @TempDir Path dir;

    Path             rulesFile;
    ActionTranslator translator;

    @BeforeEach
    void setUp() {
        rulesFile  = dir.resolve("rules.json");
        translator = new ActionTranslator(new RuleLoader(new ObjectMapper(), rulesFile.toString()));
    }

    private void writeRules(String json) throws Exception {
        Files.writeString(rulesFile, json);
    }

    // ------------------------------------------------------------------
    // Built-ins
    // ------------------------------------------------------------------

    @Test
    void translate_openCalculatorOnMac_usesSpotlight() {
        assertThat(translator.translate("Open the Calculator app", MAC))
                .contains("hotkey(command, space); type(\"Calculator\"); press(enter)");
    }

    @Test
    void translate_openCalculatorElsewhere_usesRunDialog() {
        assertThat(translator.translate("launch calculator", WINDOWS))
                .contains("hotkey(win, r); type(\"calc\"); press(enter)");
    }

    static Stream<Arguments> typeAndEnterPhrases() {
        return Stream.of(
                Arguments.of("type 3+3 and press enter", "type(\"3+3\"); press(enter)"),
                Arguments.of("Type '12 * 4' then press enter", "type(\"12 * 4\"); press(enter)"),
                Arguments.of("type hello there and press enter", "type(\"hello there\"); press(enter)"),
                Arguments.of("type notes.txt, then hit enter", "type(\"notes.txt\"); press(enter)"));
    }

    @ParameterizedTest
    @MethodSource("typeAndEnterPhrases")
    void translate_typeAndEnter_extractsPayload(String description, String expected) {
        assertThat(translator.translate(description, WINDOWS)).contains(expected);
    }

    @Test
    void translate_typeHelloWorld() {
        assertThat(translator.translate("Type Hello World in the field", WINDOWS))
                .contains("type(\"Hello World\")");
    }

    @Test
    void translate_unknownPhrase_isEmpty() {
        assertThat(translator.translate("scroll down to the footer", WINDOWS)).isEmpty();
        assertThat(translator.translate("   ", WINDOWS)).isEmpty();
        assertThat(translator.translate(null, WINDOWS)).isEmpty();
    }

    @Test
    void translate_isDeterministic() {
        String first = translator.translate("type 3+3 and press enter", MAC).orElseThrow();

        for (int i = 0; i < 5; i++) {
            assertThat(translator.translate("type 3+3 and press enter", MAC)).contains(first);
        }
    }

    // ------------------------------------------------------------------
    // File rules
    // ------------------------------------------------------------------

    @Test
    void translate_fileRule_winsOverBuiltIn() throws Exception {
        writeRules("""
                [{"patterns": ["open calculator"], "instruction": "press(f1)"}]
                """);

        assertThat(translator.translate("Open Calculator", WINDOWS)).contains("press(f1)");
    }

    @Test
    void translate_fileRule_substitutesModifierAndPrefersMacInstruction() throws Exception {
        writeRules("""
                {"rules": [
                  {"pattern": "select all", "instruction": "hotkey(ctrl, a)",
                   "instruction_macos": "hotkey({modifier}, a)"},
                  {"patterns": ["show desktop"], "instruction": "hotkey({modifier}, d)"}
                ]}
                """);

        assertThat(translator.translate("Select all text", MAC)).contains("hotkey(command, a)");
        assertThat(translator.translate("Select all text", WINDOWS)).contains("hotkey(ctrl, a)");
        assertThat(translator.translate("show desktop", WINDOWS)).contains("hotkey(win, d)");
        assertThat(translator.translate("show desktop", MAC)).contains("hotkey(command, d)");
    }

    @Test
    void translate_firstMatchingRuleInFileOrderWins() throws Exception {
        writeRules("""
                [{"patterns": ["save"], "instruction": "hotkey(ctrl, s)"},
                 {"patterns": ["save as"], "instruction": "hotkey(ctrl, shift, s)"}]
                """);

        assertThat(translator.translate("save as a new file", WINDOWS)).contains("hotkey(ctrl, s)");
    }

    @Test
    void translate_unreadableFile_fallsBackToBuiltIns() throws Exception {
        writeRules("{ not json");

        assertThat(translator.translate("open calculator", WINDOWS))
                .contains("hotkey(win, r); type(\"calc\"); press(enter)");
    }

    @Test
    void load_dropsRulesWithoutPatternsOrInstruction() throws Exception {
        writeRules("""
                [{"patterns": [], "instruction": "press(a)"},
                 {"patterns": ["x"]},
                 "not an object",
                 {"patterns": ["ok", 7], "instruction": "press(b)"}]
                """);

        assertThat(new RuleLoader(new ObjectMapper(), rulesFile.toString()).load())
                .containsExactly(new TranslationRule(List.of("ok"), "press(b)", null));
    }
}
