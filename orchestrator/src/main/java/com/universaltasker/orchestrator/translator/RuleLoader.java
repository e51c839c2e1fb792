package com.universaltasker.orchestrator.translator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the translation rule file.
 *
 * The file is a JSON array of rules, or an object with a {@code rules} array.
 * A rule may give a single {@code pattern} string instead of a {@code patterns}
 * list. Every {@link #load()} reads the file afresh so edits take effect without
 * a restart; the returned list is an immutable snapshot.
 */
@Component
public class RuleLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleLoader.class);

    private final ObjectMapper json;
    private final Path         rulesFile;

    public RuleLoader(ObjectMapper objectMapper,
                      @Value("${tasker.translator.rules-file:data/translator_rules.json}") String rulesFile) {
        this.json      = objectMapper;
        this.rulesFile = Path.of(rulesFile);
    }

    public Path rulesFile() {
        return rulesFile;
    }

    /**
     * Load all usable rules in file order. A missing file means no rules; an
     * unreadable one is logged and also yields no rules.
     */
    public List<TranslationRule> load() {
        if (!Files.exists(rulesFile)) return List.of();
        try {
            JsonNode root = json.readTree(rulesFile.toFile());
            JsonNode array = root != null ? ruleArray(root) : null;
            if (array == null || !array.isArray()) {
                log.warn("Rule file {} has no rule array, ignoring it", rulesFile);
                return List.of();
            }
            List<TranslationRule> rules = new ArrayList<>();
            for (JsonNode node : array) {
                TranslationRule rule = toRule(node);
                if (rule != null) rules.add(rule);
            }
            return List.copyOf(rules);
        } catch (IOException e) {
            log.warn("Could not read rule file {}: {}", rulesFile, e.getMessage());
            return List.of();
        }
    }

    /**
     * Read the rule file as raw JSON for rewriting, keeping entries and keys
     * that {@link #load()} does not model. A missing file reads as an empty
     * array.
     *
     * @throws RuleFileException when the file cannot be parsed or holds no rule array
     */
    public JsonNode readRaw() {
        if (!Files.exists(rulesFile)) return json.createArrayNode();
        JsonNode root;
        try {
            root = json.readTree(rulesFile.toFile());
        } catch (IOException e) {
            throw new RuleFileException("Could not parse rule file " + rulesFile, e);
        }
        if (root == null || !ruleArray(root).isArray()) {
            throw new RuleFileException("Rule file " + rulesFile + " has no rule array");
        }
        return root;
    }

    /** The rule array inside a raw root: the root itself, or its {@code rules} field. */
    public static JsonNode ruleArray(JsonNode root) {
        return root.isObject() ? root.path("rules") : root;
    }

    /**
     * Replace the rule file with the given raw JSON, pretty-printed.
     *
     * @throws RuleFileException when the file cannot be written
     */
    public void save(JsonNode root) {
        try {
            if (rulesFile.getParent() != null) {
                Files.createDirectories(rulesFile.getParent());
            }
            Files.writeString(rulesFile,
                    json.copy().enable(SerializationFeature.INDENT_OUTPUT).writeValueAsString(root));
        } catch (IOException e) {
            throw new RuleFileException("Could not write rule file " + rulesFile, e);
        }
    }

    /** Non-empty patterns of a raw entry, from {@code patterns} or a single {@code pattern}. */
    static List<String> patternsOf(JsonNode node) {
        List<String> patterns = new ArrayList<>();
        if (!node.isObject()) return patterns;
        JsonNode p = node.has("patterns") ? node.get("patterns") : node.get("pattern");
        if (p != null && p.isArray()) {
            p.forEach(n -> { if (n.isTextual() && !n.asText().isEmpty()) patterns.add(n.asText()); });
        } else if (p != null && p.isTextual() && !p.asText().isEmpty()) {
            patterns.add(p.asText());
        }
        return patterns;
    }

    private static TranslationRule toRule(JsonNode node) {
        if (!node.isObject()) return null;
        List<String> patterns = patternsOf(node);
        TranslationRule rule = new TranslationRule(patterns,
                textOrNull(node.get("instruction")),
                textOrNull(node.get("instruction_macos")));
        return rule.patterns().isEmpty() || !rule.hasInstruction() ? null : rule;
    }

    private static String textOrNull(JsonNode n) {
        return n != null && n.isTextual() ? n.asText() : null;
    }
}
