package com.universaltasker.orchestrator.agent;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a JSON object out of the engine's free-form text replies.
 *
 * Replies come in three shapes: JSON inside a fenced code block, a bare JSON
 * object, or JSON buried in prose. They are tried in that order:
 *   1. first ```json (or plain ```) block holding an object
 *   2. the whole trimmed reply
 *   3. first brace span, one level of nested braces tolerated
 * Nothing in here throws; malformed input yields Optional.empty().
 */
public final class ReplyParser {

    private static final Pattern FENCED_OBJECT = Pattern.compile(
            "```(?:json)?\\s*(\\{[\\s\\S]*?\\})\\s*```");

    private static final Pattern BRACE_SPAN = Pattern.compile(
            "\\{[^{}]*(?:\\{[^{}]*\\}[^{}]*)*\\}");

    private static final Pattern LEADING_FENCE  = Pattern.compile("^```\\w*\\n?");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\n?```\\s*$");

    private static final ObjectMapper JSON = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private ReplyParser() {}

    /**
     * Extract the first JSON object from a reply.
     *
     * A reply that parses as JSON but not as an object (a bare number, an
     * array) counts as unparseable.
     */
    public static Optional<JsonNode> extractObject(String reply) {
        if (reply == null || reply.isBlank()) return Optional.empty();

        Matcher fenced = FENCED_OBJECT.matcher(reply);
        if (fenced.find()) {
            JsonNode node = tryParse(fenced.group(1));
            if (node != null && node.isObject()) return Optional.of(node);
        }

        JsonNode whole = tryParse(reply.strip());
        if (whole != null) {
            return whole.isObject() ? Optional.of(whole) : Optional.empty();
        }

        Matcher brace = BRACE_SPAN.matcher(reply);
        if (brace.find()) {
            JsonNode node = tryParse(brace.group());
            if (node != null && node.isObject()) return Optional.of(node);
        }
        return Optional.empty();
    }

    /**
     * Remove a surrounding markdown fence from a plain-text reply.
     * Returns empty when nothing but whitespace is left.
     */
    public static Optional<String> stripFences(String reply) {
        if (reply == null) return Optional.empty();
        String text = reply.strip();
        if (text.startsWith("```")) {
            text = LEADING_FENCE.matcher(text).replaceFirst("");
            text = TRAILING_FENCE.matcher(text).replaceFirst("");
        }
        text = text.strip();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    private static JsonNode tryParse(String text) {
        try {
            JsonNode node = JSON.readTree(text);
            return (node == null || node.isMissingNode()) ? null : node;
        } catch (Exception e) {
            return null;
        }
    }
}
