package com.universaltasker.orchestrator.action;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses instruction text into primitive calls.
 *
 * Grammar:
 * <pre>
 *   instruction := statement (';' statement)*
 *   statement   := name '(' [arg (',' arg)*] ')'
 *   arg         := '"' chars '"' | '\'' chars '\'' | bare-token
 * </pre>
 * Blank text, {@code noop} and {@code pass} mean "do nothing" and parse to an
 * empty list. Quoted strings honour backslash escapes.
 */
public final class InstructionParser {

    public static final String NOOP = "noop";

    private InstructionParser() {}

    /** True for text that carries no action at all. */
    public static boolean isNoop(String text) {
        if (text == null) return true;
        String t = text.strip();
        return t.isEmpty() || t.equalsIgnoreCase(NOOP) || t.equalsIgnoreCase("pass");
    }

    /** Double-quotes a literal, escaping backslashes and quotes. */
    public static String quote(String literal) {
        return "\"" + literal.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    /**
     * @throws ActionException PARSE_ERROR on malformed text, UNKNOWN_PRIMITIVE on
     *                         a name outside the vocabulary
     */
    public static List<Instruction> parse(String text) {
        List<Instruction> out = new ArrayList<>();
        if (isNoop(text)) return out;

        Cursor c = new Cursor(text);
        while (true) {
            c.skipSeparators();
            if (c.atEnd()) break;
            out.add(parseStatement(c));
            c.skipWhitespace();
            if (c.atEnd()) break;
            if (c.peek() != ';') {
                throw c.error("expected ';' between statements");
            }
        }
        return out;
    }

    private static Instruction parseStatement(Cursor c) {
        int start = c.pos;
        while (!c.atEnd() && (Character.isLetterOrDigit(c.peek()) || c.peek() == '_')) c.pos++;
        String name = c.text.substring(start, c.pos);
        if (name.isEmpty()) throw c.error("expected a primitive name");
        if (name.equalsIgnoreCase(NOOP) || name.equalsIgnoreCase("pass")) {
            throw c.error("'" + name + "' cannot be combined with other statements");
        }
        PrimitiveKind kind = PrimitiveKind.byKeyword(name).orElseThrow(() ->
                new ActionException(ActionException.Kind.UNKNOWN_PRIMITIVE,
                        "Unknown primitive '" + name + "' in: " + c.text));

        c.skipWhitespace();
        if (c.atEnd() || c.peek() != '(') throw c.error("expected '(' after " + name);
        c.pos++;

        List<String> args = new ArrayList<>();
        c.skipWhitespace();
        if (!c.atEnd() && c.peek() == ')') {
            c.pos++;
            return new Instruction(kind, args);
        }
        while (true) {
            c.skipWhitespace();
            args.add(parseArg(c));
            c.skipWhitespace();
            if (c.atEnd()) throw c.error("unterminated argument list");
            char ch = c.peek();
            c.pos++;
            if (ch == ')') break;
            if (ch != ',') throw c.error("expected ',' or ')'");
        }
        return new Instruction(kind, args);
    }

    private static String parseArg(Cursor c) {
        if (c.atEnd()) throw c.error("missing argument");
        char first = c.peek();
        if (first == '"' || first == '\'') {
            c.pos++;
            StringBuilder sb = new StringBuilder();
            while (true) {
                if (c.atEnd()) throw c.error("unterminated string");
                char ch = c.text.charAt(c.pos++);
                if (ch == '\\') {
                    if (c.atEnd()) throw c.error("dangling escape");
                    char esc = c.text.charAt(c.pos++);
                    sb.append(switch (esc) {
                        case 'n' -> '\n';
                        case 't' -> '\t';
                        default  -> esc;
                    });
                } else if (ch == first) {
                    return sb.toString();
                } else {
                    sb.append(ch);
                }
            }
        }
        int start = c.pos;
        while (!c.atEnd() && c.peek() != ',' && c.peek() != ')' && c.peek() != ';') c.pos++;
        String bare = c.text.substring(start, c.pos).strip();
        if (bare.isEmpty()) throw c.error("empty argument");
        return bare;
    }

    private static final class Cursor {
        final String text;
        int pos;

        Cursor(String text) {
            this.text = text;
        }

        boolean atEnd()  { return pos >= text.length(); }
        char    peek()   { return text.charAt(pos); }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(peek())) pos++;
        }

        void skipSeparators() {
            while (!atEnd() && (Character.isWhitespace(peek()) || peek() == ';')) pos++;
        }

        ActionException error(String what) {
            return new ActionException(ActionException.Kind.PARSE_ERROR,
                    what + " at position " + pos + " in: " + text);
        }
    }
}
