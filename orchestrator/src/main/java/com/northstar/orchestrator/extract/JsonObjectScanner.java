package com.northstar.orchestrator.extract;

import java.util.Optional;

/**
 * Character-level scanning of JSON-ish text.
 *
 * Both operations walk the text with the same three-state machine:
 *
 *   OUTSIDE_STRING --"--> IN_STRING --\--> ESCAPED
 *         ^                  |                |
 *         +-------"----------+  <--any char---+
 *
 * Braces only count while OUTSIDE_STRING, so a "}" inside a string literal
 * (or an escaped quote inside one) never ends the object early.
 */
final class JsonObjectScanner {

    enum State { OUTSIDE_STRING, IN_STRING, ESCAPED }

    private JsonObjectScanner() {}

    /**
     * Return the first balanced {...} object in the text, or empty if there is
     * no "{" or the object never closes (e.g. truncated output, stray quote).
     */
    static Optional<String> firstObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) return Optional.empty();

        State state = State.OUTSIDE_STRING;
        int depth = 0;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (state) {
                case ESCAPED -> state = State.IN_STRING;
                case IN_STRING -> {
                    if (c == '\\')     state = State.ESCAPED;
                    else if (c == '"') state = State.OUTSIDE_STRING;
                }
                case OUTSIDE_STRING -> {
                    if (c == '"') {
                        state = State.IN_STRING;
                    } else if (c == '{') {
                        depth++;
                    } else if (c == '}') {
                        depth--;
                        if (depth == 0) return Optional.of(text.substring(start, i + 1));
                    }
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Make raw control characters legal.
     *
     * Inside string literals, raw newline/CR/tab become their two-character
     * escapes and other control characters are dropped. A backslash followed by
     * a character that is not a JSON escape is kept as a literal backslash.
     * Outside strings, control characters other than whitespace are dropped.
     */
    static String sanitizeControlCharacters(String json) {
        StringBuilder out = new StringBuilder(json.length() + 16);
        State state = State.OUTSIDE_STRING;
        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);
            switch (state) {
                case OUTSIDE_STRING -> {
                    if (c == '"') {
                        state = State.IN_STRING;
                        out.append(c);
                    } else if (c >= 0x20 || c == '\n' || c == '\r' || c == '\t') {
                        out.append(c);
                    }
                }
                case IN_STRING -> {
                    if (c == '\\') {
                        state = State.ESCAPED;
                    } else if (c == '"') {
                        state = State.OUTSIDE_STRING;
                        out.append(c);
                    } else if (c < 0x20) {
                        appendControlEscape(out, c);
                    } else {
                        out.append(c);
                    }
                }
                case ESCAPED -> {
                    state = State.IN_STRING;
                    if ("\"\\/bfnrtu".indexOf(c) >= 0) {
                        out.append('\\').append(c);
                    } else if (c < 0x20) {
                        appendControlEscape(out, c);
                    } else {
                        out.append("\\\\").append(c);
                    }
                }
            }
        }
        // A dangling backslash at the very end would otherwise vanish.
        if (state == State.ESCAPED) out.append("\\\\");
        return out.toString();
    }

    private static void appendControlEscape(StringBuilder out, char c) {
        switch (c) {
            case '\n' -> out.append("\\n");
            case '\r' -> out.append("\\r");
            case '\t' -> out.append("\\t");
            default   -> { }   // dropped
        }
    }
}
