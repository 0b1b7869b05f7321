package com.earthfile.frontend.builder;

import java.util.Objects;
import java.util.function.Function;

/**
 * Shell-style expansion of a single word: {@code $NAME}, {@code ${NAME}} and the {@code :-},
 * {@code :+}, {@code -}, {@code +} modifiers, backslash escapes, single quotes (literal) and double
 * quotes (expanding). Unset names expand to the empty string. Quotes are removed.
 *
 * <p>Malformed input such as an unterminated {@code ${} is kept literally rather than rejected.</p>
 */
public final class VariableExpander {

    private VariableExpander() {}

    public static String expand(String word, Function<String, String> lookup) {
        Objects.requireNonNull(word, "word");
        Objects.requireNonNull(lookup, "lookup");
        return new Scan(word, lookup).word();
    }

    private static final class Scan {
        private final String input;
        private final Function<String, String> lookup;
        private int pos;

        Scan(String input, Function<String, String> lookup) {
            this.input = input;
            this.lookup = lookup;
        }

        String word() {
            StringBuilder out = new StringBuilder(input.length());
            while (pos < input.length()) {
                char ch = input.charAt(pos);
                switch (ch) {
                    case '\\':
                        if (pos + 1 < input.length()) {
                            out.append(input.charAt(pos + 1));
                            pos += 2;
                        } else {
                            out.append(ch);
                            pos++;
                        }
                        break;
                    case '\'':
                        singleQuoted(out);
                        break;
                    case '"':
                        doubleQuoted(out);
                        break;
                    case '$':
                        dollar(out);
                        break;
                    default:
                        out.append(ch);
                        pos++;
                }
            }
            return out.toString();
        }

        private void singleQuoted(StringBuilder out) {
            int close = input.indexOf('\'', pos + 1);
            if (close < 0) {
                out.append(input, pos, input.length());
                pos = input.length();
                return;
            }
            out.append(input, pos + 1, close);
            pos = close + 1;
        }

        private void doubleQuoted(StringBuilder out) {
            StringBuilder quoted = new StringBuilder();
            pos++;
            while (pos < input.length()) {
                char ch = input.charAt(pos);
                if (ch == '"') {
                    pos++;
                    out.append(quoted);
                    return;
                }
                if (ch == '\\' && pos + 1 < input.length()) {
                    char next = input.charAt(pos + 1);
                    if (next == '"' || next == '$' || next == '\\') {
                        quoted.append(next);
                    } else {
                        quoted.append(ch).append(next);
                    }
                    pos += 2;
                    continue;
                }
                if (ch == '$') {
                    dollar(quoted);
                    continue;
                }
                quoted.append(ch);
                pos++;
            }
            // Unterminated: keep the opening quote.
            out.append('"').append(quoted);
        }

        private void dollar(StringBuilder out) {
            int next = pos + 1;
            if (next >= input.length()) {
                out.append('$');
                pos++;
                return;
            }
            char ch = input.charAt(next);
            if (ch == '{') {
                braced(out);
                return;
            }
            if (!isNameStart(ch)) {
                out.append('$');
                pos++;
                return;
            }
            int end = next;
            while (end < input.length() && isNamePart(input.charAt(end))) {
                end++;
            }
            out.append(valueOf(input.substring(next, end)));
            pos = end;
        }

        private void braced(StringBuilder out) {
            int close = matchingBrace(pos + 2);
            if (close < 0) {
                out.append(input, pos, input.length());
                pos = input.length();
                return;
            }
            String body = input.substring(pos + 2, close);
            pos = close + 1;
            int nameEnd = 0;
            while (nameEnd < body.length() && isNamePart(body.charAt(nameEnd))) {
                nameEnd++;
            }
            String name = body.substring(0, nameEnd);
            String rest = body.substring(nameEnd);
            String value = lookup.apply(name);
            if (rest.isEmpty()) {
                out.append(value == null ? "" : value);
                return;
            }
            boolean colon = rest.startsWith(":");
            String modifier = colon ? rest.substring(1) : rest;
            boolean unset = value == null || (colon && value.isEmpty());
            if (modifier.startsWith("-")) {
                out.append(unset ? expand(modifier.substring(1), lookup) : value);
            } else if (modifier.startsWith("+")) {
                out.append(unset ? "" : expand(modifier.substring(1), lookup));
            } else {
                out.append("${").append(body).append('}');
            }
        }

        private int matchingBrace(int from) {
            int depth = 1;
            for (int i = from; i < input.length(); i++) {
                char ch = input.charAt(i);
                if (ch == '\\') {
                    i++;
                } else if (ch == '{') {
                    depth++;
                } else if (ch == '}') {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                }
            }
            return -1;
        }

        private String valueOf(String name) {
            String value = lookup.apply(name);
            return value == null ? "" : value;
        }

        private static boolean isNameStart(char ch) {
            return ch == '_' || (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
        }

        private static boolean isNamePart(char ch) {
            return isNameStart(ch) || (ch >= '0' && ch <= '9');
        }
    }
}
