package com.earthfile.frontend.loader.semantic;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decodes the leading options of a statement's words against an {@link OptionSpec}, with the
 * conventions of Go's {@code flag} package that Earthfile authors already know:
 *
 * <ul>
 *   <li>{@code -name} and {@code --name} are equivalent; values follow as {@code --name=value}
 *       or as the next word;</li>
 *   <li>flags take no separate value, but accept {@code --name=false};</li>
 *   <li>decoding stops at the first word that is not an option, or after {@code --};</li>
 *   <li>a repeated list option accumulates, any other repeated option keeps the last value.</li>
 * </ul>
 */
final class OptionDecoder {
    private static final Set<String> TRUE_VALUES = Set.of("1", "t", "T", "TRUE", "true", "True");
    private static final Set<String> FALSE_VALUES = Set.of("0", "f", "F", "FALSE", "false", "False");

    private OptionDecoder() {}

    static DecodedOptions decode(OptionSpec spec, List<String> words) throws OptionDecodeException {
        DecodedOptions decoded = new DecodedOptions(spec);
        int index = 0;
        while (index < words.size()) {
            String word = words.get(index);
            if (word.length() < 2 || word.charAt(0) != '-') {
                break;
            }
            index++;
            int dashes = 1;
            if (word.charAt(1) == '-') {
                dashes = 2;
                if (word.length() == 2) {
                    break;
                }
            }
            String name = word.substring(dashes);
            if (name.isEmpty() || name.charAt(0) == '-' || name.charAt(0) == '=') {
                throw failure(spec, words, "bad flag syntax: " + word);
            }
            String value = null;
            int equals = name.indexOf('=');
            if (equals >= 0) {
                value = name.substring(equals + 1);
                name = name.substring(0, equals);
            }
            OptionSpec.Option option = spec.find(name);
            if (option == null) {
                if ("help".equals(name) || "h".equals(name)) {
                    throw failure(spec, words, "flag: help requested");
                }
                throw failure(spec, words, "flag provided but not defined: -" + name);
            }
            if (option.type() == OptionSpec.Type.FLAG) {
                decoded.set(name, value == null ? Boolean.TRUE : parseBoolean(spec, words, name, value));
                continue;
            }
            if (value == null) {
                if (index >= words.size()) {
                    throw failure(spec, words, "flag needs an argument: -" + name);
                }
                value = words.get(index++);
            }
            store(spec, words, decoded, option, value);
        }
        for (; index < words.size(); index++) {
            decoded.addPositional(words.get(index));
        }
        return decoded;
    }

    private static void store(
            OptionSpec spec, List<String> words, DecodedOptions decoded, OptionSpec.Option option, String value)
            throws OptionDecodeException {
        String name = option.name();
        switch (option.type()) {
            case STRING -> decoded.set(name, value);
            case LIST -> decoded.append(name, value);
            case DURATION -> {
                Duration duration;
                try {
                    duration = GoDuration.parse(value);
                } catch (IllegalArgumentException ex) {
                    throw new OptionDecodeException(
                            prefix(spec, words) + invalidValue(name, value), ex);
                }
                decoded.set(name, duration);
            }
            case INTEGER -> {
                int parsed;
                try {
                    parsed = Integer.decode(value);
                } catch (NumberFormatException ex) {
                    throw new OptionDecodeException(prefix(spec, words) + invalidValue(name, value), ex);
                }
                decoded.set(name, parsed);
            }
            default -> throw new IllegalStateException("unexpected option type " + option.type());
        }
    }

    private static Boolean parseBoolean(OptionSpec spec, List<String> words, String name, String value)
            throws OptionDecodeException {
        if (TRUE_VALUES.contains(value)) {
            return Boolean.TRUE;
        }
        if (FALSE_VALUES.contains(value)) {
            return Boolean.FALSE;
        }
        throw failure(
                spec,
                words,
                String.format(Locale.ROOT, "invalid boolean value \"%s\" for -%s: parse error", value, name));
    }

    private static String invalidValue(String name, String value) {
        return String.format(Locale.ROOT, "invalid value \"%s\" for flag -%s: parse error", value, name);
    }

    private static OptionDecodeException failure(OptionSpec spec, List<String> words, String reason) {
        return new OptionDecodeException(prefix(spec, words) + reason);
    }

    private static String prefix(OptionSpec spec, List<String> words) {
        return "invalid " + spec.getCommandName() + " arguments [" + String.join(" ", words) + "]: ";
    }
}
