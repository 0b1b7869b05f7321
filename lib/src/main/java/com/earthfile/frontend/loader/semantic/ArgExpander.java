package com.earthfile.frontend.loader.semantic;

import com.earthfile.frontend.builder.GraphBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Variable expansion through {@link GraphBuilder#expandArgs(String)} that keeps escaped target
 * markers ({@code \+}) intact. The escape is doubled before expansion so the builder's own
 * backslash handling leaves one level behind. {@link #reference(String)} keeps that level for
 * words that are parsed as references afterwards; {@link #literal(String)} removes it.
 *
 * <p>Words that already contain {@code \\+} are not round-tripped faithfully: the doubled escape
 * is indistinguishable from an escaped marker after expansion.</p>
 */
final class ArgExpander {
    private static final String ESCAPED_MARKER = "\\+";
    private static final String DOUBLE_ESCAPED_MARKER = "\\\\+";

    private final GraphBuilder builder;

    ArgExpander(GraphBuilder builder) {
        this.builder = Objects.requireNonNull(builder, "builder");
    }

    /** Expand a word that will be parsed as a target or artifact reference. */
    String reference(String word) {
        if (word.isEmpty()) {
            return word;
        }
        return builder.expandArgs(escapeMarker(word));
    }

    /** Expand a word used as a plain value. */
    String literal(String word) {
        if (word.isEmpty()) {
            return word;
        }
        return unescapeMarker(builder.expandArgs(escapeMarker(word)));
    }

    List<String> reference(List<String> words) {
        List<String> expanded = new ArrayList<>(words.size());
        for (String word : words) {
            expanded.add(reference(word));
        }
        return expanded;
    }

    List<String> literal(List<String> words) {
        List<String> expanded = new ArrayList<>(words.size());
        for (String word : words) {
            expanded.add(literal(word));
        }
        return expanded;
    }

    static String escapeMarker(String word) {
        return word.replace(ESCAPED_MARKER, DOUBLE_ESCAPED_MARKER);
    }

    static String unescapeMarker(String word) {
        return word.replace(ESCAPED_MARKER, "+");
    }
}
