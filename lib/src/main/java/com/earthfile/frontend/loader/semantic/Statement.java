package com.earthfile.frontend.loader.semantic;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One parsed statement, as handed to the {@link StatementInterpreter}. Words are continuation
 * free but not yet variable-expanded. ENV and ARG carry a single key and value; LABEL carries
 * parallel key and value lists which may differ in length when the source is malformed.
 */
public final class Statement {
    private final StatementKind kind;
    private final List<String> words;
    private final boolean execMode;
    private final List<String> keys;
    private final List<String> values;
    private final String text;
    private final int line;

    private Statement(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.words = List.copyOf(builder.words);
        this.execMode = builder.execMode;
        this.keys = List.copyOf(builder.keys);
        this.values = List.copyOf(builder.values);
        this.text = builder.text;
        this.line = builder.line;
    }

    public static Builder builder(StatementKind kind) {
        return new Builder().kind(kind);
    }

    public StatementKind getKind() {
        return kind;
    }

    public List<String> getWords() {
        return words;
    }

    /** True when the words came from a JSON array ({@code RUN ["echo", "hi"]}). */
    public boolean isExecMode() {
        return execMode;
    }

    public List<String> getKeys() {
        return keys;
    }

    public List<String> getValues() {
        return values;
    }

    /** The key of an ENV or ARG statement, or an empty string. */
    public String getKey() {
        return keys.isEmpty() ? "" : keys.get(0);
    }

    /** The value of an ENV or ARG statement, or an empty string when none was written. */
    public String getValue() {
        return values.isEmpty() ? "" : values.get(0);
    }

    /** Source text of the whole statement, used in error messages. */
    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    /** Go-style rendering of the raw words, {@code [a b c]}. */
    String wordsForMessage() {
        return "[" + String.join(" ", words) + "]";
    }

    @Override
    public String toString() {
        return text.isEmpty() ? kind.keyword() + " " + String.join(" ", words) : text;
    }

    /** Per-statement scratch filled while the parse tree is walked; discarded once built. */
    public static final class Builder {
        private StatementKind kind;
        private final List<String> words = new ArrayList<>();
        private boolean execMode;
        private final List<String> keys = new ArrayList<>();
        private final List<String> values = new ArrayList<>();
        private String text = "";
        private int line;

        public Builder kind(StatementKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder word(String word) {
            words.add(Objects.requireNonNull(word, "word"));
            return this;
        }

        public Builder words(List<String> replacement, boolean execMode) {
            words.clear();
            words.addAll(replacement);
            this.execMode = execMode;
            return this;
        }

        public Builder key(String key) {
            keys.add(Objects.requireNonNull(key, "key"));
            return this;
        }

        public Builder value(String value) {
            values.add(Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder text(String text) {
            this.text = text == null ? "" : text;
            return this;
        }

        public Builder line(int line) {
            this.line = line;
            return this;
        }

        List<String> currentWords() {
            return words;
        }

        public Statement build() {
            return new Statement(this);
        }
    }
}
