package com.earthfile.frontend.loader.semantic;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** The options one statement accepts, with their types and defaults. Built once per handler. */
final class OptionSpec {

    enum Type {
        FLAG,
        STRING,
        LIST,
        DURATION,
        INTEGER
    }

    record Option(String name, Type type, Object defaultValue) {}

    private final String commandName;
    private final Map<String, Option> options;

    private OptionSpec(String commandName, Map<String, Option> options) {
        this.commandName = commandName;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    static Builder builder(String commandName) {
        return new Builder(commandName);
    }

    /** Name used in decode errors, for example {@code invalid GIT CLONE arguments [...]}. */
    String getCommandName() {
        return commandName;
    }

    Option find(String name) {
        return options.get(name);
    }

    Map<String, Option> getOptions() {
        return options;
    }

    static final class Builder {
        private final String commandName;
        private final Map<String, Option> options = new LinkedHashMap<>();

        private Builder(String commandName) {
            this.commandName = Objects.requireNonNull(commandName, "commandName");
        }

        Builder flag(String name) {
            return add(new Option(name, Type.FLAG, Boolean.FALSE));
        }

        Builder string(String name) {
            return add(new Option(name, Type.STRING, ""));
        }

        /** A repeatable option; every occurrence appends a value. */
        Builder list(String name) {
            return add(new Option(name, Type.LIST, null));
        }

        Builder duration(String name, Duration defaultValue) {
            return add(new Option(name, Type.DURATION, defaultValue));
        }

        Builder integer(String name, int defaultValue) {
            return add(new Option(name, Type.INTEGER, defaultValue));
        }

        private Builder add(Option option) {
            if (options.putIfAbsent(option.name(), option) != null) {
                throw new IllegalArgumentException("option declared twice: " + option.name());
            }
            return this;
        }

        OptionSpec build() {
            return new OptionSpec(commandName, options);
        }
    }
}
