package com.earthfile.frontend.loader.semantic;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Option values and positional residue of one decoded statement. Undeclared names are a bug. */
final class DecodedOptions {
    private final OptionSpec spec;
    private final Map<String, Object> values = new HashMap<>();
    private final Map<String, List<String>> lists = new HashMap<>();
    private final List<String> positionals = new ArrayList<>();

    DecodedOptions(OptionSpec spec) {
        this.spec = spec;
        for (OptionSpec.Option option : spec.getOptions().values()) {
            if (option.type() == OptionSpec.Type.LIST) {
                lists.put(option.name(), new ArrayList<>());
            } else {
                values.put(option.name(), option.defaultValue());
            }
        }
    }

    void set(String name, Object value) {
        values.put(name, value);
    }

    void append(String name, String value) {
        lists.get(name).add(value);
    }

    void addPositional(String value) {
        positionals.add(value);
    }

    boolean flag(String name) {
        return (Boolean) lookup(name, OptionSpec.Type.FLAG);
    }

    String string(String name) {
        return (String) lookup(name, OptionSpec.Type.STRING);
    }

    List<String> list(String name) {
        checkDeclared(name, OptionSpec.Type.LIST);
        return List.copyOf(lists.get(name));
    }

    Duration duration(String name) {
        return (Duration) lookup(name, OptionSpec.Type.DURATION);
    }

    int integer(String name) {
        return (Integer) lookup(name, OptionSpec.Type.INTEGER);
    }

    List<String> positionals() {
        return List.copyOf(positionals);
    }

    int positionalCount() {
        return positionals.size();
    }

    String positional(int index) {
        return positionals.get(index);
    }

    private Object lookup(String name, OptionSpec.Type expected) {
        checkDeclared(name, expected);
        return values.get(name);
    }

    private void checkDeclared(String name, OptionSpec.Type expected) {
        OptionSpec.Option option = spec.find(name);
        if (option == null || option.type() != expected) {
            throw new IllegalArgumentException(
                    "no " + expected.name().toLowerCase(Locale.ROOT) + " option '" + name + "' declared for " + spec.getCommandName());
        }
    }
}
