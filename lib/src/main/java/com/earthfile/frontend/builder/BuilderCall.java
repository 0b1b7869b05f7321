package com.earthfile.frontend.builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One operation recorded by {@link RecordingGraphBuilder}, with its arguments in call order. */
public final class BuilderCall {
    private final String operation;
    private final Map<String, Object> arguments;

    BuilderCall(String operation, Map<String, Object> arguments) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public String getOperation() {
        return operation;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    public Object get(String name) {
        if (!arguments.containsKey(name)) {
            throw new IllegalArgumentException("No argument '" + name + "' recorded for " + operation);
        }
        return arguments.get(name);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(operation);
        for (Map.Entry<String, Object> entry : arguments.entrySet()) {
            builder.append(' ').append(entry.getKey()).append('=').append(entry.getValue());
        }
        return builder.toString();
    }
}
