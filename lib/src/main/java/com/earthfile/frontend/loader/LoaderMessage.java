package com.earthfile.frontend.loader;

import java.util.Objects;

/**
 * A non-fatal diagnostic produced while loading an Earthfile: deprecation notices from the
 * interpreter, and token or parser traces when {@link DebugFlags} asks for them.
 */
public final class LoaderMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final String message;
    private final String sourceName;
    private final int line;

    public LoaderMessage(Level level, String message, String sourceName, int line) {
        this.level = Objects.requireNonNull(level, "level");
        this.message = Objects.requireNonNull(message, "message");
        this.sourceName = sourceName == null ? "" : sourceName;
        this.line = line;
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getSourceName() {
        return sourceName;
    }

    /** 1-based line of the statement that produced the message, or 0 when it has none. */
    public int getLine() {
        return line;
    }

    /** {@code LEVEL source:line: message}, leaving out whatever location part is unknown. */
    public String format() {
        StringBuilder builder = new StringBuilder(level.name()).append(' ');
        if (!sourceName.isEmpty()) {
            builder.append(sourceName);
            if (line > 0) {
                builder.append(':').append(line);
            }
            builder.append(": ");
        }
        return builder.append(message).toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
