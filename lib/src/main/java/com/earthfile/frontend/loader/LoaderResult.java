package com.earthfile.frontend.loader;

import java.util.List;

/**
 * Outcome of interpreting one target of an Earthfile. Builder effects went to the caller's
 * {@link com.earthfile.frontend.builder.GraphBuilder}; this only carries what is left to report.
 */
public final class LoaderResult {
    private final String sourceName;
    private final String targetName;
    private final List<LoaderMessage> messages;

    public LoaderResult(String sourceName, String targetName, List<LoaderMessage> messages) {
        this.sourceName = sourceName;
        this.targetName = targetName;
        this.messages = List.copyOf(messages);
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getTargetName() {
        return targetName;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }

    public List<LoaderMessage> getWarnings() {
        return messages.stream().filter(message -> message.getLevel() == LoaderMessage.Level.WARNING).toList();
    }
}
