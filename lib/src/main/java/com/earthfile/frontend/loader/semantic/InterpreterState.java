package com.earthfile.frontend.loader.semantic;

import com.earthfile.frontend.loader.LoaderMessage;
import java.util.ArrayList;
import java.util.List;

/** Everything that outlives a single statement during one walk of one file. */
final class InterpreterState {
    private final TargetFilter filter;
    private final WithDockerTracker withDocker = new WithDockerTracker();
    private final List<LoaderMessage> messages = new ArrayList<>();
    private boolean pushOnly;
    private InterpreterException error;

    InterpreterState(String requestedTarget) {
        this.filter = new TargetFilter(requestedTarget);
    }

    TargetFilter getFilter() {
        return filter;
    }

    WithDockerTracker getWithDocker() {
        return withDocker;
    }

    boolean isPushOnly() {
        return pushOnly;
    }

    void setPushOnly(boolean pushOnly) {
        this.pushOnly = pushOnly;
    }

    InterpreterException getError() {
        return error;
    }

    boolean hasError() {
        return error != null;
    }

    /** Records {@code failure} unless an earlier one is already recorded. */
    boolean latch(InterpreterException failure) {
        if (error != null) {
            return false;
        }
        error = failure;
        return true;
    }

    /** Statements are interpreted only inside the requested target and before the first error. */
    boolean shouldSkip() {
        return error != null || !filter.isActive();
    }

    void addMessage(LoaderMessage message) {
        messages.add(message);
    }

    List<LoaderMessage> getMessages() {
        return List.copyOf(messages);
    }
}
