package com.earthfile.frontend.builder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Cancellation and deadline carrier handed to every {@link GraphBuilder} call. The interpreter
 * only threads it through; builders decide when to observe it.
 *
 * <p>Contexts form a chain: a child created with {@link #withDeadline(Instant)} is cancelled
 * whenever its parent is, and its effective deadline is the earlier of the two.</p>
 */
public final class BuildContext {
    private final BuildContext parent;
    private final Instant deadline;
    private volatile boolean cancelled;

    private BuildContext(BuildContext parent, Instant deadline) {
        this.parent = parent;
        this.deadline = deadline;
    }

    /** A fresh root context with no deadline. */
    public static BuildContext background() {
        return new BuildContext(null, null);
    }

    public BuildContext withDeadline(Instant deadline) {
        Objects.requireNonNull(deadline, "deadline");
        Instant effective = getDeadline().filter(existing -> existing.isBefore(deadline)).orElse(deadline);
        return new BuildContext(this, effective);
    }

    public BuildContext withTimeout(Duration timeout, Clock clock) {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(clock, "clock");
        return withDeadline(clock.instant().plus(timeout));
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (parent != null && parent.isCancelled());
    }

    public Optional<Instant> getDeadline() {
        if (deadline != null) {
            return Optional.of(deadline);
        }
        return parent == null ? Optional.empty() : parent.getDeadline();
    }

    /** True once cancelled or once the deadline has passed according to {@code clock}. */
    public boolean isDone(Clock clock) {
        if (isCancelled()) {
            return true;
        }
        return getDeadline().map(d -> !clock.instant().isBefore(d)).orElse(false);
    }
}
