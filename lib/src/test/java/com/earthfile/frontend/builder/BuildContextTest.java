package com.earthfile.frontend.builder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class BuildContextTest {
    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void backgroundHasNoDeadlineAndIsNotDone() {
        BuildContext context = BuildContext.background();
        assertEquals(Optional.empty(), context.getDeadline());
        assertFalse(context.isDone(CLOCK));
    }

    @Test
    void cancellationFlowsFromParentToChildOnly() {
        BuildContext parent = BuildContext.background();
        BuildContext child = parent.withTimeout(Duration.ofMinutes(1), CLOCK);
        child.cancel();
        assertTrue(child.isCancelled());
        assertFalse(parent.isCancelled());

        BuildContext sibling = parent.withTimeout(Duration.ofMinutes(1), CLOCK);
        parent.cancel();
        assertTrue(sibling.isCancelled());
    }

    @Test
    void earlierDeadlineWins() {
        BuildContext context = BuildContext.background().withTimeout(Duration.ofSeconds(5), CLOCK);
        BuildContext later = context.withDeadline(NOW.plusSeconds(60));
        assertEquals(Optional.of(NOW.plusSeconds(5)), later.getDeadline());
        BuildContext earlier = context.withDeadline(NOW.plusSeconds(1));
        assertEquals(Optional.of(NOW.plusSeconds(1)), earlier.getDeadline());
    }

    @Test
    void doneOnceDeadlineIsReached() {
        BuildContext context = BuildContext.background().withTimeout(Duration.ofSeconds(5), CLOCK);
        assertFalse(context.isDone(CLOCK));
        assertTrue(context.isDone(Clock.fixed(NOW.plusSeconds(5), ZoneOffset.UTC)));
    }
}
