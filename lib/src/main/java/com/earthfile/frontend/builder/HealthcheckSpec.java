package com.earthfile.frontend.builder;

import java.time.Duration;
import java.util.List;

/** {@code HEALTHCHECK NONE} ({@code none} set, empty command) or {@code HEALTHCHECK CMD ...}. */
public record HealthcheckSpec(
        boolean none, List<String> command, Duration interval, Duration timeout, Duration startPeriod, int retries) {

    public HealthcheckSpec {
        command = List.copyOf(command);
    }
}
