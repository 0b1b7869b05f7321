package com.earthfile.frontend.loader.semantic;

import java.util.Objects;
import java.util.Set;

/**
 * Tracks which target the walk is in and whether its statements are interpreted. Statements
 * before the first header belong to the {@value #BASE} pseudo-target.
 */
final class TargetFilter {
    static final String BASE = "base";
    private static final Set<String> RESERVED_NAMES = Set.of(BASE, "secrets");

    private final String requestedTarget;
    private String currentTarget = BASE;
    private boolean found;

    TargetFilter(String requestedTarget) {
        this.requestedTarget = Objects.requireNonNull(requestedTarget, "requestedTarget");
    }

    /**
     * Moves to the target declared by a header.
     *
     * @return whether statements of that target are interpreted
     */
    boolean enterTarget(String name) throws StateInvariantException {
        currentTarget = name;
        if (RESERVED_NAMES.contains(name)) {
            throw new StateInvariantException("target name cannot be \"base\" or \"secrets\"");
        }
        if (name.equals(requestedTarget)) {
            if (found) {
                throw new StateInvariantException("target " + name + " is declared twice");
            }
            found = true;
        }
        return isActive();
    }

    boolean isActive() {
        return currentTarget.equals(requestedTarget);
    }

    boolean isInBase() {
        return BASE.equals(currentTarget);
    }

    /** The base pseudo-target never has a header, so requesting it always counts as found. */
    boolean isFound() {
        return found || BASE.equals(requestedTarget);
    }

    String getRequestedTarget() {
        return requestedTarget;
    }

    String getCurrentTarget() {
        return currentTarget;
    }
}
