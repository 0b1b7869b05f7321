package com.earthfile.frontend.domain;

/** Checked exception raised when a target, artifact or platform string cannot be parsed. */
public final class ReferenceParseException extends Exception {
    public ReferenceParseException(String message) {
        super(message);
    }
}
