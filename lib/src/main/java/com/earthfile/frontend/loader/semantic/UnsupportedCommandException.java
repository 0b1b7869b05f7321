package com.earthfile.frontend.loader.semantic;

/** A recognized command, form or option that is deliberately not implemented. */
public final class UnsupportedCommandException extends InterpreterException {
    UnsupportedCommandException(String message) {
        super(message);
    }
}
