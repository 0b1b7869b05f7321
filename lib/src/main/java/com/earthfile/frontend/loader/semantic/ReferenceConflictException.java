package com.earthfile.frontend.loader.semantic;

/** Arguments or options that cannot be combined in one statement. */
public final class ReferenceConflictException extends InterpreterException {
    ReferenceConflictException(String message) {
        super(message);
    }
}
