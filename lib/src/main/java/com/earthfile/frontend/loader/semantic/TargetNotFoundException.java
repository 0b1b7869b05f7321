package com.earthfile.frontend.loader.semantic;

/** The requested target has no header anywhere in the file. */
public final class TargetNotFoundException extends InterpreterException {
    TargetNotFoundException(String message) {
        super(message);
    }
}
