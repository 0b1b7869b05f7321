package com.earthfile.frontend.loader.semantic;

/** Wrong number or shape of positional arguments, or a malformed ENV/ARG key. */
public final class ArityException extends InterpreterException {
    ArityException(String message) {
        super(message);
    }
}
