package com.earthfile.frontend.loader.semantic;

/** A command replaced by a newer form; the message names the replacement. */
public final class ObsoleteCommandException extends InterpreterException {
    ObsoleteCommandException(String message) {
        super(message);
    }
}
