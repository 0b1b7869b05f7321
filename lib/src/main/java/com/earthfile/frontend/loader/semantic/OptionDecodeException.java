package com.earthfile.frontend.loader.semantic;

/** A statement option is unknown, lacks its value, or carries a value of the wrong type. */
public final class OptionDecodeException extends InterpreterException {
    OptionDecodeException(String message) {
        super(message);
    }

    OptionDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
