package com.earthfile.frontend.loader;

/** Raised when the lexer or parser rejects an Earthfile; the message carries {@code source:line:column}. */
public final class EarthfileParseException extends Exception {
    public EarthfileParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
