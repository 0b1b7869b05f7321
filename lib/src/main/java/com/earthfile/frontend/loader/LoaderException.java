package com.earthfile.frontend.loader;

/**
 * Checked exception signalling that an Earthfile could not be read, parsed or interpreted.
 * Interpretation failures use the more specific subclasses in the semantic package.
 */
public class LoaderException extends Exception {
    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
