package com.earthfile.frontend.builder;

/** Checked exception a {@link GraphBuilder} raises when it cannot apply a build step. */
public class GraphBuilderException extends Exception {
    public GraphBuilderException(String message) {
        super(message);
    }

    public GraphBuilderException(String message, Throwable cause) {
        super(message, cause);
    }
}
