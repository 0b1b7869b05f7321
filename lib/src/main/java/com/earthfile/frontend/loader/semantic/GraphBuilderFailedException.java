package com.earthfile.frontend.loader.semantic;

import com.earthfile.frontend.builder.GraphBuilderException;

/** A {@link com.earthfile.frontend.builder.GraphBuilder} call failed while applying a statement. */
public final class GraphBuilderFailedException extends InterpreterException {
    GraphBuilderFailedException(String action, GraphBuilderException cause) {
        super(action + ": " + cause.getMessage(), cause);
    }
}
