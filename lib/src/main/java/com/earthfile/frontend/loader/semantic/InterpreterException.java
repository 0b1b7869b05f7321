package com.earthfile.frontend.loader.semantic;

import com.earthfile.frontend.loader.LoaderException;

/**
 * Base of the interpreter's error taxonomy. The first one raised while walking a file becomes
 * the terminal outcome of the walk; later statements are not interpreted.
 */
public abstract class InterpreterException extends LoaderException {
    private int line;

    protected InterpreterException(String message) {
        super(message);
    }

    protected InterpreterException(String message, Throwable cause) {
        super(message, cause);
    }

    /** 1-based line of the statement that failed, or 0 for failures detected after the walk. */
    public int getLine() {
        return line;
    }

    void setLine(int line) {
        this.line = line;
    }
}
