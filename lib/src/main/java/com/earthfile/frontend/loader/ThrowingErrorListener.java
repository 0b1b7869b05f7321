package com.earthfile.frontend.loader;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/** Aborts lexing or parsing at the first syntax error, naming the file and position. */
final class ThrowingErrorListener extends BaseErrorListener {
    private final String sourceName;

    ThrowingErrorListener(String sourceName) {
        this.sourceName = sourceName;
    }

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        throw new ParseCancellationException(
                sourceName + ":" + line + ":" + (charPositionInLine + 1) + " " + msg, e);
    }
}
