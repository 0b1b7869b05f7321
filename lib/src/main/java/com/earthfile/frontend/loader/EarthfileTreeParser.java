package com.earthfile.frontend.loader;

import com.earthfile.frontend.loader.grammar.EarthLexer;
import com.earthfile.frontend.loader.grammar.EarthParser;
import java.util.Objects;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/** Lexes and parses an Earthfile into an ANTLR parse tree, failing on the first syntax error. */
public final class EarthfileTreeParser {

    public EarthParser.EarthFileContext parse(String sourceName, String input) throws EarthfileParseException {
        CharStream stream = CharStreams.fromString(input, sourceName);
        return parse(sourceName, stream);
    }

    public EarthParser.EarthFileContext parse(String sourceName, CharStream input) throws EarthfileParseException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(input, "input");
        ThrowingErrorListener errorListener = new ThrowingErrorListener(sourceName);

        EarthLexer lexer = new EarthLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        try {
            if (DebugFlags.isTokenDebugEnabled()) {
                tokens.fill();
                DebugFlags.logTokens(tokens, lexer);
                tokens.seek(0);
            }

            EarthParser parser = new EarthParser(tokens);
            parser.removeErrorListeners();
            parser.addErrorListener(errorListener);
            if (DebugFlags.isParserTraceEnabled()) {
                parser.addErrorListener(DebugFlags.diagnosticListener());
            }
            return parser.earthFile();
        } catch (ParseCancellationException ex) {
            throw new EarthfileParseException(ex.getMessage(), ex);
        }
    }
}
