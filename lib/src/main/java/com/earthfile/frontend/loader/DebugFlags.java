package com.earthfile.frontend.loader;

import com.earthfile.frontend.loader.grammar.EarthLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

/**
 * Switches for lexer/parser debugging. System properties win over the environment; captured
 * output is kept per thread so tests can assert on it.
 */
public final class DebugFlags {
    public static final String TOKENS_PROPERTY = "earthfile.debugTokens";
    public static final String PARSER_PROPERTY = "earthfile.debugParser";
    private static final String TOKENS_ENV = "EARTHFILE_DEBUG_TOKENS";
    private static final String PARSER_ENV = "EARTHFILE_DEBUG_PARSER";
    private static final Logger LOGGER = Logger.getLogger(DebugFlags.class.getName());
    private static final ThreadLocal<List<String>> CAPTURED_TOKENS =
            ThreadLocal.withInitial(ArrayList::new);
    private static final ThreadLocal<List<String>> CAPTURED_DIAGNOSTICS =
            ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        return isEnabled(TOKENS_PROPERTY, TOKENS_ENV);
    }

    public static boolean isParserTraceEnabled() {
        return isEnabled(PARSER_PROPERTY, PARSER_ENV);
    }

    private static boolean isEnabled(String property, String env) {
        String value = System.getProperty(property);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(env));
    }

    static void logTokens(CommonTokenStream tokens, EarthLexer lexer) {
        for (Token token : tokens.getTokens()) {
            String symbolic = lexer.getVocabulary().getSymbolicName(token.getType());
            if (symbolic == null) {
                symbolic = String.format(Locale.ROOT, "#%d", token.getType());
            }
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-16s @ %4d:%-3d -> %s",
                            symbolic,
                            token.getLine(),
                            token.getCharPositionInLine(),
                            token.getText().replace("\n", "\\n"));
            LOGGER.log(Level.INFO, "[Earthfile] token {0}", line);
            CAPTURED_TOKENS.get().add(line);
        }
    }

    static DebugDiagnosticErrorListener diagnosticListener() {
        return new DebugDiagnosticErrorListener();
    }

    public static List<String> drainCapturedTokens() {
        List<String> captured = new ArrayList<>(CAPTURED_TOKENS.get());
        CAPTURED_TOKENS.get().clear();
        return captured;
    }

    static void captureDiagnostic(String message) {
        LOGGER.log(Level.FINE, "[Earthfile] parser {0}", message);
        CAPTURED_DIAGNOSTICS.get().add(message);
    }

    public static List<String> drainCapturedDiagnostics() {
        List<String> captured = new ArrayList<>(CAPTURED_DIAGNOSTICS.get());
        CAPTURED_DIAGNOSTICS.get().clear();
        return captured;
    }
}
