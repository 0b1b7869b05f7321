package com.earthfile.frontend.loader;

import java.util.BitSet;
import org.antlr.v4.runtime.DiagnosticErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.atn.ATNConfigSet;
import org.antlr.v4.runtime.dfa.DFA;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Records ambiguity and full-context reports from the Earthfile parser through {@link DebugFlags}.
 *
 * <p>The stock {@link DiagnosticErrorListener} routes these reports through
 * {@link Parser#notifyErrorListeners(String)}, where {@link ThrowingErrorListener} would turn them
 * into a failed parse. The grammar's optional newline runs are ambiguous by construction, so they
 * are captured here instead.</p>
 */
final class DebugDiagnosticErrorListener extends DiagnosticErrorListener {

    DebugDiagnosticErrorListener() {
        super(true);
    }

    @Override
    public void reportAmbiguity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            boolean exact,
            BitSet ambigAlts,
            ATNConfigSet configs) {
        if (exactOnly && !exact) {
            return;
        }
        DebugFlags.captureDiagnostic(
                String.format(
                        "ambiguity in %s: alts=%s, input='%s'",
                        getDecisionDescription(recognizer, dfa),
                        getConflictingAlts(ambigAlts, configs),
                        inputText(recognizer, startIndex, stopIndex)));
    }

    @Override
    public void reportAttemptingFullContext(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            BitSet conflictingAlts,
            ATNConfigSet configs) {
        DebugFlags.captureDiagnostic(
                String.format(
                        "full context in %s: input='%s'",
                        getDecisionDescription(recognizer, dfa),
                        inputText(recognizer, startIndex, stopIndex)));
    }

    @Override
    public void reportContextSensitivity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            int prediction,
            ATNConfigSet configs) {
        DebugFlags.captureDiagnostic(
                String.format(
                        "context sensitivity in %s: prediction=%d, input='%s'",
                        getDecisionDescription(recognizer, dfa),
                        prediction,
                        inputText(recognizer, startIndex, stopIndex)));
    }

    private static String inputText(Parser recognizer, int startIndex, int stopIndex) {
        return recognizer.getTokenStream().getText(Interval.of(startIndex, stopIndex));
    }
}
