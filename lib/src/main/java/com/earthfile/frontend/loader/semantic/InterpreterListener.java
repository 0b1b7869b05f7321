package com.earthfile.frontend.loader.semantic;

import com.earthfile.frontend.loader.grammar.EarthParser;
import com.earthfile.frontend.loader.grammar.EarthParserBaseListener;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Turns parse-tree walk events into {@link Statement} values for a {@link StatementInterpreter}.
 * The statement under construction lives from {@code enterStmt} to {@code exitStmt} only.
 */
public final class InterpreterListener extends EarthParserBaseListener {
    private static final Pattern LINE_CONTINUATION = Pattern.compile("\\\\[ \\t]*(\\n|\\r\\n)[\\t ]*");

    private final StatementInterpreter interpreter;
    private Statement.Builder current;

    public InterpreterListener(StatementInterpreter interpreter) {
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
    }

    @Override
    public void enterTargetHeader(EarthParser.TargetHeaderContext ctx) {
        String header = ctx.getText();
        String name = header.endsWith(":") ? header.substring(0, header.length() - 1) : header;
        interpreter.enterTarget(name, ctx.getStart().getLine());
    }

    @Override
    public void exitStmts(EarthParser.StmtsContext ctx) {
        interpreter.exitStatements(ctx.getStop() == null ? 0 : ctx.getStop().getLine());
    }

    @Override
    public void enterStmt(EarthParser.StmtContext ctx) {
        current = Statement.builder(kindOf(ctx.getStart()))
                .text(originalText(ctx))
                .line(ctx.getStart().getLine());
    }

    @Override
    public void exitStmt(EarthParser.StmtContext ctx) {
        Statement statement = current.build();
        current = null;
        interpreter.execute(statement);
    }

    @Override
    public void enterStmtWord(EarthParser.StmtWordContext ctx) {
        current.word(removeLineContinuations(ctx.getText()));
    }

    @Override
    public void exitStmtWordsMaybeJSON(EarthParser.StmtWordsMaybeJSONContext ctx) {
        List<String> words = current.currentWords();
        ExecForm.parse(words).ifPresent(elements -> current.words(elements, true));
    }

    @Override
    public void enterEnvArgKey(EarthParser.EnvArgKeyContext ctx) {
        current.key(ctx.getText());
    }

    @Override
    public void enterEnvArgValue(EarthParser.EnvArgValueContext ctx) {
        current.value(removeLineContinuations(ctx.getText()).stripTrailing());
    }

    @Override
    public void enterLabelKey(EarthParser.LabelKeyContext ctx) {
        current.key(removeLineContinuations(ctx.getText()));
    }

    @Override
    public void enterLabelValue(EarthParser.LabelValueContext ctx) {
        current.value(removeLineContinuations(ctx.getText()));
    }

    static String removeLineContinuations(String text) {
        return LINE_CONTINUATION.matcher(text).replaceAll("");
    }

    private static String originalText(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        if (stop == null || stop.getStopIndex() < start.getStartIndex()) {
            return ctx.getText();
        }
        String text = start.getInputStream().getText(Interval.of(start.getStartIndex(), stop.getStopIndex()));
        return removeLineContinuations(text).strip();
    }

    private static StatementKind kindOf(Token keyword) {
        return switch (keyword.getType()) {
            case EarthParser.FROM -> StatementKind.FROM;
            case EarthParser.FROM_DOCKERFILE -> StatementKind.FROM_DOCKERFILE;
            case EarthParser.COPY -> StatementKind.COPY;
            case EarthParser.SAVE_ARTIFACT -> StatementKind.SAVE_ARTIFACT;
            case EarthParser.SAVE_IMAGE -> StatementKind.SAVE_IMAGE;
            case EarthParser.RUN -> StatementKind.RUN;
            case EarthParser.BUILD -> StatementKind.BUILD;
            case EarthParser.WORKDIR -> StatementKind.WORKDIR;
            case EarthParser.USER -> StatementKind.USER;
            case EarthParser.CMD -> StatementKind.CMD;
            case EarthParser.ENTRYPOINT -> StatementKind.ENTRYPOINT;
            case EarthParser.EXPOSE -> StatementKind.EXPOSE;
            case EarthParser.VOLUME -> StatementKind.VOLUME;
            case EarthParser.ENV -> StatementKind.ENV;
            case EarthParser.ARG -> StatementKind.ARG;
            case EarthParser.LABEL -> StatementKind.LABEL;
            case EarthParser.GIT_CLONE -> StatementKind.GIT_CLONE;
            case EarthParser.ADD -> StatementKind.ADD;
            case EarthParser.STOPSIGNAL -> StatementKind.STOPSIGNAL;
            case EarthParser.ONBUILD -> StatementKind.ONBUILD;
            case EarthParser.HEALTHCHECK -> StatementKind.HEALTHCHECK;
            case EarthParser.SHELL -> StatementKind.SHELL;
            case EarthParser.WITH_DOCKER -> StatementKind.WITH_DOCKER;
            case EarthParser.END -> StatementKind.END;
            case EarthParser.DOCKER_LOAD -> StatementKind.DOCKER_LOAD;
            case EarthParser.DOCKER_PULL -> StatementKind.DOCKER_PULL;
            case EarthParser.GenericCommand -> StatementKind.GENERIC;
            default -> throw new IllegalStateException(
                    "unexpected statement keyword " + keyword.getText() + " at line " + keyword.getLine());
        };
    }
}
