package com.earthfile.frontend.loader;

import com.earthfile.frontend.builder.BuildContext;
import com.earthfile.frontend.builder.GraphBuilder;
import com.earthfile.frontend.loader.grammar.EarthParser;
import com.earthfile.frontend.loader.semantic.InterpreterListener;
import com.earthfile.frontend.loader.semantic.StatementInterpreter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.tree.ParseTreeWalker;

/**
 * Entry point: parses an Earthfile and interprets one of its targets against a
 * {@link GraphBuilder}. Every builder call happens before {@code load} returns.
 */
public final class EarthfileLoader {
    private static final Logger LOGGER = Logger.getLogger(EarthfileLoader.class.getName());
    private static final int RECENT_TOKEN_COUNT = 10;

    private final EarthfileTreeParser treeParser = new EarthfileTreeParser();

    public LoaderResult load(Path earthfile, String targetName, GraphBuilder builder, BuildContext context)
            throws LoaderException {
        Objects.requireNonNull(earthfile, "earthfile");
        String contents;
        try {
            contents = Files.readString(earthfile, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new LoaderException("Failed to read Earthfile: " + earthfile, ex);
        }
        return load(earthfile.toString(), contents, targetName, builder, context);
    }

    public LoaderResult load(
            String sourceName, String contents, String targetName, GraphBuilder builder, BuildContext context)
            throws LoaderException {
        Objects.requireNonNull(targetName, "targetName");
        List<LoaderMessage> messages = new ArrayList<>();
        EarthParser.EarthFileContext tree;
        try {
            tree = treeParser.parse(sourceName, contents);
        } catch (EarthfileParseException ex) {
            List<String> tokens = drainDebugOutput(sourceName, messages);
            StringBuilder message = new StringBuilder("Failed to parse Earthfile: ").append(ex.getMessage());
            if (!tokens.isEmpty()) {
                message.append("\nRecent tokens:\n");
                for (int i = Math.max(0, tokens.size() - RECENT_TOKEN_COUNT); i < tokens.size(); i++) {
                    message.append("  ").append(tokens.get(i)).append('\n');
                }
            }
            throw new LoaderException(message.toString(), ex);
        }
        drainDebugOutput(sourceName, messages);

        StatementInterpreter interpreter = new StatementInterpreter(sourceName, targetName, builder, context);
        ParseTreeWalker.DEFAULT.walk(new InterpreterListener(interpreter), tree);
        interpreter.finish();
        messages.addAll(interpreter.getMessages());
        LOGGER.log(Level.FINE, "[Earthfile] interpreted {0} of {1}", new Object[] {targetName, sourceName});
        return new LoaderResult(sourceName, targetName, messages);
    }

    private static List<String> drainDebugOutput(String sourceName, List<LoaderMessage> messages) {
        List<String> tokens = new ArrayList<>();
        if (DebugFlags.isTokenDebugEnabled()) {
            for (String tokenLine : DebugFlags.drainCapturedTokens()) {
                tokens.add(tokenLine);
                messages.add(new LoaderMessage(LoaderMessage.Level.INFO, "[tokens] " + tokenLine, sourceName, 0));
            }
        }
        if (DebugFlags.isParserTraceEnabled()) {
            for (String diagnostic : DebugFlags.drainCapturedDiagnostics()) {
                messages.add(
                        new LoaderMessage(LoaderMessage.Level.INFO, "[diagnostic] " + diagnostic, sourceName, 0));
            }
        }
        return tokens;
    }
}
