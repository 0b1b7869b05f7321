package com.earthfile.frontend.tools;

import com.earthfile.frontend.Version;
import com.earthfile.frontend.builder.BuildContext;
import com.earthfile.frontend.builder.BuilderCall;
import com.earthfile.frontend.builder.RecordingGraphBuilder;
import com.earthfile.frontend.loader.DebugFlags;
import com.earthfile.frontend.loader.EarthfileLoader;
import com.earthfile.frontend.loader.LoaderException;
import com.earthfile.frontend.loader.LoaderMessage;
import com.earthfile.frontend.loader.LoaderResult;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Interprets one target of an Earthfile without building anything and prints the builder calls
 * it would make, one per line.
 */
public final class EarthfileDryRunCli {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILED = 2;
    private static final String USAGE =
            "Usage: EarthfileDryRunCli [--build-arg KEY=VALUE]... [--verbose] [--debug-tokens] <Earthfile> <target>";

    private EarthfileDryRunCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Map<String, String> buildArgs = new LinkedHashMap<>();
        List<String> positionals = new ArrayList<>();
        boolean verbose = false;
        boolean debugTokens = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--version".equals(arg)) {
                out.println(Version.RUNTIME);
                return EXIT_OK;
            } else if ("--help".equals(arg) || "-h".equals(arg)) {
                out.println(USAGE);
                return EXIT_OK;
            } else if ("--verbose".equals(arg)) {
                verbose = true;
            } else if ("--debug-tokens".equals(arg)) {
                debugTokens = true;
            } else if ("--build-arg".equals(arg) || arg.startsWith("--build-arg=")) {
                String value;
                if (arg.startsWith("--build-arg=")) {
                    value = arg.substring("--build-arg=".length());
                } else if (i + 1 < args.length) {
                    value = args[++i];
                } else {
                    return usage(err, "--build-arg needs a KEY=VALUE argument");
                }
                int equals = value.indexOf('=');
                if (equals <= 0) {
                    return usage(err, "invalid --build-arg " + value + ", expected KEY=VALUE");
                }
                buildArgs.put(value.substring(0, equals), value.substring(equals + 1));
            } else if (arg.startsWith("-") && arg.length() > 1) {
                return usage(err, "unknown option " + arg);
            } else {
                positionals.add(arg);
            }
        }
        if (positionals.size() != 2) {
            return usage(err, "expected an Earthfile and a target name");
        }
        Path earthfile = Path.of(positionals.get(0));
        if (!Files.isRegularFile(earthfile)) {
            err.println("Earthfile not found: " + earthfile);
            return EXIT_FAILED;
        }
        if (verbose) {
            enableVerboseLogging();
        }
        String previousTokenSetting = null;
        if (debugTokens) {
            previousTokenSetting = System.setProperty(DebugFlags.TOKENS_PROPERTY, "true");
        }
        try {
            RecordingGraphBuilder builder = new RecordingGraphBuilder(buildArgs);
            LoaderResult result = null;
            LoaderException failure = null;
            try {
                result = new EarthfileLoader().load(earthfile, positionals.get(1), builder, BuildContext.background());
            } catch (LoaderException ex) {
                failure = ex;
            }
            for (BuilderCall call : builder.getCalls()) {
                out.println(call);
            }
            if (failure != null) {
                err.println("Error: " + failure.getMessage());
                return EXIT_FAILED;
            }
            for (LoaderMessage message : result.getMessages()) {
                if (message.getLevel() != LoaderMessage.Level.INFO || debugTokens) {
                    out.println(message.format());
                }
            }
            return EXIT_OK;
        } finally {
            if (debugTokens) {
                restoreProperty(DebugFlags.TOKENS_PROPERTY, previousTokenSetting);
            }
        }
    }

    private static int usage(PrintStream err, String problem) {
        err.println(problem);
        err.println(USAGE);
        return EXIT_USAGE;
    }

    private static void restoreProperty(String name, String previous) {
        if (previous == null) {
            System.clearProperty(name);
        } else {
            System.setProperty(name, previous);
        }
    }

    private static void enableVerboseLogging() {
        Logger frontendLogger = Logger.getLogger("com.earthfile.frontend");
        frontendLogger.setLevel(Level.FINE);
        boolean hasConsole = false;
        for (Handler handler : frontendLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler console) {
                console.setLevel(Level.FINE);
                hasConsole = true;
            }
        }
        if (!hasConsole) {
            ConsoleHandler handler = new ConsoleHandler();
            handler.setLevel(Level.FINE);
            frontendLogger.addHandler(handler);
        }
    }
}
