package com.earthfile.frontend.loader.semantic;

import com.earthfile.frontend.builder.ArtifactCopy;
import com.earthfile.frontend.builder.ArtifactSave;
import com.earthfile.frontend.builder.BuildContext;
import com.earthfile.frontend.builder.ClassicalCopy;
import com.earthfile.frontend.builder.DockerLoad;
import com.earthfile.frontend.builder.DockerPull;
import com.earthfile.frontend.builder.GraphBuilder;
import com.earthfile.frontend.builder.GraphBuilderException;
import com.earthfile.frontend.builder.HealthcheckSpec;
import com.earthfile.frontend.builder.ImageSave;
import com.earthfile.frontend.builder.RunCommand;
import com.earthfile.frontend.domain.ArtifactRef;
import com.earthfile.frontend.domain.Platform;
import com.earthfile.frontend.domain.ReferenceParseException;
import com.earthfile.frontend.loader.LoaderMessage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Interprets the statements of one requested target and drives a {@link GraphBuilder} with them.
 *
 * <p>The tree walk reports target headers, the end of each statement block and every completed
 * {@link Statement}, in document order. Statements outside the requested target are ignored, as
 * is everything after the first failure; that failure is reported by {@link #finish()}.</p>
 *
 * <p>Words are expanded in one of two ways. Words that name another target or artifact keep
 * escaped markers so they can be parsed afterwards; everything else is expanded to its literal
 * value. Shell-form RUN, CMD and ENTRYPOINT words are not expanded at all, the shell does that
 * when the command runs.</p>
 */
public final class StatementInterpreter {
    private static final Logger LOGGER = Logger.getLogger(StatementInterpreter.class.getName());
    private static final Pattern ENV_KEY = Pattern.compile("^[a-zA-Z_]+[a-zA-Z0-9_]*$");
    private static final String IMPLICIT_BASE = "+base";
    private static final String SAVE_IMAGE_DEPRECATION =
            "Deprecation: using SAVE IMAGE with no arguments is no longer necessary and can be safely removed";

    private static final OptionSpec FROM_OPTIONS =
            OptionSpec.builder("FROM").list("build-arg").string("platform").build();
    private static final OptionSpec FROM_DOCKERFILE_OPTIONS =
            OptionSpec.builder("FROM DOCKERFILE")
                    .list("build-arg")
                    .string("platform")
                    .string("target")
                    .string("f")
                    .build();
    private static final OptionSpec COPY_OPTIONS =
            OptionSpec.builder("COPY")
                    .string("from")
                    .flag("dir")
                    .string("chown")
                    .flag("keep-ts")
                    .flag("keep-own")
                    .flag("if-exists")
                    .string("platform")
                    .list("build-arg")
                    .build();
    private static final OptionSpec RUN_OPTIONS =
            OptionSpec.builder("RUN")
                    .flag("push")
                    .flag("privileged")
                    .flag("entrypoint")
                    .flag("with-docker")
                    .flag("ssh")
                    .list("secret")
                    .list("mount")
                    .build();
    private static final OptionSpec SAVE_ARTIFACT_OPTIONS =
            OptionSpec.builder("SAVE").flag("keep-ts").flag("keep-own").flag("if-exists").build();
    private static final OptionSpec SAVE_IMAGE_OPTIONS =
            OptionSpec.builder("SAVE IMAGE")
                    .flag("push")
                    .flag("cache-hint")
                    .flag("insecure")
                    .list("cache-from")
                    .build();
    private static final OptionSpec BUILD_OPTIONS =
            OptionSpec.builder("BUILD").list("platform").list("build-arg").build();
    private static final OptionSpec GIT_CLONE_OPTIONS =
            OptionSpec.builder("GIT CLONE").string("branch").flag("keep-ts").build();
    private static final OptionSpec HEALTHCHECK_OPTIONS =
            OptionSpec.builder("HEALTHCHECK")
                    .duration("interval", Duration.ofSeconds(30))
                    .duration("timeout", Duration.ofSeconds(30))
                    .duration("start-period", Duration.ZERO)
                    .integer("retries", 3)
                    .build();
    private static final OptionSpec WITH_DOCKER_OPTIONS =
            OptionSpec.builder("WITH DOCKER")
                    .list("compose")
                    .list("service")
                    .list("load")
                    .string("platform")
                    .list("build-arg")
                    .list("pull")
                    .build();

    @FunctionalInterface
    private interface Handler {
        void apply(Statement statement) throws InterpreterException;
    }

    @FunctionalInterface
    private interface BuilderAction {
        void run() throws GraphBuilderException;
    }

    private final String sourceName;
    private final GraphBuilder builder;
    private final BuildContext context;
    private final ArgExpander expander;
    private final InterpreterState state;
    private final Map<StatementKind, Handler> handlers = new EnumMap<>(StatementKind.class);

    public StatementInterpreter(String sourceName, String targetName, GraphBuilder builder, BuildContext context) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.context = Objects.requireNonNull(context, "context");
        this.expander = new ArgExpander(builder);
        this.state = new InterpreterState(Objects.requireNonNull(targetName, "targetName"));
        for (StatementKind kind : StatementKind.values()) {
            handlers.put(kind, handlerFor(kind));
        }
    }

    private Handler handlerFor(StatementKind kind) {
        return switch (kind) {
            case FROM -> this::applyFrom;
            case FROM_DOCKERFILE -> this::applyFromDockerfile;
            case COPY -> this::applyCopy;
            case SAVE_ARTIFACT -> this::applySaveArtifact;
            case SAVE_IMAGE -> this::applySaveImage;
            case RUN -> this::applyRun;
            case BUILD -> this::applyBuild;
            case WORKDIR -> this::applyWorkdir;
            case USER -> this::applyUser;
            case CMD -> this::applyCmd;
            case ENTRYPOINT -> this::applyEntrypoint;
            case EXPOSE -> this::applyExpose;
            case VOLUME -> this::applyVolume;
            case ENV -> this::applyEnv;
            case ARG -> this::applyArg;
            case LABEL -> this::applyLabel;
            case GIT_CLONE -> this::applyGitClone;
            case HEALTHCHECK -> this::applyHealthcheck;
            case WITH_DOCKER -> this::applyWithDocker;
            case END -> this::applyEnd;
            case ADD, STOPSIGNAL, SHELL -> statement -> {
                throw new UnsupportedCommandException("command " + kind.keyword() + " not yet supported");
            };
            case ONBUILD -> statement -> {
                throw new UnsupportedCommandException("command ONBUILD not supported");
            };
            case DOCKER_LOAD -> statement -> {
                throw new ObsoleteCommandException("DOCKER LOAD is obsolete. Please use WITH DOCKER --load");
            };
            case DOCKER_PULL -> statement -> {
                throw new ObsoleteCommandException("DOCKER PULL is obsolete. Please use WITH DOCKER --pull");
            };
            case GENERIC -> statement -> {
                throw new UnsupportedCommandException("invalid command " + statement.getText());
            };
        };
    }

    // Walk events.

    /** A target header was reached. Starts the target from {@code +base} when it is the one requested. */
    public void enterTarget(String name, int line) {
        if (state.hasError()) {
            return;
        }
        try {
            boolean active = state.getFilter().enterTarget(name);
            state.setPushOnly(false);
            if (active) {
                apply("apply implicit FROM " + IMPLICIT_BASE,
                        () -> builder.fromImage(context, IMPLICIT_BASE, null, List.of()));
            }
        } catch (InterpreterException ex) {
            fail(ex, line);
        }
    }

    /** The statement block of the current target (or of the base recipe) ended. */
    public void exitStatements(int line) {
        if (state.shouldSkip()) {
            return;
        }
        try {
            state.getWithDocker().requireClosed();
        } catch (InterpreterException ex) {
            fail(ex, line);
        }
    }

    public void execute(Statement statement) {
        Objects.requireNonNull(statement, "statement");
        if (state.shouldSkip()) {
            return;
        }
        try {
            if (state.isPushOnly() && !statement.getKind().isPushQualified()) {
                throw pushOnlyViolation(statement);
            }
            handlers.get(statement.getKind()).apply(statement);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.log(Level.FINE, "[Earthfile] {0}:{1} applied {2}",
                        new Object[] {sourceName, statement.getLine(), statement});
            }
        } catch (InterpreterException ex) {
            fail(ex, statement.getLine());
        }
    }

    /** True once a statement failed; nothing else is interpreted after that. */
    public boolean hasFailed() {
        return state.hasError();
    }

    public List<LoaderMessage> getMessages() {
        return state.getMessages();
    }

    /**
     * Ends the walk.
     *
     * @throws InterpreterException the first failure of the walk, or {@link TargetNotFoundException}
     *     when the requested target was never declared
     */
    public void finish() throws InterpreterException {
        if (state.hasError()) {
            throw state.getError();
        }
        if (!state.getFilter().isFound()) {
            throw new TargetNotFoundException("target " + state.getFilter().getRequestedTarget() + " not defined");
        }
    }

    private void fail(InterpreterException failure, int line) {
        if (failure.getLine() == 0) {
            failure.setLine(line);
        }
        if (state.latch(failure)) {
            LOGGER.log(Level.FINE, "[Earthfile] {0}:{1} failed: {2}",
                    new Object[] {sourceName, line, failure.getMessage()});
        }
    }

    // Statement handlers.

    private void applyFrom(Statement statement) throws InterpreterException {
        DecodedOptions options = OptionDecoder.decode(FROM_OPTIONS, statement.getWords());
        if (options.positionalCount() != 1) {
            if (options.positionalCount() == 3 && "AS".equals(options.positional(1))) {
                throw new UnsupportedCommandException("AS not supported, use earthly targets instead");
            }
            throw new ArityException("invalid number of arguments for FROM: " + statement.wordsForMessage());
        }
        String imageName = expander.reference(options.positional(0));
        Platform platform = platform(options.string("platform"));
        List<String> buildArgs = expander.reference(options.list("build-arg"));
        apply("apply FROM " + imageName, () -> builder.fromImage(context, imageName, platform, buildArgs));
    }

    private void applyFromDockerfile(Statement statement) throws InterpreterException {
        DecodedOptions options = OptionDecoder.decode(FROM_DOCKERFILE_OPTIONS, statement.getWords());
        if (options.positionalCount() != 1) {
            throw new ArityException(
                    "invalid number of arguments for FROM DOCKERFILE: " + statement.wordsForMessage());
        }
        String dockerfilePath = expander.literal(options.string("f"));
        if (!dockerfilePath.isEmpty()) {
            throw new UnsupportedCommandException("FROM DOCKERFILE -f is not supported: " + statement.wordsForMessage());
        }
        String contextPath = artifactOrLiteral(options.positional(0));
        List<String> buildArgs = expander.reference(options.list("build-arg"));
        Platform platform = platform(options.string("platform"));
        String stageName = expander.literal(options.string("target"));
        apply("apply FROM DOCKERFILE " + contextPath,
                () -> builder.fromDockerfile(context, contextPath, dockerfilePath, stageName, platform, buildArgs));
    }

    private void applyCopy(Statement statement) throws InterpreterException {
        DecodedOptions options = OptionDecoder.decode(COPY_OPTIONS, statement.getWords());
        if (options.positionalCount() < 2) {
            throw new ArityException("not enough COPY arguments " + statement.wordsForMessage());
        }
        if (!options.string("from").isEmpty()) {
            throw new UnsupportedCommandException("COPY --from not implemented. Use COPY artifacts form instead");
        }
        List<String> positionals = options.positionals();
        String destination = expander.literal(positionals.get(positionals.size() - 1));
        List<String> buildArgs = expander.reference(options.list("build-arg"));
        String chown = expander.literal(options.string("chown"));
        Platform platform = platform(options.string("platform"));

        List<String> sources = new ArrayList<>();
        List<String> artifacts = new ArrayList<>();
        List<String> paths = new ArrayList<>();
        for (String source : positionals.subList(0, positionals.size() - 1)) {
            try {
                String artifact = ArtifactRef.parse(expander.reference(source)).toString();
                artifacts.add(artifact);
                sources.add(artifact);
            } catch (ReferenceParseException notAnArtifact) {
                String path = expander.literal(source);
                paths.add(path);
                sources.add(path);
            }
        }
        if (!artifacts.isEmpty() && !paths.isEmpty()) {
            throw new ReferenceConflictException(
                    "combining artifacts and build context arguments in a single COPY command is not allowed: ["
                            + String.join(" ", sources) + "]");
        }
        boolean dirCopy = options.flag("dir");
        boolean keepTs = options.flag("keep-ts");
        boolean keepOwn = options.flag("keep-own");
        if (paths.isEmpty()) {
            boolean ifExists = options.flag("if-exists");
            for (String artifact : artifacts) {
                ArtifactCopy copy = new ArtifactCopy(
                        artifact, destination, platform, buildArgs, dirCopy, keepTs, keepOwn, chown, ifExists);
                apply("apply COPY " + artifact, () -> builder.copyArtifact(context, copy));
            }
            return;
        }
        if (!buildArgs.isEmpty()) {
            throw new ReferenceConflictException(
                    "build args not supported for non +artifact arguments case " + statement.wordsForMessage());
        }
        ClassicalCopy copy = new ClassicalCopy(paths, destination, dirCopy, keepTs, keepOwn, chown);
        apply("apply COPY " + String.join(" ", paths), () -> builder.copyClassical(context, copy));
    }

    private void applyRun(Statement statement) throws InterpreterException {
        DecodedOptions options = OptionDecoder.decode(RUN_OPTIONS, statement.getWords());
        if (options.positionalCount() == 0) {
            throw new ArityException("not enough arguments for RUN");
        }
        boolean push = options.flag("push");
        boolean withDocker = options.flag("with-docker");
        boolean privileged = options.flag("privileged") || withDocker;
        boolean withEntrypoint = options.flag("entrypoint");
        boolean withShell = !statement.isExecMode();
        if (!push && state.isPushOnly()) {
            throw pushOnlyViolation(statement);
        }
        List<String> secrets = expander.reference(options.list("secret"));
        List<String> mounts = expander.literal(options.list("mount"));
        List<String> args = withShell ? options.positionals() : expander.literal(options.positionals());

        WithDockerTracker tracker = state.getWithDocker();
        if (!tracker.isOpen()) {
            RunCommand command = new RunCommand(
                    args, mounts, secrets, privileged, withEntrypoint, withDocker, withShell, push, options.flag("ssh"));
            apply("apply RUN", () -> builder.run(context, command));
            if (push) {
                state.setPushOnly(true);
            }
            return;
        }
        if (push) {
            throw new ReferenceConflictException("RUN --push not allowed in WITH DOCKER");
        }
        WithDockerBlock block = tracker.beginRun();
        apply("apply WITH DOCKER RUN",
                () -> builder.runWithDocker(context, args, block.toSpec(mounts, secrets, withShell, withEntrypoint)));
    }

    private void applySaveArtifact(Statement statement) throws InterpreterException {
        DecodedOptions options = OptionDecoder.decode(SAVE_ARTIFACT_OPTIONS, statement.getWords());
        int count = options.positionalCount();
        if (count == 0) {
            throw new ArityException("no arguments provided to the SAVE ARTIFACT command");
        }
        if (count > 5) {
            throw new ArityException(
                    "too many arguments provided to the SAVE ARTIFACT command: " + statement.wordsForMessage());
        }
        String saveTo = "./";
        String saveAsLocalTo = "";
        if (count >= 4) {
            if (!"AS".equals(options.positional(count - 3)) || !"LOCAL".equals(options.positional(count - 2))) {
                throw new ArityException("invalid arguments for SAVE ARTIFACT command: " + statement.wordsForMessage());
            }
            saveAsLocalTo = options.positional(count - 1);
            if (count == 5) {
                saveTo = options.positional(1);
            }
        } else if (count == 2) {
            saveTo = options.positional(1);
        } else if (count == 3) {
            throw new ArityException("invalid arguments for SAVE ARTIFACT command: " + statement.wordsForMessage());
        }
        ArtifactSave save = new ArtifactSave(
                expander.literal(options.positional(0)),
                expander.literal(saveTo),
                expander.literal(saveAsLocalTo),
                options.flag("keep-ts"),
                options.flag("keep-own"),
                options.flag("if-exists"));
        apply("apply SAVE ARTIFACT " + save.source(), () -> builder.saveArtifact(context, save));
    }

    private void applySaveImage(Statement statement) throws InterpreterException {
        DecodedOptions options = OptionDecoder.decode(SAVE_IMAGE_OPTIONS, statement.getWords());
        boolean push = options.flag("push");
        boolean cacheHint = options.flag("cache-hint");
        List<String> cacheFrom = expander.literal(options.list("cache-from"));
        if (!push && state.isPushOnly()) {
            throw pushOnlyViolation(statement);
        }
        if (push && options.positionalCount() == 0) {
            throw new ArityException("invalid number of arguments for SAVE IMAGE --push: " + statement.wordsForMessage());
        }
        List<String> imageNames = expander.literal(options.positionals());
        if (imageNames.isEmpty() && !cacheHint && cacheFrom.isEmpty()) {
            LOGGER.log(Level.WARNING, "[Earthfile] {0}:{1} {2}",
                    new Object[] {sourceName, statement.getLine(), SAVE_IMAGE_DEPRECATION});
            state.addMessage(new LoaderMessage(
                    LoaderMessage.Level.WARNING, SAVE_IMAGE_DEPRECATION, sourceName, statement.getLine()));
            return;
        }
        ImageSave save = new ImageSave(imageNames, push, options.flag("insecure"), cacheHint, cacheFrom);
        apply("apply SAVE IMAGE", () -> builder.saveImage(context, save));
        if (push) {
            state.setPushOnly(true);
        }
    }

    private void applyBuild(Statement statement) throws InterpreterException {
        DecodedOptions options = OptionDecoder.decode(BUILD_OPTIONS, statement.getWords());
        if (options.positionalCount() != 1) {
            throw new ArityException("invalid number of arguments for BUILD: " + statement.wordsForMessage());
        }
        String targetName = expander.reference(options.positional(0));
        List<Platform> platforms = new ArrayList<>();
        for (String raw : options.list("platform")) {
            platforms.add(platform(raw));
        }
        List<String> buildArgs = expander.reference(options.list("build-arg"));
        if (platforms.isEmpty()) {
            platforms = Collections.singletonList(null);
        }
        for (Platform platform : platforms) {
            apply("apply BUILD " + targetName, () -> builder.build(context, targetName, platform, buildArgs));
        }
    }

    private void applyWorkdir(Statement statement) throws InterpreterException {
        String path = expander.literal(single(statement));
        apply("apply WORKDIR " + path, () -> builder.workdir(context, path));
    }

    private void applyUser(Statement statement) throws InterpreterException {
        String user = expander.literal(single(statement));
        apply("apply USER " + user, () -> builder.user(context, user));
    }

    private void applyCmd(Statement statement) throws InterpreterException {
        boolean withShell = !statement.isExecMode();
        List<String> args = withShell ? statement.getWords() : expander.literal(statement.getWords());
        apply("apply CMD", () -> builder.cmd(context, args, withShell));
    }

    private void applyEntrypoint(Statement statement) throws InterpreterException {
        boolean withShell = !statement.isExecMode();
        List<String> args = withShell ? statement.getWords() : expander.literal(statement.getWords());
        apply("apply ENTRYPOINT", () -> builder.entrypoint(context, args, withShell));
    }

    private void applyExpose(Statement statement) throws InterpreterException {
        List<String> ports = expander.literal(atLeastOne(statement));
        apply("apply EXPOSE", () -> builder.expose(context, ports));
    }

    private void applyVolume(Statement statement) throws InterpreterException {
        List<String> volumes = expander.literal(atLeastOne(statement));
        apply("apply VOLUME", () -> builder.volume(context, volumes));
    }

    private void applyEnv(Statement statement) throws InterpreterException {
        String key = envKey(statement);
        String value = expander.literal(statement.getValue());
        apply("apply ENV " + key, () -> builder.env(context, key, value));
    }

    private void applyArg(Statement statement) throws InterpreterException {
        String key = envKey(statement);
        String value = expander.reference(statement.getValue());
        boolean global = state.getFilter().isInBase();
        apply("apply ARG " + key, () -> builder.arg(context, key, value, global));
    }

    private void applyLabel(Statement statement) throws InterpreterException {
        List<String> keys = statement.getKeys();
        List<String> values = statement.getValues();
        if (keys.isEmpty()) {
            throw new ArityException("no labels provided in LABEL command: " + statement.getText());
        }
        if (keys.size() != values.size()) {
            throw new ArityException("label keys and values do not match: " + statement.getText());
        }
        Map<String, String> labels = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            labels.put(expander.literal(keys.get(i)), expander.literal(values.get(i)));
        }
        apply("apply LABEL", () -> builder.label(context, labels));
    }

    private void applyGitClone(Statement statement) throws InterpreterException {
        DecodedOptions options = OptionDecoder.decode(GIT_CLONE_OPTIONS, statement.getWords());
        if (options.positionalCount() != 2) {
            throw new ArityException("invalid number of arguments for GIT CLONE: " + statement.wordsForMessage());
        }
        String gitUrl = expander.literal(options.positional(0));
        String destination = expander.literal(options.positional(1));
        String branch = expander.literal(options.string("branch"));
        boolean keepTs = options.flag("keep-ts");
        apply("apply GIT CLONE " + gitUrl, () -> builder.gitClone(context, gitUrl, branch, destination, keepTs));
    }

    private void applyHealthcheck(Statement statement) throws InterpreterException {
        DecodedOptions options = OptionDecoder.decode(HEALTHCHECK_OPTIONS, statement.getWords());
        if (options.positionalCount() == 0) {
            throw new ArityException("invalid number of arguments for HEALTHCHECK: " + statement.wordsForMessage());
        }
        boolean none;
        List<String> command;
        String mode = options.positional(0);
        if ("NONE".equals(mode)) {
            if (options.positionalCount() != 1) {
                throw new ArityException("invalid arguments for HEALTHCHECK: " + statement.wordsForMessage());
            }
            none = true;
            command = List.of();
        } else if ("CMD".equals(mode)) {
            if (options.positionalCount() == 1) {
                throw new ArityException(
                        "invalid number of arguments for HEALTHCHECK CMD: " + statement.wordsForMessage());
            }
            none = false;
            command = expander.literal(options.positionals().subList(1, options.positionalCount()));
        } else if (mode.startsWith("[")) {
            throw new UnsupportedCommandException(
                    "exec form not yet supported for HEALTHCHECK CMD: " + statement.wordsForMessage());
        } else {
            throw new ArityException("invalid arguments for HEALTHCHECK: " + statement.wordsForMessage());
        }
        HealthcheckSpec healthcheck = new HealthcheckSpec(
                none,
                command,
                options.duration("interval"),
                options.duration("timeout"),
                options.duration("start-period"),
                options.integer("retries"));
        apply("apply HEALTHCHECK", () -> builder.healthcheck(context, healthcheck));
    }

    private void applyWithDocker(Statement statement) throws InterpreterException {
        WithDockerTracker tracker = state.getWithDocker();
        tracker.requireIdle();
        DecodedOptions options = OptionDecoder.decode(WITH_DOCKER_OPTIONS, statement.getWords());
        if (options.positionalCount() != 0) {
            throw new ArityException(
                    "invalid WITH DOCKER arguments [" + String.join(" ", options.positionals()) + "]");
        }
        Platform platform = platform(options.string("platform"));
        List<String> composeFiles = expander.literal(options.list("compose"));
        List<String> composeServices = expander.literal(options.list("service"));
        List<String> buildArgs = expander.reference(options.list("build-arg"));

        List<DockerPull> pulls = new ArrayList<>();
        for (String imageName : expander.literal(options.list("pull"))) {
            pulls.add(new DockerPull(imageName, platform));
        }
        List<DockerLoad> loads = new ArrayList<>();
        for (String load : expander.reference(options.list("load"))) {
            int equals = load.indexOf('=');
            // A bare target takes its image name from that target's SAVE IMAGE.
            String imageName = equals < 0 ? "" : load.substring(0, equals);
            String target = equals < 0 ? load : load.substring(equals + 1);
            loads.add(new DockerLoad(imageName, target, platform, buildArgs));
        }
        tracker.open(new WithDockerBlock(composeFiles, composeServices, loads, pulls));
    }

    private void applyEnd(Statement statement) throws InterpreterException {
        if (!statement.getWords().isEmpty()) {
            throw new ArityException("END does not take any arguments: " + statement.getText());
        }
        state.getWithDocker().close();
    }

    // Helpers.

    private String single(Statement statement) throws ArityException {
        if (statement.getWords().size() != 1) {
            throw new ArityException("invalid number of arguments for " + statement.getKind().keyword() + ": "
                    + statement.wordsForMessage());
        }
        return statement.getWords().get(0);
    }

    private List<String> atLeastOne(Statement statement) throws ArityException {
        if (statement.getWords().isEmpty()) {
            throw new ArityException("no arguments provided to the " + statement.getKind().keyword() + " command");
        }
        return statement.getWords();
    }

    private static String envKey(Statement statement) throws ArityException {
        String key = statement.getKey();
        if (!ENV_KEY.matcher(key).matches()) {
            throw new ArityException("invalid env key definition " + key);
        }
        return key;
    }

    /** Treats the word as an artifact when it parses as one, and as a plain path otherwise. */
    private String artifactOrLiteral(String word) {
        try {
            return ArtifactRef.parse(expander.reference(word)).toString();
        } catch (ReferenceParseException notAnArtifact) {
            return expander.literal(word);
        }
    }

    private Platform platform(String raw) throws OptionDecodeException {
        String expanded = expander.literal(raw);
        if (expanded.isEmpty()) {
            return null;
        }
        try {
            return Platform.parse(expanded);
        } catch (ReferenceParseException ex) {
            throw new OptionDecodeException("parse platform " + expanded + ": " + ex.getMessage(), ex);
        }
    }

    private void apply(String action, BuilderAction call) throws GraphBuilderFailedException {
        try {
            call.run();
        } catch (GraphBuilderException ex) {
            throw new GraphBuilderFailedException(action, ex);
        }
    }

    private static StateInvariantException pushOnlyViolation(Statement statement) {
        return new StateInvariantException("no non-push commands allowed after a --push: " + statement.getText());
    }
}
