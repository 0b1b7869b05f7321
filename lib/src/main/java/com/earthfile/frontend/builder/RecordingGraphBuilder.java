package com.earthfile.frontend.builder;

import com.earthfile.frontend.domain.Platform;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link GraphBuilder} that performs no build work and records every call in order. ENV and ARG
 * declarations feed {@link #expandArgs(String)}, with build-arg overrides taking precedence over
 * ARG defaults, so dry runs see the same expanded values a real build would.
 */
public final class RecordingGraphBuilder implements GraphBuilder {
    private static final Logger LOGGER = Logger.getLogger(RecordingGraphBuilder.class.getName());

    private final Map<String, String> buildArgOverrides;
    private final Map<String, String> variables = new HashMap<>();
    private final Map<String, String> failures = new HashMap<>();
    private final List<BuilderCall> calls = new ArrayList<>();

    public RecordingGraphBuilder() {
        this(Map.of());
    }

    public RecordingGraphBuilder(Map<String, String> buildArgOverrides) {
        this.buildArgOverrides = Map.copyOf(Objects.requireNonNull(buildArgOverrides, "buildArgOverrides"));
    }

    /** Make every later call to {@code operation} fail with {@code message}. */
    public RecordingGraphBuilder failOn(String operation, String message) {
        failures.put(operation, message);
        return this;
    }

    public List<BuilderCall> getCalls() {
        return List.copyOf(calls);
    }

    public List<String> getOperations() {
        List<String> operations = new ArrayList<>(calls.size());
        for (BuilderCall call : calls) {
            operations.add(call.getOperation());
        }
        return operations;
    }

    @Override
    public void fromImage(BuildContext context, String imageName, Platform platform, List<String> buildArgs)
            throws GraphBuilderException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("image", imageName);
        args.put("platform", platform);
        args.put("buildArgs", List.copyOf(buildArgs));
        record("fromImage", args);
    }

    @Override
    public void fromDockerfile(
            BuildContext context,
            String contextPath,
            String dockerfilePath,
            String stageName,
            Platform platform,
            List<String> buildArgs)
            throws GraphBuilderException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("context", contextPath);
        args.put("dockerfile", dockerfilePath);
        args.put("stage", stageName);
        args.put("platform", platform);
        args.put("buildArgs", List.copyOf(buildArgs));
        record("fromDockerfile", args);
    }

    @Override
    public void copyArtifact(BuildContext context, ArtifactCopy copy) throws GraphBuilderException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("source", copy.source());
        args.put("destination", copy.destination());
        args.put("platform", copy.platform());
        args.put("buildArgs", copy.buildArgs());
        args.put("dirCopy", copy.dirCopy());
        args.put("keepTs", copy.keepTs());
        args.put("keepOwn", copy.keepOwn());
        args.put("chown", copy.chown());
        args.put("ifExists", copy.ifExists());
        record("copyArtifact", args);
    }

    @Override
    public void copyClassical(BuildContext context, ClassicalCopy copy) throws GraphBuilderException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("sources", copy.sources());
        args.put("destination", copy.destination());
        args.put("dirCopy", copy.dirCopy());
        args.put("keepTs", copy.keepTs());
        args.put("keepOwn", copy.keepOwn());
        args.put("chown", copy.chown());
        record("copyClassical", args);
    }

    @Override
    public void run(BuildContext context, RunCommand command) throws GraphBuilderException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("args", command.args());
        args.put("mounts", command.mounts());
        args.put("secrets", command.secrets());
        args.put("privileged", command.privileged());
        args.put("withEntrypoint", command.withEntrypoint());
        args.put("withDocker", command.withDocker());
        args.put("withShell", command.withShell());
        args.put("push", command.push());
        args.put("withSsh", command.withSsh());
        record("run", args);
    }

    @Override
    public void runWithDocker(BuildContext context, List<String> command, WithDockerSpec spec)
            throws GraphBuilderException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("args", List.copyOf(command));
        args.put("composeFiles", spec.composeFiles());
        args.put("composeServices", spec.composeServices());
        args.put("loads", spec.loads());
        args.put("pulls", spec.pulls());
        args.put("mounts", spec.mounts());
        args.put("secrets", spec.secrets());
        args.put("withShell", spec.withShell());
        args.put("withEntrypoint", spec.withEntrypoint());
        record("runWithDocker", args);
    }

    @Override
    public void saveArtifact(BuildContext context, ArtifactSave save) throws GraphBuilderException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("source", save.source());
        args.put("destination", save.destination());
        args.put("localDestination", save.localDestination());
        args.put("keepTs", save.keepTs());
        args.put("keepOwn", save.keepOwn());
        args.put("ifExists", save.ifExists());
        record("saveArtifact", args);
    }

    @Override
    public void saveImage(BuildContext context, ImageSave save) throws GraphBuilderException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("imageNames", save.imageNames());
        args.put("push", save.push());
        args.put("insecure", save.insecure());
        args.put("cacheHint", save.cacheHint());
        args.put("cacheFrom", save.cacheFrom());
        record("saveImage", args);
    }

    @Override
    public void build(BuildContext context, String targetName, Platform platform, List<String> buildArgs)
            throws GraphBuilderException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("target", targetName);
        args.put("platform", platform);
        args.put("buildArgs", List.copyOf(buildArgs));
        record("build", args);
    }

    @Override
    public void workdir(BuildContext context, String path) throws GraphBuilderException {
        record("workdir", Map.of("path", path));
    }

    @Override
    public void user(BuildContext context, String user) throws GraphBuilderException {
        record("user", Map.of("user", user));
    }

    @Override
    public void cmd(BuildContext context, List<String> command, boolean withShell) throws GraphBuilderException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("args", List.copyOf(command));
        args.put("withShell", withShell);
        record("cmd", args);
    }

    @Override
    public void entrypoint(BuildContext context, List<String> command, boolean withShell)
            throws GraphBuilderException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("args", List.copyOf(command));
        args.put("withShell", withShell);
        record("entrypoint", args);
    }

    @Override
    public void expose(BuildContext context, List<String> ports) throws GraphBuilderException {
        record("expose", Map.of("ports", List.copyOf(ports)));
    }

    @Override
    public void volume(BuildContext context, List<String> volumes) throws GraphBuilderException {
        record("volume", Map.of("volumes", List.copyOf(volumes)));
    }

    @Override
    public void env(BuildContext context, String key, String value) throws GraphBuilderException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("key", key);
        args.put("value", value);
        record("env", args);
        variables.put(key, value);
    }

    @Override
    public void arg(BuildContext context, String key, String defaultValue, boolean global)
            throws GraphBuilderException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("key", key);
        args.put("defaultValue", defaultValue);
        args.put("global", global);
        record("arg", args);
        variables.put(key, buildArgOverrides.getOrDefault(key, defaultValue));
    }

    @Override
    public void label(BuildContext context, Map<String, String> labels) throws GraphBuilderException {
        record("label", Map.of("labels", new LinkedHashMap<>(labels)));
    }

    @Override
    public void gitClone(BuildContext context, String gitUrl, String branch, String destination, boolean keepTs)
            throws GraphBuilderException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("url", gitUrl);
        args.put("branch", branch);
        args.put("destination", destination);
        args.put("keepTs", keepTs);
        record("gitClone", args);
    }

    @Override
    public void healthcheck(BuildContext context, HealthcheckSpec healthcheck) throws GraphBuilderException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("none", healthcheck.none());
        args.put("command", healthcheck.command());
        args.put("interval", healthcheck.interval());
        args.put("timeout", healthcheck.timeout());
        args.put("startPeriod", healthcheck.startPeriod());
        args.put("retries", healthcheck.retries());
        record("healthcheck", args);
    }

    @Override
    public String expandArgs(String word) {
        return VariableExpander.expand(word, variables::get);
    }

    private void record(String operation, Map<String, Object> args) throws GraphBuilderException {
        String failure = failures.get(operation);
        if (failure != null) {
            throw new GraphBuilderException(failure);
        }
        BuilderCall call = new BuilderCall(operation, args);
        calls.add(call);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.log(Level.FINE, "[Earthfile] builder call {0}", call);
        }
    }
}
