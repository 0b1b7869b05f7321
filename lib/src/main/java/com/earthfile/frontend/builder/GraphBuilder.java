package com.earthfile.frontend.builder;

import com.earthfile.frontend.domain.Platform;
import java.util.List;
import java.util.Map;

/**
 * The build-graph construction side of the front end. The interpreter calls these operations in
 * document order with arguments that are already expanded; implementations never receive
 * references back into interpreter state.
 *
 * <p>Any operation may fail with {@link GraphBuilderException}; the interpreter wraps the failure
 * with a description of the statement and stops issuing calls.</p>
 */
public interface GraphBuilder {

    /**
     * Start the current target from an image or from another target ({@code +base}, {@code +deps}).
     *
     * @param imageName image or target reference, marker escapes preserved
     * @param platform target platform, or {@code null} for the default
     * @param buildArgs {@code KEY=VALUE} overrides passed to a referenced target
     */
    void fromImage(BuildContext context, String imageName, Platform platform, List<String> buildArgs)
            throws GraphBuilderException;

    /**
     * Start the current target from a Dockerfile build.
     *
     * @param contextPath build context directory or artifact reference
     * @param dockerfilePath explicit Dockerfile path; always empty in this version
     * @param stageName Dockerfile stage to stop at, empty for the last stage
     */
    void fromDockerfile(
            BuildContext context,
            String contextPath,
            String dockerfilePath,
            String stageName,
            Platform platform,
            List<String> buildArgs)
            throws GraphBuilderException;

    void copyArtifact(BuildContext context, ArtifactCopy copy) throws GraphBuilderException;

    void copyClassical(BuildContext context, ClassicalCopy copy) throws GraphBuilderException;

    void run(BuildContext context, RunCommand command) throws GraphBuilderException;

    /** The single RUN of a {@code WITH DOCKER} block, with the block's accumulated configuration. */
    void runWithDocker(BuildContext context, List<String> args, WithDockerSpec spec)
            throws GraphBuilderException;

    void saveArtifact(BuildContext context, ArtifactSave save) throws GraphBuilderException;

    void saveImage(BuildContext context, ImageSave save) throws GraphBuilderException;

    /** Build another target; called once per requested platform ({@code null} when none was given). */
    void build(BuildContext context, String targetName, Platform platform, List<String> buildArgs)
            throws GraphBuilderException;

    void workdir(BuildContext context, String path) throws GraphBuilderException;

    void user(BuildContext context, String user) throws GraphBuilderException;

    void cmd(BuildContext context, List<String> args, boolean withShell) throws GraphBuilderException;

    void entrypoint(BuildContext context, List<String> args, boolean withShell) throws GraphBuilderException;

    void expose(BuildContext context, List<String> ports) throws GraphBuilderException;

    void volume(BuildContext context, List<String> volumes) throws GraphBuilderException;

    void env(BuildContext context, String key, String value) throws GraphBuilderException;

    /**
     * Declare a build argument.
     *
     * @param global true when declared in the base recipe, making it visible to every target
     */
    void arg(BuildContext context, String key, String defaultValue, boolean global) throws GraphBuilderException;

    void label(BuildContext context, Map<String, String> labels) throws GraphBuilderException;

    void gitClone(BuildContext context, String gitUrl, String branch, String destination, boolean keepTs)
            throws GraphBuilderException;

    void healthcheck(BuildContext context, HealthcheckSpec healthcheck) throws GraphBuilderException;

    /** Substitute build args and environment variables in a single word. */
    String expandArgs(String word);
}
