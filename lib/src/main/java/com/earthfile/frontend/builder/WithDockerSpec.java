package com.earthfile.frontend.builder;

import java.util.List;

/** Everything a {@code WITH DOCKER ... RUN ... END} block hands to the builder with its single RUN. */
public record WithDockerSpec(
        List<String> composeFiles,
        List<String> composeServices,
        List<DockerLoad> loads,
        List<DockerPull> pulls,
        List<String> mounts,
        List<String> secrets,
        boolean withShell,
        boolean withEntrypoint) {

    public WithDockerSpec {
        composeFiles = List.copyOf(composeFiles);
        composeServices = List.copyOf(composeServices);
        loads = List.copyOf(loads);
        pulls = List.copyOf(pulls);
        mounts = List.copyOf(mounts);
        secrets = List.copyOf(secrets);
    }
}
