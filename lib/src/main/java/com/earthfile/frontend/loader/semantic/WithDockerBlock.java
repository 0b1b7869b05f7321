package com.earthfile.frontend.loader.semantic;

import com.earthfile.frontend.builder.DockerLoad;
import com.earthfile.frontend.builder.DockerPull;
import com.earthfile.frontend.builder.WithDockerSpec;
import java.util.List;

/** Configuration collected by an open {@code WITH DOCKER} statement, waiting for its RUN. */
record WithDockerBlock(
        List<String> composeFiles, List<String> composeServices, List<DockerLoad> loads, List<DockerPull> pulls) {

    WithDockerBlock {
        composeFiles = List.copyOf(composeFiles);
        composeServices = List.copyOf(composeServices);
        loads = List.copyOf(loads);
        pulls = List.copyOf(pulls);
    }

    WithDockerSpec toSpec(List<String> mounts, List<String> secrets, boolean withShell, boolean withEntrypoint) {
        return new WithDockerSpec(
                composeFiles, composeServices, loads, pulls, mounts, secrets, withShell, withEntrypoint);
    }
}
