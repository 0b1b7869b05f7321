package com.earthfile.frontend.builder;

import com.earthfile.frontend.domain.Platform;
import java.util.List;

/**
 * Image to build from {@code target} and load into the docker daemon of a {@code WITH DOCKER}
 * block. An empty {@code imageName} means the name comes from that target's {@code SAVE IMAGE}.
 */
public record DockerLoad(String imageName, String target, Platform platform, List<String> buildArgs) {

    public DockerLoad {
        buildArgs = List.copyOf(buildArgs);
    }
}
