package com.earthfile.frontend.builder;

import com.earthfile.frontend.domain.Platform;

public record DockerPull(String imageName, Platform platform) {}
