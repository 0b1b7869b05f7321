package com.earthfile.frontend.builder;

import java.util.List;

public record ImageSave(
        List<String> imageNames, boolean push, boolean insecure, boolean cacheHint, List<String> cacheFrom) {

    public ImageSave {
        imageNames = List.copyOf(imageNames);
        cacheFrom = List.copyOf(cacheFrom);
    }
}
