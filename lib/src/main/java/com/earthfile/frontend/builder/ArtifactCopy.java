package com.earthfile.frontend.builder;

import com.earthfile.frontend.domain.Platform;
import java.util.List;

/** One artifact source of a {@code COPY +target/path dest} statement. {@code platform} may be null. */
public record ArtifactCopy(
        String source,
        String destination,
        Platform platform,
        List<String> buildArgs,
        boolean dirCopy,
        boolean keepTs,
        boolean keepOwn,
        String chown,
        boolean ifExists) {

    public ArtifactCopy {
        buildArgs = List.copyOf(buildArgs);
    }
}
