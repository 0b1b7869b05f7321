package com.earthfile.frontend.builder;

import java.util.List;

/** A {@code COPY} from the build context: every source is a plain path. */
public record ClassicalCopy(
        List<String> sources, String destination, boolean dirCopy, boolean keepTs, boolean keepOwn, String chown) {

    public ClassicalCopy {
        sources = List.copyOf(sources);
    }
}
