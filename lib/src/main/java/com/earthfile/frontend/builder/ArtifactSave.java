package com.earthfile.frontend.builder;

/** {@code SAVE ARTIFACT}; {@code localDestination} is empty unless {@code AS LOCAL} was given. */
public record ArtifactSave(
        String source, String destination, String localDestination, boolean keepTs, boolean keepOwn, boolean ifExists) {}
