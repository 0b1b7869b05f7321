package com.earthfile.frontend.domain;

import java.util.Objects;

/** A file or directory saved by a target, referenced as {@code <target-ref>/<path>}. */
public final class ArtifactRef {
    private final TargetRef target;
    private final String artifact;

    public ArtifactRef(TargetRef target, String artifact) {
        this.target = Objects.requireNonNull(target, "target");
        this.artifact = Objects.requireNonNull(artifact, "artifact");
    }

    public static ArtifactRef parse(String artifactName) throws ReferenceParseException {
        Objects.requireNonNull(artifactName, "artifactName");
        int markerIndex = TargetRef.indexOfMarker(artifactName);
        if (markerIndex < 0) {
            throw new ReferenceParseException("invalid artifact name " + artifactName);
        }
        int slash = artifactName.indexOf('/', markerIndex + 1);
        if (slash < 0) {
            throw new ReferenceParseException("invalid artifact name " + artifactName);
        }
        TargetRef target = TargetRef.parse(artifactName.substring(0, slash));
        return new ArtifactRef(target, artifactName.substring(slash + 1));
    }

    public TargetRef getTarget() {
        return target;
    }

    public String getArtifact() {
        return artifact;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ArtifactRef)) {
            return false;
        }
        ArtifactRef other = (ArtifactRef) obj;
        return target.equals(other.target) && artifact.equals(other.artifact);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, artifact);
    }

    @Override
    public String toString() {
        return target + "/" + artifact;
    }
}
