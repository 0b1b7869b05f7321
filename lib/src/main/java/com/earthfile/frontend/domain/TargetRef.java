package com.earthfile.frontend.domain;

import java.util.Objects;

/**
 * A reference to a target, either in the current directory ({@code +build}), in another local
 * directory ({@code ./sub+build}) or in a remote repository ({@code github.com/org/repo:v1+build}).
 */
public final class TargetRef {
    static final char MARKER = '+';

    private final String localPath;
    private final String gitUrl;
    private final String tag;
    private final String target;

    private TargetRef(String localPath, String gitUrl, String tag, String target) {
        this.localPath = localPath;
        this.gitUrl = gitUrl;
        this.tag = tag;
        this.target = target;
    }

    public static TargetRef parse(String fullTargetName) throws ReferenceParseException {
        Objects.requireNonNull(fullTargetName, "fullTargetName");
        int markerIndex = indexOfMarker(fullTargetName);
        if (markerIndex < 0) {
            throw new ReferenceParseException("invalid target ref " + fullTargetName);
        }
        String prefix = fullTargetName.substring(0, markerIndex);
        String name = fullTargetName.substring(markerIndex + 1);
        if (name.isEmpty()) {
            throw new ReferenceParseException("invalid target ref " + fullTargetName);
        }
        if (prefix.isEmpty()) {
            return new TargetRef(".", "", "", name);
        }
        if (prefix.startsWith(".") || prefix.startsWith("/")) {
            return new TargetRef(prefix, "", "", name);
        }
        int colon = prefix.indexOf(':');
        if (colon < 0) {
            return new TargetRef("", prefix, "", name);
        }
        String gitUrl = prefix.substring(0, colon);
        String tag = prefix.substring(colon + 1);
        if (gitUrl.isEmpty() || tag.isEmpty()) {
            throw new ReferenceParseException("invalid target ref " + fullTargetName);
        }
        return new TargetRef("", gitUrl, tag, name);
    }

    /** Index of the first reference marker that is not escaped with a backslash, or -1. */
    static int indexOfMarker(String value) {
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '\\') {
                i++;
                continue;
            }
            if (ch == MARKER) {
                return i;
            }
        }
        return -1;
    }

    public boolean isLocalInternal() {
        return ".".equals(localPath);
    }

    public boolean isRemote() {
        return !gitUrl.isEmpty();
    }

    public String getLocalPath() {
        return localPath;
    }

    public String getGitUrl() {
        return gitUrl;
    }

    public String getTag() {
        return tag;
    }

    public String getTarget() {
        return target;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof TargetRef)) {
            return false;
        }
        TargetRef other = (TargetRef) obj;
        return localPath.equals(other.localPath)
                && gitUrl.equals(other.gitUrl)
                && tag.equals(other.tag)
                && target.equals(other.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(localPath, gitUrl, tag, target);
    }

    @Override
    public String toString() {
        if (isLocalInternal()) {
            return MARKER + target;
        }
        if (isRemote()) {
            String repo = tag.isEmpty() ? gitUrl : gitUrl + ":" + tag;
            return repo + MARKER + target;
        }
        return localPath + MARKER + target;
    }
}
