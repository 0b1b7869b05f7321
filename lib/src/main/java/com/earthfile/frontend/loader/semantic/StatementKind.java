package com.earthfile.frontend.loader.semantic;

/** Every statement the grammar recognizes. {@link #GENERIC} covers unknown upper-case commands. */
public enum StatementKind {
    FROM("FROM"),
    FROM_DOCKERFILE("FROM DOCKERFILE"),
    COPY("COPY"),
    SAVE_ARTIFACT("SAVE ARTIFACT"),
    SAVE_IMAGE("SAVE IMAGE", true),
    RUN("RUN", true),
    BUILD("BUILD"),
    WORKDIR("WORKDIR"),
    USER("USER"),
    CMD("CMD"),
    ENTRYPOINT("ENTRYPOINT"),
    EXPOSE("EXPOSE"),
    VOLUME("VOLUME"),
    ENV("ENV"),
    ARG("ARG"),
    LABEL("LABEL"),
    GIT_CLONE("GIT CLONE"),
    ADD("ADD"),
    STOPSIGNAL("STOPSIGNAL"),
    ONBUILD("ONBUILD"),
    HEALTHCHECK("HEALTHCHECK"),
    SHELL("SHELL"),
    WITH_DOCKER("WITH DOCKER"),
    END("END"),
    DOCKER_LOAD("DOCKER LOAD"),
    DOCKER_PULL("DOCKER PULL"),
    GENERIC("");

    private final String keyword;
    private final boolean pushQualified;

    StatementKind(String keyword) {
        this(keyword, false);
    }

    StatementKind(String keyword, boolean pushQualified) {
        this.keyword = keyword;
        this.pushQualified = pushQualified;
    }

    /** The command as written in an Earthfile; empty for {@link #GENERIC}. */
    public String keyword() {
        return keyword;
    }

    /**
     * Whether the statement has a {@code --push} form. These decide for themselves whether they
     * are allowed in push-only mode, since that depends on their options.
     */
    public boolean isPushQualified() {
        return pushQualified;
    }
}
