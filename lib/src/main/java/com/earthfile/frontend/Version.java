package com.earthfile.frontend;

public final class Version {
    static final int MAJOR = 0;
    static final int MINOR = 3;
    static final int PATCH = 0;
    private static final String QUALIFIER = "alpha";

    public static final String FULL = MAJOR + "." + MINOR + "." + PATCH + "-" + QUALIFIER;
    public static final String ANTLR_VERSION = "4.13.1";
    public static final String RUNTIME = FULL + " (ANTLR " + ANTLR_VERSION + ")";

    private Version() {}
}
