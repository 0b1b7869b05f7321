package com.earthfile.frontend.domain;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Target platform triple ({@code os/architecture[/variant]}), parsed the way container tooling
 * normalizes platform specifiers.
 */
public final class Platform {
    private static final Pattern COMPONENT = Pattern.compile("^[A-Za-z0-9_-]+$");
    private static final String DEFAULT_OS = "linux";
    private static final String DEFAULT_ARCHITECTURE = "amd64";
    private static final Set<String> KNOWN_OS =
            Set.of(
                    "aix", "android", "darwin", "dragonfly", "freebsd", "illumos", "ios", "js",
                    "linux", "netbsd", "openbsd", "plan9", "solaris", "windows");
    private static final Set<String> KNOWN_ARCHITECTURES =
            Set.of(
                    "386", "amd64", "arm", "arm64", "loong64", "mips", "mips64", "mips64le",
                    "mipsle", "ppc64", "ppc64le", "riscv64", "s390x", "wasm");
    private static final Map<String, String> OS_ALIASES = Map.of("macos", "darwin");

    private final String os;
    private final String architecture;
    private final String variant;

    public Platform(String os, String architecture, String variant) {
        this.os = Objects.requireNonNull(os, "os");
        this.architecture = Objects.requireNonNull(architecture, "architecture");
        this.variant = variant == null ? "" : variant;
    }

    public static Platform parse(String specifier) throws ReferenceParseException {
        Objects.requireNonNull(specifier, "specifier");
        if (specifier.isEmpty()) {
            throw new ReferenceParseException("invalid platform specifier \"\"");
        }
        String[] parts = specifier.split("/", -1);
        for (String part : parts) {
            if (!COMPONENT.matcher(part).matches()) {
                throw new ReferenceParseException(
                        "invalid platform specifier \"" + specifier + "\": invalid component \"" + part + "\"");
            }
        }
        switch (parts.length) {
            case 1: {
                String single = parts[0].toLowerCase(Locale.ROOT);
                String os = normalizeOs(single);
                if (KNOWN_OS.contains(os)) {
                    return new Platform(os, DEFAULT_ARCHITECTURE, "");
                }
                String[] arch = normalizeArchitecture(single, "");
                if (KNOWN_ARCHITECTURES.contains(arch[0])) {
                    return new Platform(DEFAULT_OS, arch[0], arch[1]);
                }
                throw new ReferenceParseException(
                        "unknown operating system or architecture in platform \"" + specifier + "\"");
            }
            case 2: {
                String os = requireKnownOs(parts[0], specifier);
                String[] arch = normalizeArchitecture(parts[1].toLowerCase(Locale.ROOT), "");
                return new Platform(os, arch[0], arch[1]);
            }
            case 3: {
                String os = requireKnownOs(parts[0], specifier);
                String[] arch =
                        normalizeArchitecture(
                                parts[1].toLowerCase(Locale.ROOT), parts[2].toLowerCase(Locale.ROOT));
                return new Platform(os, arch[0], arch[1]);
            }
            default:
                throw new ReferenceParseException(
                        "invalid platform specifier \"" + specifier + "\": too many components");
        }
    }

    private static String requireKnownOs(String raw, String specifier) throws ReferenceParseException {
        String os = normalizeOs(raw.toLowerCase(Locale.ROOT));
        if (!KNOWN_OS.contains(os)) {
            throw new ReferenceParseException(
                    "unknown operating system \"" + raw + "\" in platform \"" + specifier + "\"");
        }
        return os;
    }

    private static String normalizeOs(String os) {
        return OS_ALIASES.getOrDefault(os, os);
    }

    /** Returns {architecture, variant}. */
    private static String[] normalizeArchitecture(String architecture, String variant) {
        switch (architecture) {
            case "i386":
                return new String[] {"386", ""};
            case "x86_64":
            case "x86-64":
                return new String[] {"amd64", ""};
            case "aarch64":
            case "arm64":
                if ("8".equals(variant) || "v8".equals(variant)) {
                    return new String[] {"arm64", ""};
                }
                return new String[] {"arm64", variant};
            case "armhf":
                return new String[] {"arm", "v7"};
            case "armel":
                return new String[] {"arm", "v6"};
            case "arm":
                if (variant.isEmpty() || "7".equals(variant)) {
                    return new String[] {"arm", "v7"};
                }
                if ("5".equals(variant) || "6".equals(variant) || "8".equals(variant)) {
                    return new String[] {"arm", "v" + variant};
                }
                return new String[] {"arm", variant};
            default:
                return new String[] {architecture, variant};
        }
    }

    public String getOs() {
        return os;
    }

    public String getArchitecture() {
        return architecture;
    }

    public String getVariant() {
        return variant;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Platform)) {
            return false;
        }
        Platform other = (Platform) obj;
        return os.equals(other.os)
                && architecture.equals(other.architecture)
                && variant.equals(other.variant);
    }

    @Override
    public int hashCode() {
        return Objects.hash(os, architecture, variant);
    }

    @Override
    public String toString() {
        if (variant.isEmpty()) {
            return os + "/" + architecture;
        }
        return os + "/" + architecture + "/" + variant;
    }
}
