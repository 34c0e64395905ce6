package com.launchpad.core.model;

/**
 * Technology stack of a project directory, used to pick the matching build toolchain.
 * <p>
 * The {@link #tag()} is the platform string written into deployment manifests.
 */
public enum ProjectPlatform {
    DOTNET("dotnet", ".NET"),
    NODEJS("nodejs", "Node.js"),
    PYTHON("python", "Python"),
    UNKNOWN("unknown", "Unknown");

    private final String tag;
    private final String displayName;

    ProjectPlatform(String tag, String displayName) {
        this.tag = tag;
        this.displayName = displayName;
    }

    public String tag() {
        return tag;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Parses a user-supplied platform name. Accepts the enum name or the manifest tag,
     * case-insensitively ("dotnet", "DOTNET", "nodejs", "node", "python").
     *
     * @throws IllegalArgumentException if the name matches no known platform
     */
    public static ProjectPlatform fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Platform name must not be blank");
        }
        String normalized = name.trim().toLowerCase();
        if ("node".equals(normalized)) {
            return NODEJS;
        }
        for (ProjectPlatform platform : values()) {
            if (platform.tag.equals(normalized) || platform.name().equalsIgnoreCase(normalized)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown platform: " + name
                + ". Valid platforms: dotnet, nodejs, python");
    }
}
