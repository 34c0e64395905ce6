package com.launchpad.core.model;

import java.util.Objects;

/**
 * Normalized description of how to start a built artifact.
 * <p>
 * {@code command} is run with the artifact directory as working directory, so it must not
 * need further path resolution. {@code buildCommand} and {@code buildRequired} tell the
 * deployment host whether it has to run a build of its own after upload.
 *
 * @param platform      platform tag, e.g. {@code dotnet}
 * @param version       runtime version, e.g. {@code 8.0}
 * @param command       start command, e.g. {@code dotnet MyApp.dll}
 * @param buildCommand  remote build command, empty when none
 * @param buildRequired whether the deployment host must build after upload
 */
public record DeploymentManifest(
    String platform,
    String version,
    String command,
    String buildCommand,
    boolean buildRequired
) {

    public DeploymentManifest {
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(command, "command");
        buildCommand = buildCommand != null ? buildCommand : "";
    }

    public DeploymentManifest(String platform, String version, String command) {
        this(platform, version, command, "", false);
    }

    /**
     * Renders the manifest in the TOML layout read by App Service's Oryx build system.
     * The {@code [build]} section is only emitted when a remote build is required.
     */
    public String toToml() {
        var sb = new StringBuilder();
        if (buildRequired) {
            sb.append("[build]\n");
            sb.append("platform = \"").append(escape(platform)).append("\"\n");
            sb.append("version = \"").append(escape(version)).append("\"\n");
            if (!buildCommand.isBlank()) {
                sb.append("build-command = \"").append(escape(buildCommand)).append("\"\n");
            }
            sb.append('\n');
        }
        sb.append("[run]\n");
        sb.append("command = \"").append(escape(command)).append("\"\n");
        return sb.toString();
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
