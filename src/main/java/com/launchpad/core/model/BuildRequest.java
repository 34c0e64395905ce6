package com.launchpad.core.model;

import java.nio.file.Path;

/**
 * Input to an orchestrated build.
 *
 * @param projectDir        project root to build
 * @param outputPath        artifact directory, relative to {@code projectDir} or absolute
 * @param verbose           stream toolchain output live
 * @param platformOverride  skip detection and use this platform (nullable)
 * @param resourceGroup     deployment resource group for settings conversion (nullable)
 * @param appName           deployment app name for settings conversion (nullable)
 * @param createPackage     zip the artifact after the manifest has been written
 * @param deploymentZip     archive file name, relative to {@code projectDir}
 */
public record BuildRequest(
    Path projectDir,
    String outputPath,
    boolean verbose,
    ProjectPlatform platformOverride,
    String resourceGroup,
    String appName,
    boolean createPackage,
    String deploymentZip
) {

    public static BuildRequest of(Path projectDir, String outputPath) {
        return new BuildRequest(projectDir, outputPath, false, null, null, null, false, "app.zip");
    }

    /** True when both deployment coordinates are present. */
    public boolean hasDeploymentTarget() {
        return resourceGroup != null && !resourceGroup.isBlank()
                && appName != null && !appName.isBlank();
    }
}
