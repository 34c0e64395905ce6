package com.launchpad.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Summary of an orchestrated build run.
 *
 * @param buildId        identifier used in events and logs
 * @param projectDir     absolute project directory
 * @param platform       detected or requested platform
 * @param completedSteps steps that finished successfully, in order
 * @param artifactPath   publish directory, null if the build step never succeeded
 * @param manifest       derived manifest, null if the manifest step never succeeded
 * @param packagePath    deployment archive, null unless packaging ran
 * @param error          the fatal error that stopped the run, null on success
 * @param durationMs     wall-clock duration of the run
 */
public record BuildReport(
    String buildId,
    Path projectDir,
    ProjectPlatform platform,
    List<BuildStep> completedSteps,
    Path artifactPath,
    DeploymentManifest manifest,
    Path packagePath,
    BuildError error,
    long durationMs
) {

    public BuildReport {
        completedSteps = completedSteps != null ? List.copyOf(completedSteps) : List.of();
    }

    public boolean succeeded() {
        return error == null;
    }

    public Optional<BuildError> failure() {
        return Optional.ofNullable(error);
    }

    public int exitCode() {
        return error == null ? 0 : error.kind().exitCode();
    }
}
