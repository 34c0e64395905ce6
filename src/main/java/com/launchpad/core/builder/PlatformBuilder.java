package com.launchpad.core.builder;

import com.launchpad.core.model.DeploymentManifest;
import com.launchpad.core.model.ProjectPlatform;
import com.launchpad.core.model.StepResult;

import java.nio.file.Path;

/**
 * Build workflow for one platform.
 * <p>
 * The orchestrator calls the lifecycle methods strictly in order, each one only after the
 * previous one succeeded: {@link #validateEnvironment}, {@link #clean}, {@link #build},
 * {@link #createManifest}, then optionally {@link #convertEnvironmentToDeploymentSettings}.
 * <p>
 * Implementations are stateless: one instance serves every project, and different project
 * directories may be built concurrently. Building the same directory into the same output
 * path from two threads at once is a caller error and is not guarded against.
 * <p>
 * Expected failures are returned as {@link StepResult#failure} values; implementations do
 * not throw for a failing toolchain or a malformed project.
 */
public interface PlatformBuilder {

    /** The platform this builder serves. */
    ProjectPlatform platform();

    /**
     * Checks the toolchain. Logs the reason and returns false when a required tool is missing;
     * never throws.
     */
    boolean validateEnvironment(BuildContext ctx);

    /** Removes build state left by earlier runs. */
    StepResult<Void> clean(Path projectDir, BuildContext ctx);

    /**
     * Restores dependencies and publishes the project into {@code outputPath}, replacing
     * whatever was there. The returned path exists when the result is a success.
     *
     * @param outputPath artifact directory, relative to {@code projectDir} or absolute
     * @param verbose    stream toolchain output to {@link BuildContext#outputSink()}
     */
    StepResult<Path> build(Path projectDir, String outputPath, boolean verbose, BuildContext ctx);

    /**
     * Derives the start manifest for a published artifact. Must not change the project
     * directory; may add runtime hint files to the artifact.
     */
    StepResult<DeploymentManifest> createManifest(Path projectDir, Path artifactPath, BuildContext ctx);

    /**
     * Pushes the project's {@code .env} values to the deployment host's app settings.
     * Platforms without such a convention succeed without doing anything.
     *
     * @return false when the settings could not be applied
     */
    default boolean convertEnvironmentToDeploymentSettings(Path projectDir, String resourceGroup,
                                                          String appName, boolean verbose,
                                                          BuildContext ctx) {
        return true;
    }
}
