package com.launchpad.core.engine;

import com.launchpad.core.builder.BuildContext;
import com.launchpad.core.builder.BuilderSupport;
import com.launchpad.core.builder.PlatformBuilder;
import com.launchpad.core.config.LaunchpadProperties;
import com.launchpad.core.events.BuildEvent;
import com.launchpad.core.events.EventBus;
import com.launchpad.core.logging.MdcContext;
import com.launchpad.core.metrics.BuildMetrics;
import com.launchpad.core.model.BuildError;
import com.launchpad.core.model.BuildReport;
import com.launchpad.core.model.BuildRequest;
import com.launchpad.core.model.BuildStep;
import com.launchpad.core.model.DeploymentManifest;
import com.launchpad.core.model.ErrorKind;
import com.launchpad.core.model.ProjectPlatform;
import com.launchpad.core.model.StepResult;
import com.launchpad.core.packaging.DeploymentPackager;
import com.launchpad.core.packaging.ManifestWriter;
import com.launchpad.core.scanner.PlatformDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs the build lifecycle for one project directory: detect the platform, pick its builder,
 * then validate, clean, build, derive and write the manifest, and optionally push app settings
 * and zip the artifact.
 * <p>
 * Every step runs only after the previous one succeeded; the first failure ends the run and is
 * recorded in the returned {@link BuildReport}. Builders are looked up by platform in a fixed
 * table built from the registered {@link PlatformBuilder} beans.
 * <p>
 * One orchestrator serves concurrent builds of different directories. Running two builds of the
 * same directory into the same output path at once is a caller error.
 */
@Service
public class BuildOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BuildOrchestrator.class);
    private static final AtomicInteger BUILD_COUNTER = new AtomicInteger(0);

    private final PlatformDetector detector;
    private final Map<ProjectPlatform, PlatformBuilder> builders;
    private final ManifestWriter manifestWriter;
    private final DeploymentPackager packager;
    private final EventBus eventBus;
    private final BuildMetrics metrics;
    private final LaunchpadProperties properties;

    public BuildOrchestrator(PlatformDetector detector,
                             List<PlatformBuilder> platformBuilders,
                             ManifestWriter manifestWriter,
                             DeploymentPackager packager,
                             EventBus eventBus,
                             @Autowired(required = false) BuildMetrics metrics,
                             LaunchpadProperties properties) {
        this.detector = detector;
        this.builders = index(platformBuilders);
        this.manifestWriter = manifestWriter;
        this.packager = packager;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    private static Map<ProjectPlatform, PlatformBuilder> index(List<PlatformBuilder> platformBuilders) {
        var table = new EnumMap<ProjectPlatform, PlatformBuilder>(ProjectPlatform.class);
        for (PlatformBuilder builder : platformBuilders) {
            PlatformBuilder previous = table.put(builder.platform(), builder);
            if (previous != null) {
                throw new IllegalStateException("Two builders registered for " + builder.platform()
                        + ": " + previous.getClass().getSimpleName() + " and " + builder.getClass().getSimpleName());
            }
        }
        return table;
    }

    public Optional<PlatformBuilder> builderFor(ProjectPlatform platform) {
        return Optional.ofNullable(builders.get(platform));
    }

    /** Registered builders in platform order. */
    public List<PlatformBuilder> builders() {
        return List.copyOf(builders.values());
    }

    public BuildReport run(BuildRequest request, BuildContext ctx) {
        return run(generateBuildId(), request, ctx);
    }

    /**
     * Runs the full lifecycle. Never throws for build failures; inspect {@link BuildReport#error()}.
     */
    public BuildReport run(String buildId, BuildRequest request, BuildContext ctx) {
        var run = new RunState(buildId);
        try {
            Path projectDir = request.projectDir() == null ? null : request.projectDir().toAbsolutePath().normalize();
            run.projectDir = projectDir;
            MdcContext.setBuild(String.valueOf(projectDir), ProjectPlatform.UNKNOWN.tag());
            log.info("Starting build {} for {}", buildId, projectDir);
            publish(BuildEvent.BUILD_STARTED, run, null, Map.of("projectDir", String.valueOf(projectDir)));

            var platform = step(run, BuildStep.DETECT, ctx, () -> resolvePlatform(projectDir, request.platformOverride()));
            if (platform.isFailure()) {
                return finish(run, platform.error().orElseThrow());
            }
            run.platform = platform.value();
            MdcContext.setPlatform(run.platform.tag());

            PlatformBuilder builder = builders.get(run.platform);
            if (builder == null) {
                return finish(run, unsupported(run.platform));
            }

            var validated = step(run, BuildStep.VALIDATE_ENVIRONMENT, ctx,
                    () -> require(builder.validateEnvironment(ctx), environmentMissing(run.platform)));
            if (validated.isFailure()) {
                return finish(run, validated.error().orElseThrow());
            }

            var cleaned = step(run, BuildStep.CLEAN, ctx, () -> builder.clean(projectDir, ctx));
            if (cleaned.isFailure()) {
                return finish(run, cleaned.error().orElseThrow());
            }

            String outputPath = request.outputPath() != null && !request.outputPath().isBlank()
                    ? request.outputPath()
                    : properties.getOutputPath();
            String zipName = request.deploymentZip() != null && !request.deploymentZip().isBlank()
                    ? request.deploymentZip()
                    : properties.getDeploymentZip();
            BuildContext buildCtx = ctx.withDeploymentZip(zipName);
            var built = step(run, BuildStep.BUILD, ctx,
                    () -> builder.build(projectDir, outputPath, request.verbose(), buildCtx));
            if (built.isFailure()) {
                return finish(run, built.error().orElseThrow());
            }
            run.artifactPath = built.value();

            var manifest = step(run, BuildStep.CREATE_MANIFEST, ctx,
                    () -> builder.createManifest(projectDir, run.artifactPath, ctx));
            if (manifest.isFailure()) {
                return finish(run, manifest.error().orElseThrow());
            }
            run.manifest = manifest.value();

            var written = step(run, BuildStep.WRITE_MANIFEST, ctx, () -> writeManifest(run.manifest, run.artifactPath));
            if (written.isFailure()) {
                return finish(run, written.error().orElseThrow());
            }

            if (request.hasDeploymentTarget()) {
                var settings = step(run, BuildStep.DEPLOYMENT_SETTINGS, ctx,
                        () -> require(builder.convertEnvironmentToDeploymentSettings(projectDir, request.resourceGroup(),
                                request.appName(), request.verbose(), ctx), settingsFailed(request)));
                if (settings.isFailure()) {
                    return finish(run, settings.error().orElseThrow());
                }
            }

            if (request.createPackage()) {
                var packaged = step(run, BuildStep.PACKAGE, ctx, () -> createPackage(projectDir, run.artifactPath, zipName));
                if (packaged.isFailure()) {
                    return finish(run, packaged.error().orElseThrow());
                }
                run.packagePath = packaged.value();
            }

            return finish(run, null);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs only detection, lookup and the clean step.
     */
    public StepResult<ProjectPlatform> clean(Path projectDir, ProjectPlatform override, BuildContext ctx) {
        var platform = resolvePlatform(projectDir, override);
        if (platform.isFailure()) {
            return platform;
        }
        PlatformBuilder builder = builders.get(platform.value());
        if (builder == null) {
            return StepResult.failure(unsupported(platform.value()));
        }
        Path dir = projectDir.toAbsolutePath().normalize();
        return builder.clean(dir, ctx).map(ignored -> platform.value());
    }

    /**
     * Derives the manifest for an artifact that was built earlier, without rebuilding.
     */
    public StepResult<DeploymentManifest> deriveManifest(Path projectDir, Path artifactPath,
                                                         ProjectPlatform override, BuildContext ctx) {
        var platform = resolvePlatform(projectDir, override);
        if (platform.isFailure()) {
            return platform.propagate();
        }
        PlatformBuilder builder = builders.get(platform.value());
        if (builder == null) {
            return StepResult.failure(unsupported(platform.value()));
        }
        Path dir = projectDir.toAbsolutePath().normalize();
        Path artifact = artifactPath.isAbsolute() ? artifactPath : dir.resolve(artifactPath).normalize();
        if (!Files.isDirectory(artifact)) {
            return StepResult.failure(BuildError.of(ErrorKind.ARTIFACT_MISSING, BuildStep.CREATE_MANIFEST,
                            "Artifact directory not found: " + artifact)
                    .withMitigation("Run 'launchpad build' first, or pass --artifact pointing at the publish output"));
        }
        return builder.createManifest(dir, artifact, ctx);
    }

    /**
     * Generates a build ID in the format LP-YYYY-NNNN.
     */
    public String generateBuildId() {
        int count = BUILD_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("LP-%d-%04d", year, count);
    }

    // ── steps ────────────────────────────────────────────────────────

    private StepResult<ProjectPlatform> resolvePlatform(Path projectDir, ProjectPlatform override) {
        if (projectDir == null || !Files.isDirectory(projectDir)) {
            return StepResult.failure(BuildError.of(ErrorKind.PROJECT_DIRECTORY_MISSING, BuildStep.DETECT,
                            "Project directory not found: " + projectDir)
                    .withMitigation("Check the path and run the command again"));
        }
        if (override != null && override != ProjectPlatform.UNKNOWN) {
            log.info("Using requested platform {} without detection", override.displayName());
            return StepResult.success(override);
        }
        ProjectPlatform detected = detector.detect(projectDir);
        if (detected == ProjectPlatform.UNKNOWN) {
            return StepResult.failure(BuildError.of(ErrorKind.PLATFORM_UNDETECTED, BuildStep.DETECT,
                            "Could not detect the project platform in " + projectDir)
                    .withMitigation("Make sure the directory contains a .csproj/.fsproj/.vbproj, package.json or Python sources",
                            "Or pass --platform dotnet|nodejs|python to skip detection")
                    .withContext("projectDir", projectDir.toString()));
        }
        return StepResult.success(detected);
    }

    private StepResult<Path> writeManifest(DeploymentManifest manifest, Path artifactPath) {
        try {
            return StepResult.success(manifestWriter.write(manifest, artifactPath, properties.getManifestFileName()));
        } catch (IOException e) {
            return StepResult.failure(BuilderSupport.fileSystemFailure(BuildStep.WRITE_MANIFEST,
                    "Could not write deployment manifest", e));
        }
    }

    private StepResult<Path> createPackage(Path projectDir, Path artifactPath, String zipName) {
        try {
            return StepResult.success(packager.createPackage(projectDir, artifactPath, zipName));
        } catch (IOException e) {
            return StepResult.failure(BuilderSupport.fileSystemFailure(BuildStep.PACKAGE,
                    "Could not create deployment package " + zipName, e));
        }
    }

    /**
     * Runs one step with MDC, events and timing around it. A cancelled context short-circuits
     * the step; an {@link UncheckedIOException} escaping the step becomes a filesystem failure and
     * any other runtime exception an internal error, so the run still finishes with a report.
     */
    private <T> StepResult<T> step(RunState run, BuildStep step, BuildContext ctx, Supplier<StepResult<T>> body) {
        if (ctx.cancellation().isCancelled() || Thread.currentThread().isInterrupted()) {
            return StepResult.failure(BuildError.of(ErrorKind.CANCELLED, step, "Build cancelled before " + step.label()));
        }

        MdcContext.setStep(step.label());
        publish(BuildEvent.STEP_STARTED, run, step, Map.of());
        log.debug("Step {} started", step.label());
        long start = System.currentTimeMillis();

        StepResult<T> result;
        try {
            result = body.get();
        } catch (UncheckedIOException e) {
            result = StepResult.failure(BuilderSupport.fileSystemFailure(step, "Unexpected I/O error", e.getCause()));
        } catch (RuntimeException e) {
            log.error("Step {} threw unexpectedly", step.label(), e);
            result = StepResult.failure(BuildError.of(ErrorKind.INTERNAL_ERROR, step,
                            "Unexpected error during " + step.label() + ": " + e)
                    .withMitigation("Re-run with --verbose and report the logged stack trace"));
        }

        long elapsed = System.currentTimeMillis() - start;
        if (metrics != null && run.platform != null) {
            metrics.recordStepDuration(run.platform, step, elapsed);
        }
        if (result.isSuccess()) {
            run.completed.add(step);
            publish(BuildEvent.STEP_COMPLETED, run, step, Map.of("durationMs", elapsed));
            log.debug("Step {} completed in {}ms", step.label(), elapsed);
        } else {
            BuildError error = result.error().orElseThrow();
            publish(BuildEvent.STEP_FAILED, run, step, Map.of(
                    "errorCode", error.kind().code(),
                    "message", error.message()));
        }
        return result;
    }

    private BuildReport finish(RunState run, BuildError error) {
        long duration = System.currentTimeMillis() - run.startedAt;
        ProjectPlatform platform = run.platform != null ? run.platform : ProjectPlatform.UNKNOWN;
        if (metrics != null) {
            metrics.recordBuildResult(platform, error == null ? "success" : error.kind().code());
        }

        if (error == null) {
            log.info("Build {} succeeded in {}ms, artifact at {}", run.buildId, duration, run.artifactPath);
            publish(BuildEvent.BUILD_COMPLETED, run, null, Map.of(
                    "artifactPath", String.valueOf(run.artifactPath),
                    "durationMs", duration));
        } else {
            if (error.kind().isInternalFault()) {
                log.error("Build {} failed at {} [{}]: {}", run.buildId, error.step().label(),
                        error.kind().code(), error.message(), new IllegalStateException(error.message()));
            } else {
                log.error("Build {} failed at {} [{}]: {}", run.buildId, error.step().label(),
                        error.kind().code(), error.message());
            }
            publish(BuildEvent.BUILD_FAILED, run, error.step(), Map.of(
                    "errorCode", error.kind().code(),
                    "message", error.message()));
        }
        return new BuildReport(run.buildId, run.projectDir, platform, run.completed, run.artifactPath,
                run.manifest, run.packagePath, error, duration);
    }

    private void publish(String type, RunState run, BuildStep step, Map<String, Object> payload) {
        eventBus.publish(BuildEvent.of(type, run.buildId, step != null ? step.label() : null, payload));
    }

    private static StepResult<Void> require(boolean ok, BuildError error) {
        return ok ? StepResult.done() : StepResult.failure(error);
    }

    private static BuildError unsupported(ProjectPlatform platform) {
        return BuildError.of(ErrorKind.PLATFORM_UNSUPPORTED, BuildStep.DETECT,
                        "No builder is registered for platform " + platform.displayName())
                .withContext("platform", platform.tag());
    }

    private static BuildError environmentMissing(ProjectPlatform platform) {
        String hint = switch (platform) {
            case DOTNET -> "Install the .NET SDK from https://dotnet.microsoft.com/download";
            case NODEJS -> "Install Node.js (includes npm) from https://nodejs.org/";
            case PYTHON -> "Install Python 3 with pip from https://www.python.org/";
            case UNKNOWN -> "Install the toolchain for the project platform";
        };
        return BuildError.of(ErrorKind.ENVIRONMENT_MISSING, BuildStep.VALIDATE_ENVIRONMENT,
                        "Required " + platform.displayName() + " toolchain not found")
                .withMitigation(hint, "Restart your terminal so PATH changes take effect",
                        "Run 'launchpad doctor' to check every toolchain");
    }

    private static BuildError settingsFailed(BuildRequest request) {
        return BuildError.of(ErrorKind.TOOL_INVOCATION_FAILED, BuildStep.DEPLOYMENT_SETTINGS,
                        "Failed to apply .env values as app settings")
                .withMitigation("Run 'az login' and check access to the resource group",
                        "Verify the web app exists: az webapp show -g " + request.resourceGroup()
                                + " -n " + request.appName())
                .withContext("resourceGroup", request.resourceGroup())
                .withContext("appName", request.appName());
    }

    /** Mutable bookkeeping for one run; confined to the calling thread. */
    private static final class RunState {
        final String buildId;
        final long startedAt = System.currentTimeMillis();
        final List<BuildStep> completed = new ArrayList<>();
        Path projectDir;
        ProjectPlatform platform;
        Path artifactPath;
        DeploymentManifest manifest;
        Path packagePath;

        RunState(String buildId) {
            this.buildId = buildId;
        }
    }
}
