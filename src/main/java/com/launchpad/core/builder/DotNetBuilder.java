package com.launchpad.core.builder;

import com.launchpad.core.config.LaunchpadProperties.VersionPolicy;
import com.launchpad.core.exec.CommandExecutor;
import com.launchpad.core.exec.CommandResult;
import com.launchpad.core.model.BuildError;
import com.launchpad.core.model.BuildStep;
import com.launchpad.core.model.DeploymentManifest;
import com.launchpad.core.model.ErrorKind;
import com.launchpad.core.model.ProjectPlatform;
import com.launchpad.core.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Builds .NET projects with the dotnet CLI: restore, then a framework-dependent Release publish.
 */
@Component
public class DotNetBuilder implements PlatformBuilder {

    private static final Logger log = LoggerFactory.getLogger(DotNetBuilder.class);

    static final List<String> PROJECT_EXTENSIONS = List.of(".csproj", ".fsproj", ".vbproj");
    private static final String DOTNET = "dotnet";

    @Override
    public ProjectPlatform platform() {
        return ProjectPlatform.DOTNET;
    }

    @Override
    public boolean validateEnvironment(BuildContext ctx) {
        log.info("Validating .NET environment...");
        var result = ctx.executor().execute(DOTNET, List.of("--version"), null, true, ctx.cancellation());
        if (!result.success()) {
            log.error(".NET SDK not found. Please install the .NET SDK from https://dotnet.microsoft.com/download");
            return false;
        }
        log.info(".NET SDK version: {}", result.stdout().trim());
        return true;
    }

    @Override
    public StepResult<Void> clean(Path projectDir, BuildContext ctx) {
        log.info("Cleaning .NET project...");
        var projectFile = resolveProjectFile(projectDir);
        if (projectFile.isFailure()) {
            return projectFile.propagate();
        }

        var args = List.of("clean", projectFile.value().getFileName().toString());
        var result = ctx.executor().execute(DOTNET, args, projectDir, true, ctx.cancellation());
        if (!result.success()) {
            return StepResult.failure(BuilderSupport.commandFailure(BuildStep.CLEAN,
                    "dotnet clean failed", DOTNET, args, result));
        }
        return StepResult.done();
    }

    @Override
    public StepResult<Path> build(Path projectDir, String outputPath, boolean verbose, BuildContext ctx) {
        log.info("Building .NET project...");
        var projectFile = resolveProjectFile(projectDir);
        if (projectFile.isFailure()) {
            return projectFile.propagate();
        }
        String projectName = projectFile.value().getFileName().toString();

        var sdkCheck = checkSdkVersion(projectFile.value(), ctx);
        if (sdkCheck.isFailure()) {
            return sdkCheck.propagate();
        }

        log.info("Restoring NuGet packages...");
        var restoreArgs = List.of("restore", projectName);
        var restore = BuilderSupport.run(ctx, projectDir, verbose, DOTNET, restoreArgs);
        if (!restore.success()) {
            return StepResult.failure(BuilderSupport.commandFailure(BuildStep.RESTORE,
                            "dotnet restore failed", DOTNET, restoreArgs, restore)
                    .withMitigation("Check the package sources in NuGet.config and your network connection",
                            "Run 'dotnet restore' in the project directory to see the full error"));
        }

        Path publishPath = BuilderSupport.resolveOutputPath(projectDir, outputPath);
        try {
            BuilderSupport.deleteRecursively(publishPath);
        } catch (IOException e) {
            return StepResult.failure(BuilderSupport.fileSystemFailure(BuildStep.PUBLISH,
                    "Could not remove old publish directory " + publishPath, e));
        }

        log.info("Publishing .NET application...");
        var publishArgs = List.of("publish", projectName, "-c", "Release", "-o", outputPath,
                "--self-contained", "false", "--verbosity", "minimal");
        var publish = BuilderSupport.run(ctx, projectDir, verbose, DOTNET, publishArgs);
        if (!publish.success()) {
            log.error("dotnet publish failed with exit code {}", publish.exitCode());
            return StepResult.failure(BuilderSupport.commandFailure(BuildStep.PUBLISH,
                            "dotnet publish failed", DOTNET, publishArgs, publish)
                    .withMitigation("Fix the compilation errors shown above",
                            "Run 'dotnet build' locally to reproduce the failure"));
        }

        if (!Files.isDirectory(publishPath)) {
            return StepResult.failure(BuildError.of(ErrorKind.ARTIFACT_MISSING, BuildStep.VERIFY_ARTIFACT,
                            "Expected publish output path not found: " + publishPath)
                    .withCommand(CommandExecutor.describe(DOTNET, publishArgs), publish.stdout()));
        }
        return StepResult.success(publishPath);
    }

    @Override
    public StepResult<DeploymentManifest> createManifest(Path projectDir, Path artifactPath, BuildContext ctx) {
        log.info("Creating deployment manifest for .NET...");

        Optional<Path> depsFile;
        try (var stream = Files.list(artifactPath)) {
            depsFile = stream
                    .filter(p -> p.getFileName().toString().endsWith(".deps.json"))
                    .min(Comparator.comparing(p -> p.getFileName().toString()));
        } catch (IOException e) {
            return StepResult.failure(BuildError.of(ErrorKind.MANIFEST_DETECTION_FAILED, BuildStep.CREATE_MANIFEST,
                            "Could not read publish output " + artifactPath + ": " + e.getMessage())
                    .withContext("artifactPath", artifactPath.toString()));
        }
        if (depsFile.isEmpty()) {
            return StepResult.failure(BuildError.of(ErrorKind.MANIFEST_DETECTION_FAILED, BuildStep.CREATE_MANIFEST,
                            "No .deps.json file found. Cannot determine entry point.")
                    .withMitigation("Make sure the project is an executable (OutputType Exe or a web SDK project)")
                    .withContext("artifactPath", artifactPath.toString()));
        }

        String fileName = depsFile.get().getFileName().toString();
        String entryDll = fileName.substring(0, fileName.length() - ".deps.json".length()) + ".dll";
        log.info("Detected entry point: {}", entryDll);

        String version = detectProjectVersion(projectDir).orElseGet(() -> fallbackVersion(ctx));
        return StepResult.success(new DeploymentManifest(platform().tag(), version, "dotnet " + entryDll));
    }

    private StepResult<Path> resolveProjectFile(Path projectDir) {
        return BuilderSupport.resolveProjectFile(projectDir, PROJECT_EXTENSIONS, ".NET project file");
    }

    private Optional<String> detectProjectVersion(Path projectDir) {
        var projectFile = resolveProjectFile(projectDir);
        if (projectFile.isFailure()) {
            return Optional.empty();
        }
        return DotNetProjectHelper.detectTargetRuntimeVersion(projectFile.value());
    }

    private String fallbackVersion(BuildContext ctx) {
        String fallback = ctx.properties().getDotnetFallback();
        if (ctx.properties().getVersionPolicy() != VersionPolicy.INSTALLED_TOOLCHAIN) {
            return fallback;
        }
        var result = ctx.executor().execute(DOTNET, List.of("--version"), null, true, ctx.cancellation());
        if (!result.success()) {
            return fallback;
        }
        return RuntimeVersions.majorMinor(result.stdout().trim()).orElse(fallback);
    }

    /**
     * Fails fast when the project targets a newer .NET than the installed SDK can build,
     * instead of letting restore fail with a less obvious message.
     */
    private StepResult<Void> checkSdkVersion(Path projectFile, BuildContext ctx) {
        var target = DotNetProjectHelper.detectTargetRuntimeVersion(projectFile);
        if (target.isEmpty()) {
            return StepResult.done();
        }
        CommandResult sdk = ctx.executor().execute(DOTNET, List.of("--version"), null, true, ctx.cancellation());
        if (!sdk.success()) {
            return StepResult.done();
        }
        String installed = sdk.stdout().trim();
        if (DotNetProjectHelper.isSdkCompatible(installed, target.get())) {
            return StepResult.done();
        }
        return StepResult.failure(BuildError.of(ErrorKind.SDK_VERSION_MISMATCH, BuildStep.RESTORE,
                        "The project targets .NET " + target.get() + ", but the installed .NET SDK is " + installed)
                .withMitigation("Install the .NET " + target.get() + " SDK from https://dotnet.microsoft.com/download",
                        "Restart your terminal after installation",
                        "Re-run the build")
                .withContext("projectFile", projectFile.toString())
                .withContext("targetFramework", "net" + target.get())
                .withContext("installedSdk", installed));
    }
}
