package com.launchpad.core.builder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.launchpad.core.config.LaunchpadProperties.VersionPolicy;
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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds Node.js projects with npm and stages the sources the App Service host needs
 * to run its own {@code npm install} after upload.
 */
@Component
public class NodeBuilder implements PlatformBuilder {

    private static final Logger log = LoggerFactory.getLogger(NodeBuilder.class);

    static final String PACKAGE_JSON = "package.json";
    private static final List<String> STAGED_FILES =
            List.of("package.json", "package-lock.json", "tsconfig.json", "ToolingManifest.json");
    private static final List<String> COMMON_ENTRY_POINTS = List.of("server.js", "app.js", "index.js", "main.js");
    private static final Pattern FIRST_INTEGER = Pattern.compile("(\\d+)");
    private static final String NPM = "npm";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AppSettingsConverter appSettingsConverter;

    public NodeBuilder(AppSettingsConverter appSettingsConverter) {
        this.appSettingsConverter = appSettingsConverter;
    }

    @Override
    public ProjectPlatform platform() {
        return ProjectPlatform.NODEJS;
    }

    @Override
    public boolean validateEnvironment(BuildContext ctx) {
        log.info("Validating Node.js environment...");
        var node = ctx.executor().execute("node", List.of("--version"), null, true, ctx.cancellation());
        if (!node.success()) {
            log.error("Node.js not found. Please install Node.js from https://nodejs.org/");
            return false;
        }
        var npm = ctx.executor().execute(NPM, List.of("--version"), null, true, ctx.cancellation());
        if (!npm.success()) {
            log.error("npm not found. Please install Node.js which includes npm.");
            return false;
        }
        log.info("Node.js version: {}", node.stdout().trim());
        log.info("npm version: {}", npm.stdout().trim());
        return true;
    }

    @Override
    public StepResult<Void> clean(Path projectDir, BuildContext ctx) {
        log.info("Cleaning Node.js project...");
        if (!Files.isRegularFile(projectDir.resolve(PACKAGE_JSON))) {
            return StepResult.failure(projectNotFound(projectDir, BuildStep.CLEAN));
        }
        Path nodeModules = projectDir.resolve("node_modules");
        if (Files.isDirectory(nodeModules)) {
            log.info("Removing node_modules directory...");
            try {
                BuilderSupport.deleteRecursively(nodeModules);
            } catch (IOException e) {
                return StepResult.failure(BuilderSupport.fileSystemFailure(BuildStep.CLEAN,
                        "Could not remove " + nodeModules, e));
            }
        }
        return StepResult.done();
    }

    @Override
    public StepResult<Path> build(Path projectDir, String outputPath, boolean verbose, BuildContext ctx) {
        log.info("Building Node.js project...");

        Path publishPath = BuilderSupport.resolveOutputPath(projectDir, outputPath);
        try {
            if (Files.exists(publishPath)) {
                log.info("Removing old publish directory...");
                BuilderSupport.deleteRecursively(publishPath);
            }
        } catch (IOException e) {
            return StepResult.failure(BuilderSupport.fileSystemFailure(BuildStep.PUBLISH,
                    "Could not remove old publish directory " + publishPath, e));
        }

        Path packageJson = projectDir.resolve(PACKAGE_JSON);
        if (!Files.isRegularFile(packageJson)) {
            return StepResult.failure(projectNotFound(projectDir, BuildStep.RESOLVE_PROJECT));
        }

        log.info("Installing dependencies...");
        var install = BuilderSupport.run(ctx, projectDir, verbose, NPM, List.of("ci"));
        if (!install.success() && !install.cancelled() && !install.timedOut()) {
            log.warn("npm ci failed, trying npm install...");
            install = BuilderSupport.run(ctx, projectDir, verbose, NPM, List.of("install"));
        }
        if (!install.success()) {
            return StepResult.failure(BuilderSupport.commandFailure(BuildStep.RESTORE,
                            "Failed to install npm dependencies", NPM, List.of("install"), install)
                    .withMitigation("Check package.json for invalid dependency versions",
                            "Delete package-lock.json and node_modules, then run 'npm install' locally"));
        }

        if (hasBuildScript(packageJson)) {
            log.info("Running build script...");
            var buildArgs = List.of("run", "build");
            var build = BuilderSupport.run(ctx, projectDir, verbose, NPM, buildArgs);
            if (!build.success()) {
                return StepResult.failure(BuilderSupport.commandFailure(BuildStep.PUBLISH,
                                "npm run build failed", NPM, buildArgs, build)
                        .withMitigation("Run 'npm run build' locally and fix the reported errors"));
            }
        } else {
            log.info("No build script found, skipping build step");
        }

        try {
            stage(projectDir, publishPath);
        } catch (IOException e) {
            return StepResult.failure(BuilderSupport.fileSystemFailure(BuildStep.PUBLISH,
                    "Could not prepare deployment package in " + publishPath, e));
        }

        if (!Files.isDirectory(publishPath)) {
            return StepResult.failure(BuildError.of(ErrorKind.ARTIFACT_MISSING, BuildStep.VERIFY_ARTIFACT,
                    "Expected publish output path not found: " + publishPath));
        }
        return StepResult.success(publishPath);
    }

    private void stage(Path projectDir, Path publishPath) throws IOException {
        Files.createDirectories(publishPath);
        log.info("Preparing deployment package...");

        for (String name : STAGED_FILES) {
            BuilderSupport.copyFileIfExists(projectDir, name, publishPath);
        }

        Path src = projectDir.resolve("src");
        if (Files.isDirectory(src)) {
            BuilderSupport.copyTree(src, publishPath.resolve("src"));
        }

        try (var stream = Files.list(projectDir)) {
            for (Path file : stream.filter(Files::isRegularFile).toList()) {
                String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
                if (name.endsWith(".js") || name.endsWith(".ts")) {
                    Files.copy(file, publishPath.resolve(file.getFileName().toString()),
                            StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }

        Path dist = projectDir.resolve("dist");
        if (Files.isDirectory(dist)) {
            log.info("Found dist folder, copying to publish output...");
            BuilderSupport.copyTree(dist, publishPath.resolve("dist"));
        } else {
            log.info("No dist folder found in project; the deployment host build has to produce runtime output");
        }

        BuilderSupport.writeDeploymentFile(publishPath);
    }

    @Override
    public StepResult<DeploymentManifest> createManifest(Path projectDir, Path artifactPath, BuildContext ctx) {
        log.info("Creating deployment manifest for Node.js...");

        Path packageJson = projectDir.resolve(PACKAGE_JSON);
        if (!Files.isRegularFile(packageJson)) {
            return StepResult.failure(projectNotFound(projectDir, BuildStep.CREATE_MANIFEST));
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(packageJson, StandardCharsets.UTF_8));
        } catch (IOException e) {
            return StepResult.failure(BuildError.of(ErrorKind.MANIFEST_DETECTION_FAILED, BuildStep.CREATE_MANIFEST,
                            "Could not parse package.json: " + e.getMessage())
                    .withContext("packageJson", packageJson.toString()));
        }

        String version = engineVersion(root).orElseGet(() -> fallbackVersion(ctx));

        Optional<String> command = startCommand(root, artifactPath);
        if (command.isEmpty()) {
            return StepResult.failure(BuildError.of(ErrorKind.MANIFEST_DETECTION_FAILED, BuildStep.CREATE_MANIFEST,
                            "Could not determine a start command for the Node.js project")
                    .withMitigation("Add a \"start\" script to package.json",
                            "Or set \"main\" to the entry file, or add server.js, app.js, index.js or main.js")
                    .withContext("artifactPath", artifactPath.toString()));
        }

        String buildCommand = "";
        boolean buildRequired = false;
        if (!text(root.path("scripts").path("build")).isBlank()) {
            buildCommand = "npm run build";
            buildRequired = true;
            log.info("Detected build script; remote build command: {}", buildCommand);
        } else {
            log.info("No build script found; the deployment host will only run npm install");
        }

        return StepResult.success(new DeploymentManifest(platform().tag(), version, command.get(),
                buildCommand, buildRequired));
    }

    @Override
    public boolean convertEnvironmentToDeploymentSettings(Path projectDir, String resourceGroup, String appName,
                                                          boolean verbose, BuildContext ctx) {
        return appSettingsConverter.convertIfPresent(projectDir, resourceGroup, appName, verbose, ctx);
    }

    private Optional<String> startCommand(JsonNode root, Path artifactPath) {
        String start = text(root.path("scripts").path("start"));
        if (!start.isBlank()) {
            log.info("Detected start command from package.json: {}", start);
            return Optional.of(start);
        }
        String main = text(root.path("main"));
        if (!main.isBlank()) {
            log.info("Detected start command from main property: node {}", main);
            return Optional.of("node " + main);
        }
        for (String entryPoint : COMMON_ENTRY_POINTS) {
            if (Files.isRegularFile(artifactPath.resolve(entryPoint))) {
                log.info("Detected entry point in publish folder: {}", entryPoint);
                return Optional.of("node " + entryPoint);
            }
        }
        return Optional.empty();
    }

    private static Optional<String> engineVersion(JsonNode root) {
        String range = text(root.path("engines").path("node"));
        Matcher m = FIRST_INTEGER.matcher(range);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    private String fallbackVersion(BuildContext ctx) {
        String fallback = ctx.properties().getNodeFallback();
        if (ctx.properties().getVersionPolicy() != VersionPolicy.INSTALLED_TOOLCHAIN) {
            return fallback;
        }
        var result = ctx.executor().execute("node", List.of("--version"), null, true, ctx.cancellation());
        if (!result.success()) {
            return fallback;
        }
        return RuntimeVersions.major(result.stdout().trim()).map(String::valueOf).orElse(fallback);
    }

    private boolean hasBuildScript(Path packageJson) {
        try {
            JsonNode root = objectMapper.readTree(Files.readString(packageJson, StandardCharsets.UTF_8));
            return !text(root.path("scripts").path("build")).isBlank();
        } catch (IOException e) {
            log.warn("Could not parse {}: {}", packageJson, e.getMessage());
            return false;
        }
    }

    private static String text(JsonNode node) {
        return node.isTextual() ? node.asText() : "";
    }

    private static BuildError projectNotFound(Path projectDir, BuildStep step) {
        return BuildError.of(ErrorKind.PROJECT_NOT_FOUND, step, "No package.json found in " + projectDir)
                .withMitigation("Run 'npm init' to create package.json, or point at the project root")
                .withContext("projectDir", projectDir.toString());
    }
}
