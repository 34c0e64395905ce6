package com.launchpad.core.builder;

import com.launchpad.core.model.BuildError;
import com.launchpad.core.model.BuildStep;
import com.launchpad.core.model.DeploymentManifest;
import com.launchpad.core.model.ErrorKind;
import com.launchpad.core.model.ProjectPlatform;
import com.launchpad.core.model.StepResult;
import com.launchpad.core.packaging.DeploymentPackager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Prepares Python projects for a remote build: syntax-checks the top-level modules, stages the
 * sources and local wheels, and writes a requirements file that installs the project from them.
 * <p>
 * The interpreter is located on every call that needs it; nothing is cached between calls.
 */
@Component
public class PythonBuilder implements PlatformBuilder {

    private static final Logger log = LoggerFactory.getLogger(PythonBuilder.class);

    static final List<String> CLEAN_DIRECTORIES = List.of(
            "__pycache__", ".pytest_cache", "*.egg-info", "build", ".venv*", "venv",
            ".venv_test", ".venv_local", ".virtual", "env", "ENV", ".mypy_cache",
            ".coverage", "htmlcov", ".tox", "dist_temp");
    static final List<String> CLEAN_FILES = List.of("uv.lock", ".coverage", "pytest.ini", "tox.ini", ".env_backup");
    static final List<String> COPY_EXCLUDES = List.of(
            "__pycache__", ".git", ".venv*", "venv", "node_modules", ".vs", ".vscode", "*.pyc",
            ".env", ".pytest_cache", "uv.lock", ".venv_test", ".venv_local", ".virtual", "env", "ENV");

    static final String REQUIREMENTS_CONTENT = "--find-links dist\n--pre\n-e .\n";
    private static final Pattern RUNTIME_TXT_VERSION = Pattern.compile("python-(\\d+\\.\\d+)");
    private static final Pattern INTERPRETER_VERSION = Pattern.compile("Python (\\d+\\.\\d+)");

    private final PythonLocator pythonLocator;
    private final AppSettingsConverter appSettingsConverter;

    public PythonBuilder(PythonLocator pythonLocator, AppSettingsConverter appSettingsConverter) {
        this.pythonLocator = pythonLocator;
        this.appSettingsConverter = appSettingsConverter;
    }

    @Override
    public ProjectPlatform platform() {
        return ProjectPlatform.PYTHON;
    }

    @Override
    public boolean validateEnvironment(BuildContext ctx) {
        log.info("Validating Python environment...");
        Optional<String> python = locate(ctx);
        if (python.isEmpty()) {
            log.error("Python not found. Please install Python from https://www.python.org/");
            return false;
        }
        var version = ctx.executor().execute(python.get(), List.of("--version"), null, true, ctx.cancellation());
        if (!version.success()) {
            log.error("Python at {} could not be run. Please install Python from https://www.python.org/", python.get());
            return false;
        }
        var pip = ctx.executor().execute(python.get(), List.of("-m", "pip", "--version"), null, true, ctx.cancellation());
        if (!pip.success()) {
            log.error("pip not found. Please ensure pip is installed with Python.");
            return false;
        }
        log.info("Python version: {}", firstNonBlank(version.stdout(), version.stderr()));
        log.info("pip version: {}", pip.stdout().trim());
        return true;
    }

    @Override
    public StepResult<Void> clean(Path projectDir, BuildContext ctx) {
        log.debug("Cleaning Python project...");

        try (Stream<Path> entries = Files.list(projectDir)) {
            for (Path dir : entries.filter(Files::isDirectory).toList()) {
                String name = dir.getFileName().toString();
                if (matchesAny(name, CLEAN_DIRECTORIES)) {
                    deleteQuietly(dir);
                }
            }
        } catch (IOException e) {
            return StepResult.failure(BuilderSupport.fileSystemFailure(BuildStep.CLEAN,
                    "Could not list " + projectDir, e));
        }

        try (Stream<Path> files = Files.walk(projectDir)) {
            files.filter(p -> p.getFileName().toString().endsWith(".pyc"))
                    .filter(Files::isRegularFile)
                    .toList()
                    .forEach(PythonBuilder::deleteQuietly);
        } catch (IOException | UncheckedIOException e) {
            log.debug("Could not scan {} for compiled files: {}", projectDir, e.getMessage());
        }

        for (String name : CLEAN_FILES) {
            Path file = projectDir.resolve(name);
            if (Files.isRegularFile(file)) {
                deleteQuietly(file);
            }
        }
        return StepResult.done();
    }

    @Override
    public StepResult<Path> build(Path projectDir, String outputPath, boolean verbose, BuildContext ctx) {
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

        log.info("Building Python project...");
        Optional<String> python = locate(ctx);
        if (python.isEmpty()) {
            return StepResult.failure(pythonMissing(BuildStep.PUBLISH));
        }

        var compiled = compileTopLevelModules(projectDir, python.get(), ctx);
        if (compiled.isFailure()) {
            return compiled.propagate();
        }

        try {
            Files.createDirectories(publishPath);
            log.info("Copying project files...");
            String manifestFileName = ctx.properties().getManifestFileName();
            BuilderSupport.copyTree(projectDir, publishPath, relative ->
                    projectDir.resolve(relative.toString()).normalize().equals(publishPath)
                            || isDeploymentArchive(projectDir, relative, ctx.deploymentZip(), manifestFileName)
                            || anySegmentMatches(relative, COPY_EXCLUDES));

            Path publishDist = publishPath.resolve("dist");
            Optional<Path> sourceDist = distDirectory(projectDir);
            if (sourceDist.isPresent()) {
                log.info("Copying existing dist folder from {} to publish directory...", sourceDist.get());
                BuilderSupport.copyTree(sourceDist.get(), publishDist);
                log.info("Copied {} wheel files from source dist/", countWheels(publishDist));
            }

            var packages = ensureLocalPackages(publishPath, publishDist, verbose, ctx);
            if (packages.isFailure()) {
                return packages.propagate();
            }

            Files.writeString(publishPath.resolve("requirements.txt"), REQUIREMENTS_CONTENT, StandardCharsets.UTF_8);
            log.info("Created requirements.txt for deployment");

            BuilderSupport.writeDeploymentFile(publishPath);

            if (BuilderSupport.copyFileIfExists(projectDir, ".env.template", publishPath)) {
                log.info("Copied .env.template file");
            }
            log.info("Excluded .env file from deployment package; set its values as app settings instead");
        } catch (IOException e) {
            return StepResult.failure(BuilderSupport.fileSystemFailure(BuildStep.PUBLISH,
                    "Could not prepare deployment package in " + publishPath, e));
        }

        if (!Files.isDirectory(publishPath)) {
            return StepResult.failure(BuildError.of(ErrorKind.ARTIFACT_MISSING, BuildStep.VERIFY_ARTIFACT,
                    "Expected publish output path not found: " + publishPath));
        }
        log.info("Python project prepared for deployment; the host installs dependencies on upload");
        return StepResult.success(publishPath);
    }

    @Override
    public StepResult<DeploymentManifest> createManifest(Path projectDir, Path artifactPath, BuildContext ctx) {
        log.info("Creating deployment manifest for Python...");

        String version = detectVersion(projectDir, ctx);
        Optional<String> command;
        try {
            Files.writeString(artifactPath.resolve("runtime.txt"), "python-" + version, StandardCharsets.UTF_8);
            log.info("Created runtime.txt for Python version detection");
            command = PythonEntryPointDetector.detect(artifactPath);
        } catch (IOException e) {
            return StepResult.failure(BuilderSupport.fileSystemFailure(BuildStep.CREATE_MANIFEST,
                    "Could not inspect publish output " + artifactPath, e));
        }

        if (command.isEmpty()) {
            return StepResult.failure(BuildError.of(ErrorKind.MANIFEST_DETECTION_FAILED, BuildStep.CREATE_MANIFEST,
                            "No Python file found in the publish output, cannot determine a start command")
                    .withMitigation("Add an entry module such as app.py or main.py to the project root")
                    .withContext("artifactPath", artifactPath.toString()));
        }
        return StepResult.success(new DeploymentManifest(platform().tag(), version, command.get(), "", true));
    }

    @Override
    public boolean convertEnvironmentToDeploymentSettings(Path projectDir, String resourceGroup, String appName,
                                                          boolean verbose, BuildContext ctx) {
        return appSettingsConverter.convertIfPresent(projectDir, resourceGroup, appName, verbose, ctx);
    }

    private Optional<String> locate(BuildContext ctx) {
        return pythonLocator.find(ctx.executor(), ctx.cancellation());
    }

    private StepResult<Void> compileTopLevelModules(Path projectDir, String python, BuildContext ctx) {
        List<Path> modules;
        try {
            modules = PythonEntryPointDetector.topLevelPythonFiles(projectDir);
        } catch (IOException e) {
            return StepResult.failure(BuilderSupport.fileSystemFailure(BuildStep.PUBLISH,
                    "Could not list " + projectDir, e));
        }
        for (Path module : modules) {
            var args = List.of("-m", "py_compile", module.toString());
            var result = ctx.executor().execute(python, args, projectDir, true, ctx.cancellation());
            if (!result.success()) {
                log.error("Python syntax error in {}:\n{}", module.getFileName(), result.stderr().strip());
                return StepResult.failure(BuilderSupport.commandFailure(BuildStep.PUBLISH,
                                "Python syntax error in " + module.getFileName(), python, args, result)
                        .withMitigation("Fix the syntax error reported above and re-run the build"));
            }
        }
        return StepResult.done();
    }

    /** Builds wheels into the publish directory when no prebuilt ones were staged. */
    private StepResult<Void> ensureLocalPackages(Path publishPath, Path publishDist, boolean verbose,
                                                 BuildContext ctx) throws IOException {
        long existing = countWheels(publishDist);
        if (existing > 0) {
            log.info("Found {} existing wheel files in publish/dist", existing);
            return StepResult.done();
        }

        log.info("No local packages found in publish/dist, running uv build in publish directory...");
        var args = List.of("build");
        var result = BuilderSupport.run(ctx, publishPath, verbose, "uv", args);
        if (result.cancelled()) {
            return StepResult.failure(BuilderSupport.commandFailure(BuildStep.PUBLISH,
                    "uv build was cancelled", "uv", args, result));
        }
        if (!result.success()) {
            log.warn("uv build failed: {}. Continuing without local packages.", result.stderr().strip());
        } else {
            log.info("Built {} local packages in publish directory", countWheels(publishDist));
        }
        return StepResult.done();
    }

    /** This run's archive, or a top-level archive an earlier run packaged under another name. */
    static boolean isDeploymentArchive(Path projectDir, Path relative, String zipName, String manifestFileName) {
        if (relative.getNameCount() != 1) {
            return false;
        }
        return relative.toString().equals(zipName)
                || DeploymentPackager.isDeploymentArchive(projectDir.resolve(relative.toString()), manifestFileName);
    }

    private String detectVersion(Path projectDir, BuildContext ctx) {
        Path runtimeTxt = projectDir.resolve("runtime.txt");
        if (Files.isRegularFile(runtimeTxt)) {
            try {
                Matcher m = RUNTIME_TXT_VERSION.matcher(BuilderSupport.readText(runtimeTxt));
                if (m.find()) {
                    log.info("Detected Python version from runtime.txt: {}", m.group(1));
                    return m.group(1);
                }
            } catch (IOException e) {
                log.warn("Could not read {}: {}", runtimeTxt, e.getMessage());
            }
            return ctx.properties().getPythonFallback();
        }

        Optional<String> python = locate(ctx);
        if (python.isPresent()) {
            var result = ctx.executor().execute(python.get(), List.of("--version"), null, true, ctx.cancellation());
            if (result.success()) {
                Matcher m = INTERPRETER_VERSION.matcher(result.stdout() + "\n" + result.stderr());
                if (m.find()) {
                    log.info("Detected Python version: {}", m.group(1));
                    return m.group(1);
                }
            }
        } else {
            log.warn("Python not found; using fallback version {}", ctx.properties().getPythonFallback());
        }
        return ctx.properties().getPythonFallback();
    }

    private static Optional<Path> distDirectory(Path projectDir) {
        Path local = projectDir.resolve("dist");
        if (Files.isDirectory(local)) {
            return Optional.of(local);
        }
        Path parent = projectDir.toAbsolutePath().getParent();
        if (parent != null && Files.isDirectory(parent.resolve("dist"))) {
            return Optional.of(parent.resolve("dist"));
        }
        return Optional.empty();
    }

    private static long countWheels(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".whl")).count();
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            log.debug("Removing {}...", path.getFileName());
            BuilderSupport.deleteRecursively(path);
        } catch (IOException e) {
            log.debug("Could not remove {}: {}", path.getFileName(), e.getMessage());
        }
    }

    static boolean anySegmentMatches(Path relative, List<String> patterns) {
        for (Path segment : relative) {
            if (matchesAny(segment.toString(), patterns)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Case-insensitive match of a file name against exact names, {@code *.ext} suffix patterns
     * and {@code prefix*} patterns.
     */
    static boolean matchesAny(String name, List<String> patterns) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (String pattern : patterns) {
            String p = pattern.toLowerCase(Locale.ROOT);
            if (p.startsWith("*.") && lower.endsWith(p.substring(1))) {
                return true;
            }
            if (p.endsWith("*") && !p.startsWith("*") && lower.startsWith(p.substring(0, p.length() - 1))) {
                return true;
            }
            if (lower.equals(p)) {
                return true;
            }
        }
        return false;
    }

    private static String firstNonBlank(String a, String b) {
        return !a.isBlank() ? a.trim() : b.trim();
    }

    private static BuildError pythonMissing(BuildStep step) {
        return BuildError.of(ErrorKind.ENVIRONMENT_MISSING, step, "Python executable could not be located")
                .withMitigation("Install Python from https://www.python.org/",
                        "Make sure python3 or python is on PATH");
    }
}
