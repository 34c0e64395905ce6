package com.launchpad.core.builder;

import com.launchpad.core.exec.CommandExecutor;
import com.launchpad.core.exec.CommandResult;
import com.launchpad.core.model.BuildError;
import com.launchpad.core.model.BuildStep;
import com.launchpad.core.model.ErrorKind;
import com.launchpad.core.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Command and filesystem plumbing shared by the platform builders.
 */
public final class BuilderSupport {

    private static final Logger log = LoggerFactory.getLogger(BuilderSupport.class);

    static final String DEPLOYMENT_FILE = ".deployment";
    static final String DEPLOYMENT_FILE_CONTENT = "[config]\nSCM_DO_BUILD_DURING_DEPLOYMENT=true\n";

    private BuilderSupport() {}

    /**
     * Runs a toolchain command. Verbose runs stream every line to the context's sink; quiet runs
     * capture output and only log it when the command fails.
     */
    public static CommandResult run(BuildContext ctx, Path workingDir, boolean verbose,
                                    String program, List<String> args) {
        CommandExecutor executor = ctx.executor();
        if (verbose) {
            return executor.executeStreaming(program, args, workingDir, ctx.outputSink(), ctx.cancellation());
        }
        var result = executor.execute(program, args, workingDir, true, ctx.cancellation());
        if (!result.success() && !result.cancelled()) {
            if (!result.stdout().isBlank()) {
                log.info("Output:\n{}", result.stdout().strip());
            }
            if (!result.stderr().isBlank()) {
                log.warn("Warnings/Errors:\n{}", result.stderr().strip());
            }
        }
        return result;
    }

    /**
     * Builds the error for a failed command. Cancelled runs are reported as {@link ErrorKind#CANCELLED};
     * a command killed by the executor timeout is a tool failure that names the limit.
     */
    public static BuildError commandFailure(BuildStep step, String message, String program,
                                            List<String> args, CommandResult result) {
        String command = CommandExecutor.describe(program, args);
        if (result.cancelled()) {
            return BuildError.of(ErrorKind.CANCELLED, step, "Build cancelled while running " + program)
                    .withCommand(command, result.stderr());
        }
        if (result.timedOut()) {
            return BuildError.of(ErrorKind.TOOL_INVOCATION_FAILED, step,
                            message + ": " + program + " timed out")
                    .withCommand(command, result.stderr())
                    .withMitigation("Raise launchpad.executor.timeout-seconds, or set it to 0 to wait indefinitely")
                    .withContext("timedOut", "true");
        }
        String diagnostics = result.stderr().isBlank() ? result.stdout() : result.stderr();
        return BuildError.of(ErrorKind.TOOL_INVOCATION_FAILED, step, message)
                .withCommand(command, diagnostics)
                .withContext("exitCode", String.valueOf(result.exitCode()));
    }

    public static BuildError fileSystemFailure(BuildStep step, String message, IOException e) {
        return BuildError.of(ErrorKind.FILESYSTEM_FAILURE, step, message + ": " + e.getMessage())
                .withMitigation("Check that the directory is writable and not locked by another process");
    }

    /**
     * Finds the project descriptor among the top-level files of {@code projectDir}.
     * With several candidates the first by file name is used and the rest are named in a warning.
     */
    public static StepResult<Path> resolveProjectFile(Path projectDir, List<String> extensions, String description) {
        List<Path> candidates;
        try (var stream = Files.list(projectDir)) {
            candidates = stream
                    .filter(Files::isRegularFile)
                    .filter(p -> hasExtension(p, extensions))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            return StepResult.failure(fileSystemFailure(BuildStep.RESOLVE_PROJECT,
                    "Could not list " + projectDir, e));
        }

        if (candidates.isEmpty()) {
            return StepResult.failure(BuildError.of(ErrorKind.PROJECT_NOT_FOUND, BuildStep.RESOLVE_PROJECT,
                            "No " + description + " found in " + projectDir)
                    .withMitigation("Run the command from the project root, or pass the project directory explicitly")
                    .withContext("projectDir", projectDir.toString()));
        }

        Path chosen = candidates.get(0);
        if (candidates.size() > 1) {
            var ignored = candidates.subList(1, candidates.size()).stream()
                    .map(p -> p.getFileName().toString())
                    .toList();
            log.warn("Multiple {} files found in {}: using {}, ignoring {}",
                    description, projectDir, chosen.getFileName(), String.join(", ", ignored));
        }
        return StepResult.success(chosen);
    }

    public static Path resolveOutputPath(Path projectDir, String outputPath) {
        Path output = Path.of(outputPath);
        return (output.isAbsolute() ? output : projectDir.resolve(output)).normalize();
    }

    static boolean hasExtension(Path file, List<String> extensions) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(name::endsWith);
    }

    /** Deletes a file or directory tree; a missing path is not an error. */
    public static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Copies a directory tree. {@code exclude} is tested against every entry's path relative to
     * {@code source}; an excluded directory is skipped with everything below it.
     */
    public static void copyTree(Path source, Path target, Predicate<Path> exclude) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Path relative = source.relativize(dir);
                if (!relative.toString().isEmpty() && exclude.test(relative)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                Files.createDirectories(target.resolve(relative.toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Path relative = source.relativize(file);
                if (!exclude.test(relative)) {
                    Files.copy(file, target.resolve(relative.toString()), StandardCopyOption.REPLACE_EXISTING);
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    public static void copyTree(Path source, Path target) throws IOException {
        copyTree(source, target, p -> false);
    }

    /**
     * Reads a text file as UTF-8, replacing undecodable bytes instead of failing. Used for files
     * that are only searched for ASCII markers and may be saved in another encoding.
     */
    public static String readText(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    /** Copies {@code projectDir/name} into {@code targetDir} when it exists. */
    public static boolean copyFileIfExists(Path projectDir, String name, Path targetDir) throws IOException {
        Path source = projectDir.resolve(name);
        if (!Files.isRegularFile(source)) {
            return false;
        }
        Files.copy(source, targetDir.resolve(name), StandardCopyOption.REPLACE_EXISTING);
        return true;
    }

    /** Writes the App Service marker that makes the host run its own build after upload. */
    public static void writeDeploymentFile(Path artifactDir) throws IOException {
        Files.writeString(artifactDir.resolve(DEPLOYMENT_FILE), DEPLOYMENT_FILE_CONTENT, StandardCharsets.UTF_8);
        log.info("Created {} file to request a remote build", DEPLOYMENT_FILE);
    }
}
