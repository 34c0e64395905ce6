package com.launchpad.core.builder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads .NET project metadata and compares SDK versions.
 */
public final class DotNetProjectHelper {

    private static final Logger log = LoggerFactory.getLogger(DotNetProjectHelper.class);

    private static final Pattern TARGET_FRAMEWORK = Pattern.compile(
            "<TargetFrameworks?>\\s*([^<]+)\\s*</TargetFrameworks?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern NET_VERSION = Pattern.compile("net(\\d+)\\.(\\d+)", Pattern.CASE_INSENSITIVE);

    private DotNetProjectHelper() {}

    /**
     * Detects the runtime version ("8.0", "9.0") a project targets from its
     * {@code <TargetFramework>} or {@code <TargetFrameworks>} element. With several target
     * frameworks the first one listed wins. Platform suffixes such as {@code -windows} are ignored.
     *
     * @return the version, or empty when the file is missing or declares no recognizable framework
     */
    public static Optional<String> detectTargetRuntimeVersion(Path projectFile) {
        if (!Files.isRegularFile(projectFile)) {
            log.warn("Project file not found: {}", projectFile);
            return Optional.empty();
        }

        String content;
        try {
            content = BuilderSupport.readText(projectFile);
        } catch (IOException e) {
            log.warn("Could not read project file {}: {}", projectFile, e.getMessage());
            return Optional.empty();
        }

        Matcher tfmMatch = TARGET_FRAMEWORK.matcher(content);
        if (!tfmMatch.find()) {
            log.warn("No TargetFramework(s) found in project file: {}", projectFile);
            return Optional.empty();
        }

        Optional<String> tfm = Arrays.stream(tfmMatch.group(1).split(";"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .findFirst();
        if (tfm.isEmpty()) {
            return Optional.empty();
        }

        Matcher versionMatch = NET_VERSION.matcher(tfm.get());
        if (!versionMatch.find()) {
            log.warn("Unrecognized TargetFramework format: {}", tfm.get());
            return Optional.empty();
        }

        String version = versionMatch.group(1) + "." + versionMatch.group(2);
        log.info("Detected TargetFramework {} -> .NET {}", tfm.get(), version);
        return Optional.of(version);
    }

    /**
     * An SDK can build a target framework when its major version is at least the target's.
     * Unparseable versions are treated as compatible so the toolchain reports the real problem.
     */
    public static boolean isSdkCompatible(String installedSdkVersion, String targetVersion) {
        var installed = RuntimeVersions.major(installedSdkVersion);
        var target = RuntimeVersions.major(targetVersion);
        if (installed.isEmpty() || target.isEmpty()) {
            return true;
        }
        return installed.get() >= target.get();
    }
}
