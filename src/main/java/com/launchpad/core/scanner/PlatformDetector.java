package com.launchpad.core.scanner;

import com.launchpad.core.metrics.BuildMetrics;
import com.launchpad.core.model.ProjectPlatform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which platform a project directory belongs to from the marker files at its top level.
 * <p>
 * Rules are checked in a fixed order and the first match wins, so a directory holding both a
 * {@code .csproj} and some {@code .py} scripts is a .NET project:
 * <ol>
 *   <li>.NET: any {@code *.csproj}, {@code *.fsproj} or {@code *.vbproj}</li>
 *   <li>Node.js: {@code package.json}, or any {@code *.js} / {@code *.ts} file</li>
 *   <li>Python: {@code requirements.txt}, {@code setup.py}, {@code pyproject.toml}, or any {@code *.py} file</li>
 * </ol>
 * Subdirectories are not inspected. File names are matched case-insensitively.
 */
@Service
public class PlatformDetector {

    private static final Logger log = LoggerFactory.getLogger(PlatformDetector.class);

    private static final List<String> DOTNET_EXTENSIONS = List.of(".csproj", ".fsproj", ".vbproj");
    private static final List<String> NODE_EXTENSIONS = List.of(".js", ".ts");
    private static final Set<String> PYTHON_MARKERS = Set.of("requirements.txt", "setup.py", "pyproject.toml");

    private final BuildMetrics metrics;

    public PlatformDetector(@Autowired(required = false) BuildMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Detects the platform of {@code projectDir}.
     * <p>
     * Never throws: a null, missing or unreadable directory is logged and reported as
     * {@link ProjectPlatform#UNKNOWN}.
     */
    public ProjectPlatform detect(Path projectDir) {
        if (projectDir == null || projectDir.toString().isBlank()) {
            log.error("No project directory given for platform detection");
            return ProjectPlatform.UNKNOWN;
        }
        if (!Files.isDirectory(projectDir)) {
            log.error("Project directory not found: {}", projectDir);
            return ProjectPlatform.UNKNOWN;
        }

        Set<String> names;
        try {
            names = topLevelFileNames(projectDir);
        } catch (IOException e) {
            log.error("Could not list project directory {}: {}", projectDir, e.getMessage());
            return ProjectPlatform.UNKNOWN;
        }

        ProjectPlatform platform = classify(names);
        log.info("Detected platform {} in {}", platform.displayName(), projectDir);
        if (metrics != null) {
            metrics.recordDetection(platform);
        }
        return platform;
    }

    static ProjectPlatform classify(Set<String> lowerCaseNames) {
        if (anyEndsWith(lowerCaseNames, DOTNET_EXTENSIONS)) {
            return ProjectPlatform.DOTNET;
        }
        if (lowerCaseNames.contains("package.json") || anyEndsWith(lowerCaseNames, NODE_EXTENSIONS)) {
            return ProjectPlatform.NODEJS;
        }
        if (lowerCaseNames.stream().anyMatch(PYTHON_MARKERS::contains)
                || anyEndsWith(lowerCaseNames, List.of(".py"))) {
            return ProjectPlatform.PYTHON;
        }
        return ProjectPlatform.UNKNOWN;
    }

    private static Set<String> topLevelFileNames(Path dir) throws IOException {
        try (var stream = Files.list(dir)) {
            return stream.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString().toLowerCase(Locale.ROOT))
                    .collect(Collectors.toSet());
        }
    }

    private static boolean anyEndsWith(Set<String> names, List<String> extensions) {
        return names.stream().anyMatch(n -> extensions.stream().anyMatch(n::endsWith));
    }
}
