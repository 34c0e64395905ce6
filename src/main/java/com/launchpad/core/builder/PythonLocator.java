package com.launchpad.core.builder;

import com.launchpad.core.exec.CancellationToken;
import com.launchpad.core.exec.CommandExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds a Python interpreter: PATH lookup first, then common install locations,
 * then the {@code py} launcher on Windows.
 */
@Component
public class PythonLocator {

    private static final Logger log = LoggerFactory.getLogger(PythonLocator.class);

    private static final List<String> UNIX_LOCATIONS = List.of(
            "/usr/bin/python3",
            "/usr/local/bin/python3",
            "/opt/homebrew/bin/python3",
            "/opt/local/bin/python3",
            "/usr/bin/python",
            "/usr/local/bin/python");

    private final boolean windows;
    private final List<Path> commonLocations;

    public PythonLocator() {
        this(System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win"), null);
    }

    PythonLocator(boolean windows, List<Path> commonLocations) {
        this.windows = windows;
        this.commonLocations = commonLocations != null ? List.copyOf(commonLocations) : defaultLocations(windows);
    }

    public Optional<String> find(CommandExecutor executor, CancellationToken cancellation) {
        var onPath = findOnPath(executor, cancellation);
        if (onPath.isPresent()) {
            return onPath;
        }
        var installed = commonLocations.stream().filter(Files::isRegularFile).findFirst();
        if (installed.isPresent()) {
            log.debug("Using Python from common install location {}", installed.get());
            return installed.map(Path::toString);
        }
        if (windows) {
            return findWithLauncher(executor, cancellation);
        }
        return Optional.empty();
    }

    private Optional<String> findOnPath(CommandExecutor executor, CancellationToken cancellation) {
        String lookup = windows ? "where" : "which";
        List<String> names = windows ? List.of("python", "python3") : List.of("python3", "python");
        for (String name : names) {
            var result = executor.execute(lookup, List.of(name), null, true, cancellation);
            if (!result.success() || result.stdout().isBlank()) {
                continue;
            }
            Optional<String> first = result.stdout().lines()
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .findFirst();
            if (first.isPresent() && Files.isRegularFile(Path.of(first.get()))) {
                return first;
            }
        }
        return Optional.empty();
    }

    private Optional<String> findWithLauncher(CommandExecutor executor, CancellationToken cancellation) {
        var result = executor.execute("py", List.of("-3", "-c", "import sys; print(sys.executable)"),
                null, true, cancellation);
        if (result.success() && !result.stdout().isBlank()) {
            String path = result.stdout().trim();
            if (Files.isRegularFile(Path.of(path))) {
                return Optional.of(path);
            }
        }
        return Optional.empty();
    }

    private static List<Path> defaultLocations(boolean windows) {
        if (!windows) {
            return UNIX_LOCATIONS.stream().map(Path::of).toList();
        }
        String localAppData = System.getenv().getOrDefault("LOCALAPPDATA", "");
        String programFiles = System.getenv().getOrDefault("ProgramFiles", "C:\\Program Files");
        var candidates = new ArrayList<Path>();
        if (!localAppData.isEmpty()) {
            candidates.add(Path.of(localAppData, "Microsoft", "WindowsApps", "python.exe"));
            candidates.add(Path.of(localAppData, "Microsoft", "WindowsApps", "python3.exe"));
        }
        for (int ver = 313; ver >= 38; ver--) {
            candidates.add(Path.of("C:\\Python" + ver, "python.exe"));
            if (!localAppData.isEmpty()) {
                candidates.add(Path.of(localAppData, "Programs", "Python", "Python" + ver, "python.exe"));
            }
            candidates.add(Path.of(programFiles, "Python" + ver, "python.exe"));
        }
        return candidates;
    }
}
