package com.launchpad.dispatch.cli;

import com.launchpad.core.model.ErrorKind;
import com.launchpad.core.model.ProjectPlatform;
import com.launchpad.core.scanner.PlatformDetector;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: launchpad detect [dir]
 */
@Command(name = "detect", mixinStandardHelpOptions = true, description = "Detect the platform of a project directory")
@Component
public class DetectCommand implements Callable<Integer> {

    @Parameters(index = "0", defaultValue = ".", description = "Project directory (default: current directory)")
    private Path projectDir;

    private final PlatformDetector detector;

    public DetectCommand(PlatformDetector detector) {
        this.detector = detector;
    }

    @Override
    public Integer call() {
        ProjectPlatform platform = detector.detect(projectDir);
        if (platform == ProjectPlatform.UNKNOWN) {
            ConsoleOutput.error("Could not detect a supported platform in " + projectDir.toAbsolutePath().normalize());
            return ErrorKind.PLATFORM_UNDETECTED.exitCode();
        }
        ConsoleOutput.success("Detected platform: " + platform.displayName() + " (" + platform.tag() + ")");
        return 0;
    }
}
