package com.launchpad.dispatch.cli;

import com.launchpad.core.config.LaunchpadProperties;
import com.launchpad.core.engine.BuildOrchestrator;
import com.launchpad.core.exec.CommandExecutor;
import com.launchpad.core.model.ErrorKind;
import com.launchpad.core.model.ProjectPlatform;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: launchpad clean [dir]
 */
@Command(name = "clean", mixinStandardHelpOptions = true, description = "Remove build state left by earlier builds")
@Component
public class CleanCommand implements Callable<Integer> {

    @Parameters(index = "0", defaultValue = ".", description = "Project directory (default: current directory)")
    private Path projectDir;

    @Option(names = "--platform", description = "Skip detection: dotnet, nodejs or python")
    private String platform;

    private final BuildOrchestrator orchestrator;
    private final CommandExecutor executor;
    private final LaunchpadProperties properties;

    public CleanCommand(BuildOrchestrator orchestrator, CommandExecutor executor, LaunchpadProperties properties) {
        this.orchestrator = orchestrator;
        this.executor = executor;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ProjectPlatform override;
        try {
            override = BuildSession.parsePlatform(platform);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return ErrorKind.PLATFORM_UNSUPPORTED.exitCode();
        }

        try (var session = new BuildSession(executor, properties, false)) {
            var result = orchestrator.clean(projectDir, override, session.context());
            if (result.isFailure()) {
                var error = result.error().orElseThrow();
                ConsoleOutput.buildError(error);
                return error.kind().exitCode();
            }
            ConsoleOutput.success("Cleaned " + result.value().displayName() + " project in "
                    + projectDir.toAbsolutePath().normalize());
            return 0;
        }
    }
}
