package com.launchpad.dispatch.cli;

import com.launchpad.core.config.LaunchpadProperties;
import com.launchpad.core.engine.BuildOrchestrator;
import com.launchpad.core.exec.CommandExecutor;
import com.launchpad.core.model.DeploymentManifest;
import com.launchpad.core.model.ErrorKind;
import com.launchpad.core.model.ProjectPlatform;
import com.launchpad.core.packaging.ManifestWriter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: launchpad manifest [dir]
 * <p>
 * Derives the deployment manifest for an artifact that was built earlier.
 */
@Command(name = "manifest", mixinStandardHelpOptions = true, description = "Derive the deployment manifest of a built artifact")
@Component
public class ManifestCommand implements Callable<Integer> {

    @Parameters(index = "0", defaultValue = ".", description = "Project directory (default: current directory)")
    private Path projectDir;

    @Option(names = "--artifact", description = "Publish directory, relative to the project (default: launchpad.build.output-path)")
    private String artifact;

    @Option(names = "--platform", description = "Skip detection: dotnet, nodejs or python")
    private String platform;

    @Option(names = "--write", description = "Also write the manifest file into the artifact")
    private boolean write;

    @Option(names = "--json", description = "Print the manifest as JSON instead of TOML")
    private boolean json;

    private final BuildOrchestrator orchestrator;
    private final ManifestWriter manifestWriter;
    private final CommandExecutor executor;
    private final LaunchpadProperties properties;

    public ManifestCommand(BuildOrchestrator orchestrator, ManifestWriter manifestWriter,
                           CommandExecutor executor, LaunchpadProperties properties) {
        this.orchestrator = orchestrator;
        this.manifestWriter = manifestWriter;
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

        Path artifactPath = Path.of(artifact != null ? artifact : properties.getOutputPath());
        try (var session = new BuildSession(executor, properties, false)) {
            var result = orchestrator.deriveManifest(projectDir, artifactPath, override, session.context());
            if (result.isFailure()) {
                var error = result.error().orElseThrow();
                ConsoleOutput.buildError(error);
                return error.kind().exitCode();
            }

            DeploymentManifest manifest = result.value();
            if (write) {
                Path dir = projectDir.toAbsolutePath().normalize();
                Path target = artifactPath.isAbsolute() ? artifactPath : dir.resolve(artifactPath);
                try {
                    manifestWriter.write(manifest, target, properties.getManifestFileName());
                } catch (IOException e) {
                    ConsoleOutput.error("Could not write manifest: " + e.getMessage());
                    return ErrorKind.FILESYSTEM_FAILURE.exitCode();
                }
            }
            System.out.print(json ? manifestWriter.toJson(manifest) + System.lineSeparator() : manifest.toToml());
            return 0;
        }
    }
}
