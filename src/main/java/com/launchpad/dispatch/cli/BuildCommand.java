package com.launchpad.dispatch.cli;

import com.launchpad.core.config.LaunchpadProperties;
import com.launchpad.core.engine.BuildOrchestrator;
import com.launchpad.core.events.EventBus;
import com.launchpad.core.exec.CommandExecutor;
import com.launchpad.core.model.BuildReport;
import com.launchpad.core.model.BuildRequest;
import com.launchpad.core.model.ErrorKind;
import com.launchpad.core.model.ProjectPlatform;
import com.launchpad.core.packaging.ManifestWriter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: launchpad build [dir]
 * <p>
 * Detects the platform, builds the project into the publish directory, writes the deployment
 * manifest and optionally pushes .env settings and zips the result. The exit code reflects the
 * kind of failure: 1 for build and tool errors, 2 for environment or configuration problems.
 */
@Command(name = "build", mixinStandardHelpOptions = true, description = "Build a project and write its deployment manifest")
@Component
public class BuildCommand implements Callable<Integer> {

    @Parameters(index = "0", defaultValue = ".", description = "Project directory (default: current directory)")
    private Path projectDir;

    @Option(names = {"--output", "-o"}, description = "Publish directory, relative to the project (default: launchpad.build.output-path)")
    private String output;

    @Option(names = {"--verbose", "-v"}, description = "Stream toolchain output")
    private boolean verbose;

    @Option(names = "--platform", description = "Skip detection: dotnet, nodejs or python")
    private String platform;

    @Option(names = "--package", description = "Zip the publish directory into the deployment archive")
    private boolean createPackage;

    @Option(names = "--json", description = "Print the manifest as JSON")
    private boolean json;

    @Option(names = "--resource-group", description = "Resource group of the target web app (enables .env conversion)")
    private String resourceGroup;

    @Option(names = "--app-name", description = "Name of the target web app (enables .env conversion)")
    private String appName;

    private final BuildOrchestrator orchestrator;
    private final EventBus eventBus;
    private final ManifestWriter manifestWriter;
    private final CommandExecutor executor;
    private final LaunchpadProperties properties;

    public BuildCommand(BuildOrchestrator orchestrator, EventBus eventBus, ManifestWriter manifestWriter,
                        CommandExecutor executor, LaunchpadProperties properties) {
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
        this.manifestWriter = manifestWriter;
        this.executor = executor;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        if (!json) {
            ConsoleOutput.printBanner();
        }

        ProjectPlatform override;
        try {
            override = BuildSession.parsePlatform(platform);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return ErrorKind.PLATFORM_UNSUPPORTED.exitCode();
        }

        boolean hasRg = resourceGroup != null && !resourceGroup.isBlank();
        boolean hasApp = appName != null && !appName.isBlank();
        if (hasRg != hasApp) {
            ConsoleOutput.warn("Both --resource-group and --app-name are needed for .env conversion; skipping it");
        }

        var request = new BuildRequest(projectDir, output != null ? output : properties.getOutputPath(),
                verbose, override, resourceGroup, appName, createPackage, properties.getDeploymentZip());

        String buildId = orchestrator.generateBuildId();
        BuildReport report;
        try (var progress = json ? EventBus.Subscription.NONE : eventBus.subscribe(buildId, ConsoleOutput::buildEvent);
             var session = new BuildSession(executor, properties, verbose)) {
            report = orchestrator.run(buildId, request, session.context());
        }

        if (!report.succeeded()) {
            ConsoleOutput.buildError(report.error());
            return report.exitCode();
        }

        if (json) {
            System.out.println(manifestWriter.toJson(report.manifest()));
            return 0;
        }
        ConsoleOutput.manifest(report.manifest());
        System.out.println(ConsoleOutput.RULE);
        ConsoleOutput.success(report.platform().displayName() + " build " + report.buildId()
                + " completed in " + ConsoleOutput.formatDuration(report.durationMs()));
        ConsoleOutput.info("Artifact: " + report.artifactPath());
        if (report.packagePath() != null) {
            ConsoleOutput.info("Package:  " + report.packagePath());
        }
        return 0;
    }
}
