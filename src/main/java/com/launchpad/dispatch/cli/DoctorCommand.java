package com.launchpad.dispatch.cli;

import com.launchpad.core.config.LaunchpadProperties;
import com.launchpad.core.exec.CommandExecutor;
import com.launchpad.core.health.HealthStatus;
import com.launchpad.core.health.ToolchainHealthService;
import com.launchpad.core.model.ErrorKind;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: launchpad doctor
 * <p>
 * Checks every platform toolchain and reports which ones can build on this machine.
 * Fails only when none can.
 */
@Command(name = "doctor", mixinStandardHelpOptions = true, description = "Check which platform toolchains are installed")
@Component
public class DoctorCommand implements Callable<Integer> {

    private final ToolchainHealthService healthService;
    private final CommandExecutor executor;
    private final LaunchpadProperties properties;

    public DoctorCommand(ToolchainHealthService healthService, CommandExecutor executor,
                         LaunchpadProperties properties) {
        this.healthService = healthService;
        this.executor = executor;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<HealthStatus> checks;
        try (var session = new BuildSession(executor, properties, false)) {
            checks = healthService.checkAll(session.context());
        }

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> ConsoleOutput.error(label);
                case DEGRADED -> ConsoleOutput.warn(label);
            }
        }

        System.out.println(ConsoleOutput.RULE);
        var overall = ToolchainHealthService.overall(checks);
        switch (overall) {
            case UP -> ConsoleOutput.success("Overall: all toolchains available");
            case DEGRADED -> ConsoleOutput.warn("Overall: some toolchains missing");
            case DOWN -> ConsoleOutput.error("Overall: no toolchain available");
        }
        return overall == HealthStatus.Status.DOWN ? ErrorKind.ENVIRONMENT_MISSING.exitCode() : 0;
    }
}
