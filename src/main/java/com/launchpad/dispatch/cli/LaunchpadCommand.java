package com.launchpad.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Launchpad.
 * Routes to subcommands: detect, build, manifest, clean, doctor.
 */
@Command(
        name = "launchpad",
        mixinStandardHelpOptions = true,
        version = "Launchpad 0.1.0",
        description = "Detects, builds and packages .NET, Node.js and Python projects for deployment",
        subcommands = {
                DetectCommand.class,
                BuildCommand.class,
                ManifestCommand.class,
                CleanCommand.class,
                DoctorCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LaunchpadCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
