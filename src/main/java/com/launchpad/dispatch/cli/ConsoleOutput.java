package com.launchpad.dispatch.cli;

import com.launchpad.core.events.BuildEvent;
import com.launchpad.core.model.BuildError;
import com.launchpad.core.model.DeploymentManifest;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Launchpad CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) LAUNCHPAD v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LAUNCHPAD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /** Live toolchain output of a verbose build. */
    public static void toolOutput(String line) {
        System.out.println("  " + line);
    }

    /** Renders a failed build: the formatted error block, red headline first. */
    public static void buildError(BuildError error) {
        String[] lines = error.formatted().split("\\R");
        error(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            System.out.println(lines[i]);
        }
    }

    public static void manifest(DeploymentManifest manifest) {
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Deployment Manifest|@"));
        System.out.println("  Platform: " + manifest.platform());
        System.out.println("  Version:  " + manifest.version());
        System.out.println("  Command:  " + manifest.command());
        if (manifest.buildRequired()) {
            System.out.println("  Remote build: " + (manifest.buildCommand().isBlank()
                    ? "required" : manifest.buildCommand()));
        }
    }

    public static void buildEvent(BuildEvent event) {
        String step = event.step() != null ? event.step() : "";
        String line = switch (event.eventType()) {
            case BuildEvent.STEP_STARTED -> "@|fg(cyan) [STEP]|@ " + step + "...";
            case BuildEvent.STEP_COMPLETED -> "@|fg(green) [DONE]|@ " + step
                    + " (" + formatDuration(asLong(event.payload().get("durationMs"))) + ")";
            case BuildEvent.STEP_FAILED -> "@|fg(red),bold [FAILED]|@ " + step;
            default -> null;
        };
        if (line != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private static long asLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
