package com.launchpad.core.exec;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Runs external toolchain programs (dotnet, npm, python, az, ...).
 * <p>
 * Arguments are passed as a list and never re-parsed by a shell. Implementations must
 * honour the {@link CancellationToken} and thread interruption by destroying the child
 * process, and must report a program that cannot be launched as a failed
 * {@link CommandResult} rather than throwing.
 */
public interface CommandExecutor {

    /**
     * Runs a program to completion.
     *
     * @param program       executable name or path
     * @param args          arguments, one element per argument
     * @param workingDir    working directory, or null for the current directory
     * @param captureOutput capture stdout/stderr into the result; otherwise the child inherits the console
     * @param cancellation  cancellation signal for this invocation
     */
    CommandResult execute(String program, List<String> args, Path workingDir,
                          boolean captureOutput, CancellationToken cancellation);

    /**
     * Runs a program, forwarding every output line to {@code lineSink} as it is produced
     * while still capturing stdout and stderr into the result.
     */
    CommandResult executeStreaming(String program, List<String> args, Path workingDir,
                                   Consumer<String> lineSink, CancellationToken cancellation);

    default CommandResult execute(String program, List<String> args, Path workingDir) {
        return execute(program, args, workingDir, true, CancellationToken.NONE);
    }

    /** Renders a program and its arguments for logs and error messages. */
    static String describe(String program, List<String> args) {
        var sb = new StringBuilder(program);
        for (String arg : args) {
            sb.append(' ');
            if (arg.isEmpty() || arg.chars().anyMatch(Character::isWhitespace)) {
                sb.append('"').append(arg).append('"');
            } else {
                sb.append(arg);
            }
        }
        return sb.toString();
    }
}
