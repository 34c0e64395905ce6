package com.launchpad.core.exec;

import java.time.Duration;

/**
 * Outcome of one external process invocation.
 *
 * @param exitCode  process exit code; {@link #START_FAILED} when the program could not be launched
 * @param stdout    captured standard output (empty when not captured)
 * @param stderr    captured standard error, or the launch failure message
 * @param cancelled true when the process was destroyed by cancellation or interruption
 * @param timedOut  true when the process was destroyed for exceeding the executor timeout
 */
public record CommandResult(
    int exitCode,
    String stdout,
    String stderr,
    boolean cancelled,
    boolean timedOut
) {

    public static final int START_FAILED = -1;
    public static final int CANCELLED_EXIT_CODE = 130;
    public static final int TIMED_OUT_EXIT_CODE = 124;

    public CommandResult {
        stdout = stdout != null ? stdout : "";
        stderr = stderr != null ? stderr : "";
    }

    public CommandResult(int exitCode, String stdout, String stderr) {
        this(exitCode, stdout, stderr, false, false);
    }

    public static CommandResult startFailed(String reason) {
        return new CommandResult(START_FAILED, "", reason, false, false);
    }

    public static CommandResult cancelled(String stdout, String stderr) {
        return new CommandResult(CANCELLED_EXIT_CODE, stdout, stderr, true, false);
    }

    public static CommandResult timedOut(String stdout, String stderr, Duration limit) {
        String note = "timed out after " + limit.toMillis() + "ms\n";
        return new CommandResult(TIMED_OUT_EXIT_CODE, stdout, stderr + note, false, true);
    }

    public boolean success() {
        return exitCode == 0 && !cancelled && !timedOut;
    }
}
