package com.launchpad.core.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * {@link CommandExecutor} backed by {@link ProcessBuilder}.
 * <p>
 * stdout and stderr are drained on two pump threads so neither pipe can fill up and block
 * the child. The pumps append to {@link StringBuffer}s, which are read while a pump may still run. Cancellation, interruption and the optional timeout all destroy the child and
 * its descendants.
 */
public class ProcessCommandExecutor implements CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandExecutor.class);

    private static final long DESTROY_GRACE_MS = 200;
    private static final long PUMP_JOIN_MS = 5_000;

    /** Launchers that are batch scripts on Windows and need {@code cmd.exe /c}. */
    private static final Set<String> WINDOWS_BATCH_COMMANDS = Set.of("az", "func", "npm", "npx", "node");

    private final Duration timeout;
    private final boolean windows;

    /**
     * @param timeout maximum run time per command; {@link Duration#ZERO} waits indefinitely
     */
    public ProcessCommandExecutor(Duration timeout) {
        this(timeout, isWindowsHost());
    }

    ProcessCommandExecutor(Duration timeout, boolean windows) {
        this.timeout = timeout != null ? timeout : Duration.ZERO;
        this.windows = windows;
    }

    @Override
    public CommandResult execute(String program, List<String> args, Path workingDir,
                                 boolean captureOutput, CancellationToken cancellation) {
        var command = buildCommand(program, args);
        log.debug("Executing: {}", CommandExecutor.describe(program, args));

        var builder = new ProcessBuilder(command);
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }
        if (!captureOutput) {
            builder.inheritIO();
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.debug("Could not start {}: {}", program, e.getMessage());
            return CommandResult.startFailed("Could not start '" + program + "': " + e.getMessage());
        }

        var stdout = new StringBuffer();
        var stderr = new StringBuffer();
        var pumps = new ArrayList<Thread>();
        if (captureOutput) {
            pumps.add(pump(process.getInputStream(), stdout, line -> log.trace("{}", line), program + "-stdout"));
            pumps.add(pump(process.getErrorStream(), stderr, line -> log.trace("{}", line), program + "-stderr"));
        }
        return await(process, program, cancellation, pumps, stdout, stderr);
    }

    @Override
    public CommandResult executeStreaming(String program, List<String> args, Path workingDir,
                                          Consumer<String> lineSink, CancellationToken cancellation) {
        var command = buildCommand(program, args);
        log.debug("Executing with streaming: {}", CommandExecutor.describe(program, args));

        var builder = new ProcessBuilder(command);
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.debug("Could not start {}: {}", program, e.getMessage());
            return CommandResult.startFailed("Could not start '" + program + "': " + e.getMessage());
        }

        // both pumps share the sink, so lines are handed over one at a time
        var lock = new Object();
        Consumer<String> serialized = line -> {
            synchronized (lock) {
                lineSink.accept(line);
            }
        };

        var stdout = new StringBuffer();
        var stderr = new StringBuffer();
        var pumps = List.of(
                pump(process.getInputStream(), stdout, serialized, program + "-stdout"),
                pump(process.getErrorStream(), stderr, serialized, program + "-stderr"));
        return await(process, program, cancellation, pumps, stdout, stderr);
    }

    private CommandResult await(Process process, String program, CancellationToken cancellation,
                                List<Thread> pumps, StringBuffer stdout, StringBuffer stderr) {
        try (var registration = cancellation.register(() -> destroyTree(process))) {
            boolean finished;
            if (timeout.isZero()) {
                process.waitFor();
                finished = true;
            } else {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }

            if (!finished) {
                log.error("{} did not finish within {}s, terminating it", program, timeout.toSeconds());
                destroyTree(process);
                joinPumps(pumps, program);
                return CommandResult.timedOut(stdout.toString(), stderr.toString(), timeout);
            }

            joinPumps(pumps, program);
            if (cancellation.isCancelled()) {
                return CommandResult.cancelled(stdout.toString(), stderr.toString());
            }

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.debug("{} exited with code {}", program, exitCode);
            }
            return new CommandResult(exitCode, stdout.toString(), stderr.toString());
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for {}, terminating it", program);
            destroyTree(process);
            Thread.currentThread().interrupt();
            return CommandResult.cancelled(stdout.toString(), stderr.toString());
        }
    }

    List<String> buildCommand(String program, List<String> args) {
        var command = new ArrayList<String>();
        if (windows && needsCmdWrapper(program)) {
            command.add("cmd.exe");
            command.add("/c");
        }
        command.add(program);
        command.addAll(args);
        return command;
    }

    static boolean needsCmdWrapper(String program) {
        String name = Path.of(program).getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".cmd") || name.endsWith(".bat")) {
            return true;
        }
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return WINDOWS_BATCH_COMMANDS.contains(stem);
    }

    private static Thread pump(InputStream stream, StringBuffer sink, Consumer<String> listener, String name) {
        var thread = new Thread(() -> {
            try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    sink.append(line).append('\n');
                    listener.accept(line);
                }
            } catch (IOException e) {
                log.debug("Output stream of {} closed: {}", name, e.getMessage());
            }
        }, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Waits for the pumps to drain. A descendant that inherited the pipes (an MSBuild node, say)
     * can keep them open after the child exits; such a pump is left running and its buffer is
     * read as it stands.
     */
    private static void joinPumps(List<Thread> pumps, String program) throws InterruptedException {
        for (Thread pump : pumps) {
            pump.join(PUMP_JOIN_MS);
            if (pump.isAlive()) {
                log.warn("Output of {} still open after {}ms, captured output may be incomplete",
                        program, PUMP_JOIN_MS);
            }
        }
    }

    private static void destroyTree(Process process) {
        if (!process.isAlive()) {
            return;
        }
        log.debug("Destroying process tree for pid {}", process.pid());
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(DESTROY_GRACE_MS, TimeUnit.MILLISECONDS)) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    private static boolean isWindowsHost() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }
}
