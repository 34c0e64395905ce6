package com.launchpad.dispatch.cli;

import com.launchpad.core.builder.BuildContext;
import com.launchpad.core.config.LaunchpadProperties;
import com.launchpad.core.exec.CancellationToken;
import com.launchpad.core.exec.CommandExecutor;
import com.launchpad.core.model.ProjectPlatform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link BuildContext} for one CLI invocation whose cancellation token fires when the JVM is
 * asked to shut down (Ctrl+C), so running toolchain processes are destroyed with it.
 */
final class BuildSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BuildSession.class);

    private final CancellationToken token = new CancellationToken();
    private final Thread hook;
    private final BuildContext context;

    BuildSession(CommandExecutor executor, LaunchpadProperties properties, boolean verbose) {
        this.hook = new Thread(token::cancel, "launchpad-cancel");
        var base = new BuildContext(executor, null, token, properties);
        this.context = verbose ? base.withOutputSink(ConsoleOutput::toolOutput) : base;
        Runtime.getRuntime().addShutdownHook(hook);
    }

    BuildContext context() {
        return context;
    }

    @Override
    public void close() {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("Shutdown already in progress, keeping cancellation hook");
        }
    }

    /**
     * Parses a {@code --platform} value; null when absent.
     *
     * @throws IllegalArgumentException for an unknown platform name
     */
    static ProjectPlatform parsePlatform(String name) {
        return name == null || name.isBlank() ? null : ProjectPlatform.fromName(name);
    }
}
