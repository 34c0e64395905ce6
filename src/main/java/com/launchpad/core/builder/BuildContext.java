package com.launchpad.core.builder;

import com.launchpad.core.config.LaunchpadProperties;
import com.launchpad.core.exec.CancellationToken;
import com.launchpad.core.exec.CommandExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Collaborators handed to every builder call. Builders keep no per-project state,
 * so everything a step needs besides the project directory arrives here.
 *
 * @param executor     runs toolchain commands
 * @param outputSink   receives live toolchain output when a step runs verbose
 * @param cancellation cancels running commands of this build
 * @param properties   output layout and runtime fallbacks
 * @param deploymentZip archive name this run packages into, so builders can keep it out of the artifact
 */
public record BuildContext(
    CommandExecutor executor,
    Consumer<String> outputSink,
    CancellationToken cancellation,
    LaunchpadProperties properties,
    String deploymentZip
) {

    private static final Logger toolLog = LoggerFactory.getLogger("launchpad.tool-output");

    public BuildContext {
        Objects.requireNonNull(executor, "executor");
        outputSink = outputSink != null ? outputSink : line -> toolLog.info("  {}", line);
        cancellation = cancellation != null ? cancellation : CancellationToken.NONE;
        properties = properties != null ? properties : new LaunchpadProperties();
        deploymentZip = deploymentZip != null && !deploymentZip.isBlank() ? deploymentZip : properties.getDeploymentZip();
    }

    public BuildContext(CommandExecutor executor, Consumer<String> outputSink,
                        CancellationToken cancellation, LaunchpadProperties properties) {
        this(executor, outputSink, cancellation, properties, null);
    }

    public static BuildContext of(CommandExecutor executor, LaunchpadProperties properties) {
        return new BuildContext(executor, null, null, properties);
    }

    public BuildContext withCancellation(CancellationToken token) {
        return new BuildContext(executor, outputSink, token, properties, deploymentZip);
    }

    public BuildContext withDeploymentZip(String zipName) {
        return new BuildContext(executor, outputSink, cancellation, properties, zipName);
    }

    public BuildContext withOutputSink(Consumer<String> sink) {
        return new BuildContext(executor, sink, cancellation, properties, deploymentZip);
    }
}
