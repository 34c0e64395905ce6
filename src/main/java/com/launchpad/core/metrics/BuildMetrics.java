package com.launchpad.core.metrics;

import com.launchpad.core.model.BuildStep;
import com.launchpad.core.model.ProjectPlatform;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer metrics for detection and build runs.
 */
@Service
public class BuildMetrics {

    private final MeterRegistry registry;

    public BuildMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDetection(ProjectPlatform platform) {
        Counter.builder("launchpad.detections.total")
                .tag("platform", platform.tag())
                .register(registry)
                .increment();
    }

    public void recordStepDuration(ProjectPlatform platform, BuildStep step, long ms) {
        Timer.builder("launchpad.step.duration")
                .tag("platform", platform.tag())
                .tag("step", step.label())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "success" or the error code of the failure
     */
    public void recordBuildResult(ProjectPlatform platform, String outcome) {
        Counter.builder("launchpad.builds.total")
                .tag("platform", platform.tag())
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
