package com.launchpad.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a build runs, used for CLI progress output.
 *
 * @param eventType event type (e.g. "build.started", "step.completed")
 * @param buildId   the build this event belongs to
 * @param step      step label (nullable for build-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record BuildEvent(
    String eventType,
    String buildId,
    String step,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String BUILD_STARTED = "build.started";
    public static final String STEP_STARTED = "step.started";
    public static final String STEP_COMPLETED = "step.completed";
    public static final String STEP_FAILED = "step.failed";
    public static final String BUILD_COMPLETED = "build.completed";
    public static final String BUILD_FAILED = "build.failed";

    public BuildEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    /** True for the last event of a run, after which no further events are published for it. */
    public boolean isTerminal() {
        return BUILD_COMPLETED.equals(eventType) || BUILD_FAILED.equals(eventType);
    }

    public static BuildEvent of(String eventType, String buildId, String step, Map<String, Object> payload) {
        return new BuildEvent(eventType, buildId, step, payload, Instant.now());
    }
}
