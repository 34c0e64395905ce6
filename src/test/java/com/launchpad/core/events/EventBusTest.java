package com.launchpad.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
    }

    private static BuildEvent stepStarted(String buildId, String step) {
        return BuildEvent.of(BuildEvent.STEP_STARTED, buildId, step, Map.of());
    }

    private static BuildEvent finished(String buildId, String type) {
        return BuildEvent.of(type, buildId, null, Map.of());
    }

    private static List<String> steps(List<BuildEvent> events) {
        return events.stream().map(BuildEvent::step).toList();
    }

    // ── Delivery ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("delivery")
    class Delivery {

        @Test
        @DisplayName("delivers events only to listeners of the same build")
        void deliversPerBuild() {
            var received = new ArrayList<BuildEvent>();
            bus.subscribe("LP-1", received::add);

            bus.publish(stepStarted("LP-1", "detect"));
            bus.publish(stepStarted("LP-2", "detect"));

            assertEquals(1, received.size());
            assertEquals("LP-1", received.get(0).buildId());
        }

        @Test
        @DisplayName("a late listener first receives the run's earlier events in order")
        void replaysHistory() {
            bus.publish(stepStarted("LP-1", "detect"));
            bus.publish(stepStarted("LP-1", "clean"));

            var received = new ArrayList<BuildEvent>();
            bus.subscribe("LP-1", received::add);
            bus.publish(stepStarted("LP-1", "build"));

            assertEquals(List.of("detect", "clean", "build"), steps(received));
        }

        @Test
        @DisplayName("replay keeps only the most recent events of a long run")
        void boundedHistory() {
            for (int i = 0; i < EventBus.MAX_HISTORY + 10; i++) {
                bus.publish(stepStarted("LP-1", "s" + i));
            }

            var received = new ArrayList<BuildEvent>();
            bus.subscribe("LP-1", received::add);

            assertEquals(EventBus.MAX_HISTORY, received.size());
            assertEquals("s10", received.get(0).step());
        }

        @Test
        @DisplayName("a throwing listener does not block the others")
        void throwingListener() {
            var received = new ArrayList<BuildEvent>();
            bus.subscribe("LP-1", e -> { throw new IllegalStateException("boom"); });
            bus.subscribe("LP-1", received::add);

            assertDoesNotThrow(() -> bus.publish(stepStarted("LP-1", "build")));
            assertEquals(1, received.size());
        }
    }

    // ── Run lifecycle ────────────────────────────────────────────────

    @Nested
    @DisplayName("run lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("the terminal event is delivered and then the run's listeners are released")
        void releasesOnCompletion() {
            var received = new ArrayList<BuildEvent>();
            bus.subscribe("LP-1", received::add);

            bus.publish(stepStarted("LP-1", "build"));
            bus.publish(finished("LP-1", BuildEvent.BUILD_COMPLETED));

            assertEquals(BuildEvent.BUILD_COMPLETED, received.get(1).eventType());
            assertEquals(Set.of(), bus.activeBuilds());
        }

        @Test
        @DisplayName("a failed run is released the same way")
        void releasesOnFailure() {
            bus.subscribe("LP-1", e -> { });
            bus.publish(stepStarted("LP-2", "detect"));

            bus.publish(finished("LP-1", BuildEvent.BUILD_FAILED));

            assertEquals(Set.of("LP-2"), bus.activeBuilds());
        }

        @Test
        @DisplayName("closing a subscription stops delivery; closing again is harmless")
        void close() {
            var received = new ArrayList<BuildEvent>();
            var subscription = bus.subscribe("LP-1", received::add);

            bus.publish(stepStarted("LP-1", "detect"));
            subscription.close();
            bus.publish(stepStarted("LP-1", "clean"));

            assertEquals(1, received.size());
            assertDoesNotThrow(subscription::close);
        }

        @Test
        @DisplayName("a subscription closed before any event leaves no channel behind")
        void unusedSubscription() {
            try (var ignored = bus.subscribe("LP-9", e -> { })) {
                assertEquals(Set.of("LP-9"), bus.activeBuilds());
            }

            assertEquals(Set.of(), bus.activeBuilds());
        }

        @Test
        @DisplayName("a reused build id starts with an empty history")
        void reusedBuildId() {
            bus.publish(stepStarted("LP-1", "detect"));
            bus.publish(finished("LP-1", BuildEvent.BUILD_COMPLETED));

            var received = new ArrayList<BuildEvent>();
            bus.subscribe("LP-1", received::add);

            assertTrue(received.isEmpty());
        }
    }

    @Test
    @DisplayName("events copy their payload and default the timestamp")
    void eventPayload() {
        var payload = new HashMap<String, Object>();
        payload.put("platform", "dotnet");
        var event = BuildEvent.of(BuildEvent.BUILD_STARTED, "LP-1", null, payload);
        payload.put("late", "value");

        assertEquals(Map.of("platform", "dotnet"), event.payload());
        assertNotNull(event.timestamp());
        assertFalse(event.isTerminal());
        assertTrue(finished("LP-1", BuildEvent.BUILD_FAILED).isTerminal());
    }
}
