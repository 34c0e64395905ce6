package com.launchpad.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Delivers the progress events of each build run to the listeners of that run.
 * <p>
 * Every build id gets a channel that lives from its first event or subscription until the
 * terminal {@code build.completed} / {@code build.failed} event. Listeners that join while the
 * run is in progress first receive the events already published for it, in order. Once the
 * terminal event has been delivered the channel and its listeners are dropped, so callers do
 * not have to unsubscribe from finished runs.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Replay history kept per run; a run publishes a few events per step. */
    static final int MAX_HISTORY = 256;

    private final ConcurrentHashMap<String, Channel> channels = new ConcurrentHashMap<>();

    public void publish(BuildEvent event) {
        log.debug("Publishing {} for build {}", event.eventType(), event.buildId());
        Channel channel = channels.computeIfAbsent(event.buildId(), Channel::new);
        synchronized (channel) {
            channel.remember(event);
            for (Consumer<BuildEvent> listener : List.copyOf(channel.listeners)) {
                deliverSafely(listener, event);
            }
            if (event.isTerminal()) {
                channel.listeners.clear();
                channels.remove(event.buildId(), channel);
                log.debug("Build {} finished, released its listeners", event.buildId());
            }
        }
    }

    /**
     * Subscribes to one build run. Events the run already published are replayed to the
     * listener before this method returns.
     *
     * @return a handle that detaches the listener; closing it after the run finished is a no-op
     */
    public Subscription subscribe(String buildId, Consumer<BuildEvent> listener) {
        Channel channel = channels.computeIfAbsent(buildId, Channel::new);
        synchronized (channel) {
            for (BuildEvent past : channel.history) {
                deliverSafely(listener, past);
            }
            channel.listeners.add(listener);
        }
        return () -> detach(channel, listener);
    }

    /** Build ids whose runs have not published a terminal event yet. */
    public Set<String> activeBuilds() {
        return Set.copyOf(channels.keySet());
    }

    private void detach(Channel channel, Consumer<BuildEvent> listener) {
        synchronized (channel) {
            channel.listeners.remove(listener);
            // a subscription that never saw an event leaves nothing behind
            if (channel.listeners.isEmpty() && channel.history.isEmpty()) {
                channels.remove(channel.buildId, channel);
            }
        }
    }

    private void deliverSafely(Consumer<BuildEvent> listener, BuildEvent event) {
        try {
            listener.accept(event);
        } catch (Exception e) {
            log.warn("Listener failed on {} for build {}: {}", event.eventType(), event.buildId(), e.getMessage(), e);
        }
    }

    /**
     * Detaches a listener. Closing twice, or after the run finished, does nothing.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        Subscription NONE = () -> {};

        @Override
        void close();
    }

    private static final class Channel {
        private final String buildId;
        private final List<Consumer<BuildEvent>> listeners = new ArrayList<>();
        private final Deque<BuildEvent> history = new ArrayDeque<>();

        Channel(String buildId) {
            this.buildId = buildId;
        }

        void remember(BuildEvent event) {
            if (history.size() == MAX_HISTORY) {
                history.removeFirst();
            }
            history.addLast(event);
        }
    }
}
