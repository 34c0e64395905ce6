package com.launchpad.core.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared by one orchestrated build.
 * <p>
 * Running commands register a callback that destroys their child process; calling
 * {@link #cancel()} fires every registered callback once. Callbacks registered after
 * cancellation run immediately.
 */
public class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    /** A token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            // shared instance, cannot be cancelled
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CopyOnWriteArrayList<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Cancellation requested, stopping {} running command(s)", callbacks.size());
            for (Runnable callback : callbacks) {
                runSafely(callback);
            }
        }
    }

    /**
     * Registers a callback to run on cancellation.
     *
     * @return a handle that removes the callback when closed
     */
    public Registration register(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get()) {
            runSafely(callback);
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Handle for removing a cancellation callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    private void runSafely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }
}
