package com.launchpad.core.model;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a single build step: either a value or a {@link BuildError}.
 * <p>
 * Builders return these instead of throwing so the orchestrator can tell which
 * step failed and why without unwinding through process waits.
 *
 * @param <T> the value produced on success ({@link Void} for steps without output)
 */
public final class StepResult<T> {

    private final T value;
    private final BuildError error;

    private StepResult(T value, BuildError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> StepResult<T> success(T value) {
        return new StepResult<>(value, null);
    }

    public static StepResult<Void> done() {
        return new StepResult<>(null, null);
    }

    public static <T> StepResult<T> failure(BuildError error) {
        return new StepResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @throws IllegalStateException if this result is a failure
     */
    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value on failed step: " + error.message());
        }
        return value;
    }

    public Optional<BuildError> error() {
        return Optional.ofNullable(error);
    }

    /** Re-types a failure so it can be returned from a step with a different value type. */
    @SuppressWarnings("unchecked")
    public <U> StepResult<U> propagate() {
        if (error == null) {
            throw new IllegalStateException("Cannot propagate a successful step");
        }
        return (StepResult<U>) this;
    }

    public <U> StepResult<U> map(Function<? super T, ? extends U> mapper) {
        return error == null ? success(mapper.apply(value)) : propagate();
    }

    @Override
    public String toString() {
        return error == null ? "StepResult[success=" + value + "]" : "StepResult[failure=" + error.kind() + "]";
    }
}
