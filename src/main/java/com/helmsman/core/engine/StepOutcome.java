package com.helmsman.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Value produced by a pipeline step, flagged when it came from the step's
 * fallback instead of its primary computation.
 *
 * @param value    the step's value, never null
 * @param degraded true when the fallback supplied the value
 * @param failure  message of the failure that triggered the fallback, null otherwise
 */
public record StepOutcome<T>(T value, boolean degraded, String failure) {

    private static final Logger log = LoggerFactory.getLogger(StepOutcome.class);

    public static <T> StepOutcome<T> ok(T value) {
        return new StepOutcome<>(value, false, null);
    }

    public static <T> StepOutcome<T> degraded(T value, String failure) {
        return new StepOutcome<>(value, true, failure);
    }

    /**
     * Runs {@code primary}; if it throws a runtime exception, logs it and
     * returns the value of {@code fallback} marked as degraded.
     *
     * @param step name of the step for logging
     */
    public static <T> StepOutcome<T> attempt(String step, Supplier<T> primary, Supplier<T> fallback) {
        try {
            return ok(primary.get());
        } catch (RuntimeException e) {
            log.warn("Step '{}' failed, using fallback: {}", step, e.toString());
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return degraded(fallback.get(), message);
        }
    }
}
