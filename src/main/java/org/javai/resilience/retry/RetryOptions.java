package org.javai.resilience.retry;

import org.javai.resilience.SdkException;

import java.time.Duration;
import java.util.Objects;

/**
 * Factories for the recognised {@link RetryOption}s.
 *
 * <pre>{@code
 * Retrier retrier = ExponentialRetrier.create(
 *     RetryOptions.initialInterval(Duration.ofMillis(100)),
 *     RetryOptions.maxElapsedTime(Duration.ofSeconds(5)),
 *     RetryOptions.notify((error, delay, total) -> log.warn("retry in {}", delay)));
 * }</pre>
 */
public final class RetryOptions {

    private RetryOptions() {
        // Utility class
    }

    public static RetryOption initialInterval(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        return builder -> builder.initialInterval(interval);
    }

    public static RetryOption maxInterval(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        return builder -> builder.maxInterval(interval);
    }

    /**
     * Sets the total time budget; {@link Duration#ZERO} retries until cancelled.
     */
    public static RetryOption maxElapsedTime(Duration budget) {
        Objects.requireNonNull(budget, "budget must not be null");
        return builder -> builder.maxElapsedTime(budget);
    }

    public static RetryOption multiplier(double multiplier) {
        return builder -> builder.multiplier(multiplier);
    }

    public static RetryOption randomizationFactor(double factor) {
        return builder -> builder.randomizationFactor(factor);
    }

    /**
     * Limits the number of attempts; 0 removes the limit.
     */
    public static RetryOption maxAttempts(int maxAttempts) {
        return builder -> builder.maxAttempts(maxAttempts);
    }

    /**
     * Limits the number of attempts and reports exhaustion with the given error.
     */
    public static RetryOption maxAttempts(int maxAttempts, SdkException exhausted) {
        Objects.requireNonNull(exhausted, "exhausted must not be null");
        return builder -> builder.maxAttempts(maxAttempts, exhausted);
    }

    public static RetryOption notify(RetryListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        return builder -> builder.notify(listener);
    }
}
