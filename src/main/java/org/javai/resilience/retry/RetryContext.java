package org.javai.resilience.retry;

import org.javai.resilience.SdkException;

import java.time.Duration;
import java.util.Objects;

/**
 * State of one retry sequence, handed to a {@link BackoffPolicy} after each failed attempt.
 *
 * @param attemptNumber The number of attempts made so far (1-based)
 * @param elapsed Time elapsed since the first attempt began
 * @param totalDelay Sum of the waits between attempts so far
 * @param lastError The error reported by the most recent attempt (null before the first failure)
 */
public record RetryContext(
        int attemptNumber,
        Duration elapsed,
        Duration totalDelay,
        SdkException lastError
) {
    public RetryContext {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        Objects.requireNonNull(elapsed, "elapsed must not be null");
        Objects.requireNonNull(totalDelay, "totalDelay must not be null");
    }

    public static RetryContext first() {
        return new RetryContext(1, Duration.ZERO, Duration.ZERO, null);
    }

    /**
     * Records the failure of the current attempt.
     */
    public RetryContext failed(SdkException error, Duration elapsedSinceStart) {
        return new RetryContext(attemptNumber, elapsedSinceStart, totalDelay, error);
    }

    /**
     * Moves on to the next attempt after waiting {@code delay}.
     */
    public RetryContext next(Duration delay) {
        return new RetryContext(attemptNumber + 1, elapsed, totalDelay.plus(delay), lastError);
    }
}
