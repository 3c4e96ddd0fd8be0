package org.javai.resilience.retry;

import org.javai.resilience.SdkException;

import java.time.Duration;
import java.util.Objects;

/**
 * The decision made by a backoff policy after a failed attempt.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    /**
     * Retry the operation after waiting for the specified delay.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }

        public static Retry after(Duration delay) {
            return new Retry(delay);
        }
    }

    /**
     * Stop retrying. {@code reason} classifies why the budget ran out; the retrier wraps
     * the last observed error with it.
     */
    record GiveUp(SdkException reason) implements RetryDecision {
        public GiveUp {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        public static GiveUp because(SdkException reason) {
            return new GiveUp(reason);
        }
    }
}
