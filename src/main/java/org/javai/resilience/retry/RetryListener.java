package org.javai.resilience.retry;

import org.javai.resilience.SdkException;

import java.time.Duration;

/**
 * Observes failed attempts that are about to be retried.
 *
 * <p>Listeners are called synchronously on the retrying thread, in attempt order, before
 * the retrier waits. A listener cannot influence the retry sequence; exceptions it throws
 * are logged and ignored.
 */
@FunctionalInterface
public interface RetryListener {

    /**
     * Called after a failed attempt, before waiting for the next one.
     *
     * @param error the error reported by the failed attempt
     * @param delay the wait before the next attempt
     * @param totalDelay the sum of all waits in this sequence, including {@code delay}
     */
    void onRetry(SdkException error, Duration delay, Duration totalDelay);

    /**
     * A listener that does nothing.
     */
    static RetryListener noOp() {
        return (error, delay, totalDelay) -> {};
    }
}
