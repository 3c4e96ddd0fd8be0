package org.javai.resilience.retry;

import org.javai.resilience.Outcome;

/**
 * Executes an attempt repeatedly until it succeeds, fails permanently, runs out of
 * budget, or is cancelled.
 *
 * <p>A retrier only sees pass or fail. Use {@link TypedRetrier} for attempts that also
 * produce a value.
 */
@FunctionalInterface
public interface Retrier {

    /**
     * Runs {@code attempt} under this retrier's backoff.
     *
     * @param token cancellation signal, checked before and while waiting between attempts
     * @param attempt the work to execute
     * @return {@code Ok} on success, otherwise exactly one classified failure
     */
    Outcome<Void> retryWithBackoff(CancellationToken token, Attempt<Void> attempt);
}
