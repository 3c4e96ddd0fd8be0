package org.javai.resilience.retry;

/**
 * Decides whether and when to retry after a failed attempt.
 *
 * <p>Policies are immutable and hold no per-sequence state; everything they need is
 * in the {@link RetryContext}. One policy can serve any number of concurrent sequences.
 */
public interface BackoffPolicy {

    /**
     * A short identifier for this policy, used in logs.
     */
    String id();

    /**
     * Evaluates the state after a failed attempt.
     *
     * @param context The current retry context
     * @return Retry with a delay, or GiveUp with the exhaustion classification
     */
    RetryDecision decide(RetryContext context);
}
