package org.javai.resilience.retry;

import org.javai.resilience.SdkException;

import java.util.Objects;

/**
 * Caps another policy at a fixed number of attempts.
 *
 * <p>Once {@code maxAttempts} attempts have failed, gives up with the configured
 * exhaustion error; until then the delegate decides.
 */
public final class AttemptLimitedBackoff implements BackoffPolicy {

    private final BackoffPolicy delegate;
    private final int maxAttempts;
    private final SdkException exhausted;

    public AttemptLimitedBackoff(BackoffPolicy delegate, int maxAttempts, SdkException exhausted) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.exhausted = Objects.requireNonNull(exhausted, "exhausted must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
    }

    @Override
    public String id() {
        return delegate.id() + "-max-" + maxAttempts;
    }

    @Override
    public RetryDecision decide(RetryContext context) {
        if (context.attemptNumber() >= maxAttempts) {
            return RetryDecision.GiveUp.because(exhausted);
        }
        return delegate.decide(context);
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
