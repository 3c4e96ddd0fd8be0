package org.javai.resilience.retry;

import org.javai.resilience.SdkErrors;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff bounded by a total time budget.
 *
 * <p>The delay after the n-th failed attempt is {@code initialInterval * multiplier^(n-1)},
 * capped at {@code maxInterval}, then spread by {@code randomizationFactor}: a factor of
 * 0.5 picks uniformly from [0.5 * delay, 1.5 * delay]. With a factor of 0 the sequence is
 * deterministic, e.g. 1ms, 2ms, 4ms, 5ms, 5ms for an initial interval of 1ms, a
 * multiplier of 2 and a 5ms cap.
 *
 * <p>If {@code maxElapsedTime} is positive, the policy gives up with
 * {@link SdkErrors#RETRY_MAX_ELAPSED_TIME_REACHED} once the time since the first attempt
 * plus the next delay would exceed it. A zero budget never gives up.
 */
public final class ExponentialBackoff implements BackoffPolicy {

    private final Duration initialInterval;
    private final Duration maxInterval;
    private final Duration maxElapsedTime;
    private final double multiplier;
    private final double randomizationFactor;

    public ExponentialBackoff(
            Duration initialInterval,
            Duration maxInterval,
            Duration maxElapsedTime,
            double multiplier,
            double randomizationFactor
    ) {
        this.initialInterval = requireNotNegative(initialInterval, "initialInterval");
        this.maxInterval = requireNotNegative(maxInterval, "maxInterval");
        this.maxElapsedTime = requireNotNegative(maxElapsedTime, "maxElapsedTime");
        if (!(multiplier >= 1.0) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("multiplier must be a finite value >= 1, was: " + multiplier);
        }
        if (!(randomizationFactor >= 0.0 && randomizationFactor <= 1.0)) {
            throw new IllegalArgumentException("randomizationFactor must be within [0, 1], was: " + randomizationFactor);
        }
        this.multiplier = multiplier;
        this.randomizationFactor = randomizationFactor;
    }

    @Override
    public String id() {
        return "exponential";
    }

    @Override
    public RetryDecision decide(RetryContext context) {
        Duration delay = randomize(intervalAfter(context.attemptNumber()));

        if (!maxElapsedTime.isZero() && context.elapsed().plus(delay).compareTo(maxElapsedTime) > 0) {
            return RetryDecision.GiveUp.because(SdkErrors.RETRY_MAX_ELAPSED_TIME_REACHED);
        }
        return RetryDecision.Retry.after(delay);
    }

    /**
     * Returns the un-randomized delay that follows the given failed attempt.
     */
    Duration intervalAfter(int attemptNumber) {
        long capNanos = maxInterval.toNanos();
        double nanos = initialInterval.toNanos() * Math.pow(multiplier, attemptNumber - 1);
        if (nanos >= capNanos) {
            return maxInterval;
        }
        return Duration.ofNanos((long) nanos);
    }

    private Duration randomize(Duration interval) {
        if (randomizationFactor == 0.0 || interval.isZero()) {
            return interval;
        }
        double nanos = interval.toNanos();
        double delta = randomizationFactor * nanos;
        double randomized = ThreadLocalRandom.current().nextDouble(nanos - delta, nanos + delta);
        return Duration.ofNanos((long) randomized);
    }

    public Duration initialInterval() {
        return initialInterval;
    }

    public Duration maxInterval() {
        return maxInterval;
    }

    public Duration maxElapsedTime() {
        return maxElapsedTime;
    }

    public double multiplier() {
        return multiplier;
    }

    public double randomizationFactor() {
        return randomizationFactor;
    }

    private static Duration requireNotNegative(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return value;
    }
}
