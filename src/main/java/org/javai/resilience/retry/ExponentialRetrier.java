package org.javai.resilience.retry;

import org.javai.resilience.Outcome;
import org.javai.resilience.SdkErrors;
import org.javai.resilience.SdkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.function.LongSupplier;

/**
 * The retry engine: executes attempts with exponential backoff.
 * Operates entirely over Outcome values; no exception thrown by an attempt escapes.
 *
 * <p>A sequence ends in exactly one of these ways:
 * <ul>
 *   <li>an attempt succeeds: {@code Ok}, with no further waiting</li>
 *   <li>an attempt fails permanently: that attempt's error, unchanged</li>
 *   <li>the backoff policy gives up: its classification (e.g.
 *       {@link SdkErrors#RETRY_MAX_ELAPSED_TIME_REACHED}) wrapping the last error</li>
 *   <li>the token is cancelled: {@link SdkErrors#RETRY_CONTEXT_CANCELED} wrapping the
 *       last error, or {@link SdkErrors#RETRY_MAX_ELAPSED_TIME_REACHED} if the token's
 *       deadline passed</li>
 * </ul>
 *
 * <p>Attempts run strictly one after another on the calling thread. Cancellation is
 * checked before each wait and interrupts the wait itself; an attempt already running
 * is never aborted.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = ExponentialRetrier.builder()
 *     .initialInterval(Duration.ofMillis(100))
 *     .maxElapsedTime(Duration.ofSeconds(10))
 *     .notify((error, delay, total) -> log.warn("retrying in {}: {}", delay, error))
 *     .build();
 *
 * Outcome<Void> result = retrier.retryWithBackoff(token, () -> {
 *     client.ping();
 *     return Outcome.ok();
 * });
 * }</pre>
 */
public final class ExponentialRetrier implements Retrier {

    private static final Logger logger = LoggerFactory.getLogger(ExponentialRetrier.class);

    static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofMillis(500);
    static final Duration DEFAULT_MAX_INTERVAL = Duration.ofSeconds(3);
    static final Duration DEFAULT_MAX_ELAPSED_TIME = Duration.ofSeconds(30);
    static final double DEFAULT_MULTIPLIER = 2.0;
    static final double DEFAULT_RANDOMIZATION_FACTOR = 0.5;

    private final BackoffPolicy policy;
    private final RetryListener listener;
    private final Sleeper sleeper;
    private final LongSupplier ticker;

    private ExponentialRetrier(BackoffPolicy policy, RetryListener listener, Sleeper sleeper, LongSupplier ticker) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
    }

    /**
     * Creates a builder initialized with the default backoff settings.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a retrier from the defaults with the given options applied in order.
     */
    public static ExponentialRetrier create(RetryOption... options) {
        return builder().apply(options).build();
    }

    /**
     * Builder for configuring an ExponentialRetrier.
     *
     * <p>Defaults: initial interval 500ms, max interval 3s, max elapsed time 30s,
     * multiplier 2.0, randomization factor 0.5, no attempt limit, no listener.
     * Each setter overwrites the previous value, so the last call wins.
     */
    public static final class Builder {
        private Duration initialInterval = DEFAULT_INITIAL_INTERVAL;
        private Duration maxInterval = DEFAULT_MAX_INTERVAL;
        private Duration maxElapsedTime = DEFAULT_MAX_ELAPSED_TIME;
        private double multiplier = DEFAULT_MULTIPLIER;
        private double randomizationFactor = DEFAULT_RANDOMIZATION_FACTOR;
        private int maxAttempts;
        private SdkException attemptsExhausted = SdkErrors.RETRY_MAX_ATTEMPTS_REACHED;
        private RetryListener listener = RetryListener.noOp();
        private Sleeper sleeper = (delay, token) -> token.await(delay);
        private LongSupplier ticker = System::nanoTime;

        private Builder() {}

        /**
         * Sets the wait before the first retry.
         */
        public Builder initialInterval(Duration initialInterval) {
            this.initialInterval = Objects.requireNonNull(initialInterval, "initialInterval must not be null");
            return this;
        }

        /**
         * Sets the ceiling on any single wait.
         */
        public Builder maxInterval(Duration maxInterval) {
            this.maxInterval = Objects.requireNonNull(maxInterval, "maxInterval must not be null");
            return this;
        }

        /**
         * Sets the total time budget of a sequence; {@link Duration#ZERO} means unbounded.
         */
        public Builder maxElapsedTime(Duration maxElapsedTime) {
            this.maxElapsedTime = Objects.requireNonNull(maxElapsedTime, "maxElapsedTime must not be null");
            return this;
        }

        /**
         * Sets the growth factor applied to each successive wait (must be >= 1).
         */
        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        /**
         * Sets the jitter fraction in [0, 1]; 0 makes waits deterministic.
         */
        public Builder randomizationFactor(double randomizationFactor) {
            this.randomizationFactor = randomizationFactor;
            return this;
        }

        /**
         * Limits a sequence to a number of attempts; 0 removes the limit.
         * Exhaustion is reported as {@link SdkErrors#RETRY_MAX_ATTEMPTS_REACHED}.
         */
        public Builder maxAttempts(int maxAttempts) {
            return maxAttempts(maxAttempts, SdkErrors.RETRY_MAX_ATTEMPTS_REACHED);
        }

        /**
         * Limits a sequence to a number of attempts, reporting exhaustion as {@code exhausted}.
         */
        public Builder maxAttempts(int maxAttempts, SdkException exhausted) {
            if (maxAttempts < 0) {
                throw new IllegalArgumentException("maxAttempts must be >= 0, was: " + maxAttempts);
            }
            this.maxAttempts = maxAttempts;
            this.attemptsExhausted = Objects.requireNonNull(exhausted, "exhausted must not be null");
            return this;
        }

        /**
         * Sets the listener called after each failed attempt that will be retried.
         */
        public Builder notify(RetryListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener must not be null");
            return this;
        }

        /**
         * Applies options in order.
         */
        public Builder apply(RetryOption... options) {
            Objects.requireNonNull(options, "options must not be null");
            for (RetryOption option : options) {
                Objects.requireNonNull(option, "option must not be null").applyTo(this);
            }
            return this;
        }

        /**
         * Replaces the waiting strategy (package-private, for tests).
         */
        Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Replaces the nanosecond time source (package-private, for tests).
         */
        Builder ticker(LongSupplier ticker) {
            this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
            return this;
        }

        /**
         * Builds the retrier.
         *
         * @throws IllegalArgumentException if a duration is negative, the multiplier is
         *         below 1 or the randomization factor is outside [0, 1]
         */
        public ExponentialRetrier build() {
            BackoffPolicy backoff = new ExponentialBackoff(
                    initialInterval, maxInterval, maxElapsedTime, multiplier, randomizationFactor);
            if (maxAttempts > 0) {
                backoff = new AttemptLimitedBackoff(backoff, maxAttempts, attemptsExhausted);
            }
            return new ExponentialRetrier(backoff, listener, sleeper, ticker);
        }
    }

    /**
     * Returns the backoff policy deciding between retries.
     */
    BackoffPolicy policy() {
        return policy;
    }

    @Override
    public Outcome<Void> retryWithBackoff(CancellationToken token, Attempt<Void> attempt) {
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");

        long startedAt = ticker.getAsLong();
        RetryContext context = RetryContext.first();

        while (true) {
            Outcome<Void> result = invoke(attempt);

            if (result.isOk()) {
                if (context.attemptNumber() > 1) {
                    logger.debug("Attempt {} succeeded with policy [{}]", context.attemptNumber(), policy.id());
                }
                return result;
            }

            SdkException error = result.failure().orElseThrow();
            if (result.isPermanent()) {
                logger.debug("Attempt {} failed permanently, not retrying: {}", context.attemptNumber(), error.toString());
                return result;
            }

            context = context.failed(error, Duration.ofNanos(ticker.getAsLong() - startedAt));
            RetryDecision decision = policy.decide(context);

            if (token.isCancelled()) {
                return cancelled(token, context);
            }

            if (decision instanceof RetryDecision.GiveUp giveUp) {
                logger.debug("Retry exhausted after {} attempts with policy [{}]: {}",
                        context.attemptNumber(), policy.id(), giveUp.reason().code());
                return Outcome.fail(giveUp.reason().wrap(error));
            }

            Duration delay = ((RetryDecision.Retry) decision).delay();
            logger.debug("Attempt {} failed, retrying in {} ms: {}",
                    context.attemptNumber(), delay.toMillis(), error.toString());
            notifyListener(error, delay, context.totalDelay().plus(delay));

            try {
                if (sleeper.sleep(delay, token)) {
                    return cancelled(token, context);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.debug("Interrupted while waiting to retry after attempt {}", context.attemptNumber());
                return Outcome.fail(SdkErrors.RETRY_CONTEXT_CANCELED.wrap(error));
            }

            context = context.next(delay);
        }
    }

    private Outcome<Void> invoke(Attempt<Void> attempt) {
        try {
            Outcome<Void> result = attempt.run();
            if (result == null) {
                return Outcome.fail(SdkErrors.RETRY_OPERATION_FAILED.withMessage("attempt returned no outcome"));
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.permanent(SdkErrors.RETRY_CONTEXT_CANCELED.wrap(e));
        } catch (CancellationException e) {
            return Outcome.permanent(SdkErrors.RETRY_CONTEXT_CANCELED.wrap(e));
        } catch (Exception e) {
            return Outcome.fail(classify(e));
        }
    }

    /**
     * Maps an exception thrown by an attempt into the error taxonomy.
     * Errors already classified are kept; anything else is wrapped.
     *
     * @param error the exception thrown by an attempt
     * @return a classified error, never null
     */
    static SdkException classify(Throwable error) {
        if (error instanceof SdkException sdkException) {
            return sdkException;
        }
        if (error instanceof InterruptedException || error instanceof CancellationException) {
            return SdkErrors.RETRY_CONTEXT_CANCELED.wrap(error);
        }
        if (error instanceof TimeoutException) {
            return SdkErrors.RETRY_MAX_ELAPSED_TIME_REACHED.wrap(error);
        }
        return SdkErrors.RETRY_OPERATION_FAILED.wrap(error);
    }

    private Outcome<Void> cancelled(CancellationToken token, RetryContext context) {
        CancellationToken.Reason reason = token.reason().orElse(CancellationToken.Reason.CANCELLED);
        logger.debug("Retry stopped after {} attempts: {}", context.attemptNumber(), reason);
        SdkException classification = reason == CancellationToken.Reason.DEADLINE_EXCEEDED
                ? SdkErrors.RETRY_MAX_ELAPSED_TIME_REACHED
                : SdkErrors.RETRY_CONTEXT_CANCELED;
        return Outcome.fail(classification.wrap(context.lastError()));
    }

    private void notifyListener(SdkException error, Duration delay, Duration totalDelay) {
        try {
            listener.onRetry(error, delay, totalDelay);
        } catch (RuntimeException e) {
            logger.warn("RetryListener {} failed: {}", listener.getClass().getName(), e.getMessage(), e);
        }
    }

    @FunctionalInterface
    interface Sleeper {
        /**
         * Waits for {@code delay} unless {@code token} is cancelled first.
         *
         * @return true if the token was cancelled
         */
        boolean sleep(Duration delay, CancellationToken token) throws InterruptedException;
    }
}
