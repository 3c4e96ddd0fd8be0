package org.javai.resilience.retry;

import org.javai.resilience.Outcome;
import org.javai.resilience.SdkErrors;
import org.javai.resilience.SdkException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Ready-made retry sequences.
 *
 * <p>Every preset starts from {@link RetryConfig#load()}, so system properties and
 * environment variables adjust the defaults. Caller options are applied after the preset's
 * own settings and therefore win.
 *
 * <ul>
 *   <li>{@link #call} bounds the sequence by the configured total time budget</li>
 *   <li>{@link #forever} retries until the token is cancelled or an attempt fails permanently</li>
 *   <li>{@link #withMaxAttempts} bounds the sequence by a number of attempts</li>
 * </ul>
 */
public final class Retries {

    private static final SdkException NOT_YET_SUCCESSFUL =
            SdkErrors.RETRY_OPERATION_FAILED.withMessage("attempt did not succeed");

    private Retries() {
        // Utility class
    }

    /**
     * Retries {@code attempt} with exponential backoff until it succeeds or the time budget
     * runs out.
     */
    public static <T> Outcome<T> call(CancellationToken token, Attempt<T> attempt, RetryOption... options) {
        return Retries.<T>typed(withConfig(options)).retryWithBackoff(token, attempt);
    }

    /**
     * Retries {@code attempt} without a time budget. The sequence ends only on success,
     * on a permanent failure, or when {@code token} is cancelled. A configured time budget or
     * attempt limit is ignored; a caller may reimpose either with
     * {@link RetryOptions#maxElapsedTime(Duration)} or {@link RetryOptions#maxAttempts(int)}.
     */
    public static <T> Outcome<T> forever(CancellationToken token, Attempt<T> attempt, RetryOption... options) {
        List<RetryOption> all = new ArrayList<>();
        all.add(RetryConfig.load().asOption());
        all.add(RetryOptions.maxElapsedTime(Duration.ZERO));
        all.add(RetryOptions.maxAttempts(0));
        all.addAll(Arrays.asList(options));
        return Retries.<T>typed(all).retryWithBackoff(token, attempt);
    }

    /**
     * Performs at most {@code maxAttempts} attempts, reporting exhaustion as
     * {@link SdkErrors#RETRY_MAX_ATTEMPTS_REACHED}.
     *
     * @see #withMaxAttempts(CancellationToken, int, SdkException, Attempt, RetryOption...)
     */
    public static Outcome<Void> withMaxAttempts(
            CancellationToken token, int maxAttempts, Attempt<Boolean> attempt, RetryOption... options) {
        return withMaxAttempts(token, maxAttempts, SdkErrors.RETRY_MAX_ATTEMPTS_REACHED, attempt, options);
    }

    /**
     * Performs at most {@code maxAttempts} attempts.
     *
     * <p>An attempt that returns {@code Ok(false)} (or {@code Ok(null)}) has not failed but has
     * not succeeded either; it is retried like a transient failure. The time budget is
     * removed unless a caller option sets one again. A non-positive {@code maxAttempts} is
     * rejected with {@link SdkErrors#DATA_INVALID_INPUT} without running the attempt.
     *
     * @param exhausted the error reported, wrapping the last failure, once all attempts failed
     */
    public static Outcome<Void> withMaxAttempts(
            CancellationToken token,
            int maxAttempts,
            SdkException exhausted,
            Attempt<Boolean> attempt,
            RetryOption... options
    ) {
        Objects.requireNonNull(attempt, "attempt must not be null");
        Objects.requireNonNull(exhausted, "exhausted must not be null");
        if (maxAttempts <= 0) {
            return Outcome.permanent(SdkErrors.DATA_INVALID_INPUT.withMessage(
                    "maxAttempts must be positive, was: " + maxAttempts));
        }

        List<RetryOption> all = new ArrayList<>();
        all.add(RetryConfig.load().asOption());
        all.add(RetryOptions.maxElapsedTime(Duration.ZERO));
        all.addAll(Arrays.asList(options));
        all.add(RetryOptions.maxAttempts(maxAttempts, exhausted));

        ExponentialRetrier retrier = ExponentialRetrier.create(all.toArray(new RetryOption[0]));
        return retrier.retryWithBackoff(token, () -> {
            Outcome<Boolean> outcome = attempt.run();
            if (outcome == null) {
                return null;
            }
            return outcome.flatMap(done -> Boolean.TRUE.equals(done)
                    ? Outcome.ok()
                    : Outcome.<Void>fail(NOT_YET_SUCCESSFUL));
        });
    }

    private static List<RetryOption> withConfig(RetryOption... options) {
        List<RetryOption> all = new ArrayList<>();
        all.add(RetryConfig.load().asOption());
        all.addAll(Arrays.asList(options));
        return all;
    }

    private static <T> TypedRetrier<T> typed(List<RetryOption> options) {
        return new TypedRetrier<>(ExponentialRetrier.create(options.toArray(new RetryOption[0])));
    }
}
