package org.javai.resilience.retry;

import org.javai.resilience.Outcome;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Adapts a {@link Retrier} to operations that produce a value.
 *
 * <p>The wrapped engine only sees whether each attempt passed or failed. The value of the
 * most recent successful attempt is kept aside and returned once the sequence succeeds.
 * A failed attempt carries no value, so it never overwrites that slot, and a failed
 * sequence returns only its error. Callers that need data from failed attempts must
 * carry it in the {@link org.javai.resilience.SdkException} they fail with.
 *
 * @param <T> the type of value produced by the operation
 */
public final class TypedRetrier<T> {

    private final Retrier retrier;

    public TypedRetrier(Retrier retrier) {
        this.retrier = Objects.requireNonNull(retrier, "retrier must not be null");
    }

    /**
     * Runs {@code attempt} under the wrapped engine.
     *
     * @param token cancellation signal for the whole sequence
     * @param attempt the operation to retry
     * @return the value of the successful attempt, or the terminal failure
     */
    public Outcome<T> retryWithBackoff(CancellationToken token, Attempt<T> attempt) {
        Objects.requireNonNull(attempt, "attempt must not be null");
        AtomicReference<T> latest = new AtomicReference<>();

        Outcome<Void> result = retrier.retryWithBackoff(token, () -> {
            Outcome<T> outcome = attempt.run();
            if (outcome == null) {
                return null;
            }
            if (outcome instanceof Outcome.Ok<T> ok) {
                latest.set(ok.value());
            }
            return outcome.map(value -> null);
        });

        return result.map(ignored -> latest.get());
    }
}
