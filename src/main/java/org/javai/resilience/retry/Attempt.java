package org.javai.resilience.retry;

import org.javai.resilience.Outcome;

/**
 * One attempt of a retried operation.
 *
 * <p>An attempt reports its result as an {@link Outcome}. Returning
 * {@link Outcome#permanent} stops the retry sequence at once. Exceptions thrown from
 * {@link #run()} are caught by the retrier and classified; they never escape it.
 *
 * @param <T> The type of value an attempt produces
 */
@FunctionalInterface
public interface Attempt<T> {

    Outcome<T> run() throws Exception;
}
