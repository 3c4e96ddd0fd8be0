package org.javai.resilience.boundary;

/**
 * Work passed to {@link Boundary#call}: typically a client call that declares
 * {@code IOException} or {@code InterruptedException}.
 *
 * @param <T> the result of the call
 * @param <E> the checked exception the call declares
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
