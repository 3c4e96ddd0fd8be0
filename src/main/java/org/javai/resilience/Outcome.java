package org.javai.resilience;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Represents the outcome of an operation that may fail.
 * Either {@link Ok} containing a successful value, or {@link Fail} containing an
 * {@link SdkException}.
 *
 * <p>A failure is tagged with a {@link FailureStability}. A {@link FailureStability#PERMANENT}
 * failure tells a retrier to stop at once and surface the error unchanged; this is the
 * only way an attempt opts out of the retry loop early.
 *
 * <pre>{@code
 * Outcome<Secret> attempt() {
 *     try {
 *         return Outcome.ok(client.fetch(path));
 *     } catch (SdkException e) {
 *         return SdkErrors.is(e, SdkErrors.ENTITY_NOT_FOUND)
 *                 ? Outcome.permanent(e)
 *                 : Outcome.fail(e);
 *     }
 * }
 * }</pre>
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome containing a value.
     *
     * @param value the successful value (may be null)
     */
    record Ok<T>(T value) implements Outcome<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
        }

        @Override
        public boolean isPermanent() {
            return false;
        }

        @Override
        public Optional<SdkException> failure() {
            return Optional.empty();
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }
    }

    /**
     * A failed outcome.
     *
     * @param error the classified error
     * @param stability whether the failure may be retried
     */
    record Fail<T>(SdkException error, FailureStability stability) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(error, "error must not be null");
            Objects.requireNonNull(stability, "stability must not be null");
        }

        /**
         * Creates a transient failure.
         */
        public Fail(SdkException error) {
            this(error, FailureStability.TRANSIENT);
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        @Override
        public boolean isPermanent() {
            return stability == FailureStability.PERMANENT;
        }

        @Override
        public Optional<SdkException> failure() {
            return Optional.of(error);
        }

        @Override
        public T getOrThrow() {
            throw error;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(error, stability);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            return new Fail<>(error, stability);
        }
    }

    // Query methods
    boolean isOk();
    boolean isFail();

    /**
     * Returns true if this is a failure that must not be retried.
     */
    boolean isPermanent();

    /**
     * Returns the error if this outcome failed.
     */
    Optional<SdkException> failure();

    // Value extraction

    /**
     * Returns the value, or throws the failure's {@link SdkException}.
     */
    T getOrThrow();

    // Transformations
    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);
    <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper);

    // Static factories
    static Outcome<Void> ok() {
        return new Ok<>(null);
    }

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * Creates a transient failure; a retrier will try again if its budget allows.
     */
    static <T> Outcome<T> fail(SdkException error) {
        return new Fail<>(error, FailureStability.TRANSIENT);
    }

    /**
     * Creates a permanent failure; a retrier stops and surfaces {@code error} unchanged.
     */
    static <T> Outcome<T> permanent(SdkException error) {
        return new Fail<>(error, FailureStability.PERMANENT);
    }
}
