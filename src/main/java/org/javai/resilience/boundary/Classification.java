package org.javai.resilience.boundary;

import org.javai.resilience.FailureStability;
import org.javai.resilience.Outcome;
import org.javai.resilience.SdkException;

import java.util.Objects;

/**
 * The result of classifying an exception: the error it maps to and whether retrying may help.
 *
 * @param error the classified error, normally wrapping the original exception
 * @param stability whether the failure may be retried
 */
public record Classification(SdkException error, FailureStability stability) {

    public Classification {
        Objects.requireNonNull(error, "error must not be null");
        Objects.requireNonNull(stability, "stability must not be null");
    }

    public static Classification transientFailure(SdkException error) {
        return new Classification(error, FailureStability.TRANSIENT);
    }

    public static Classification permanentFailure(SdkException error) {
        return new Classification(error, FailureStability.PERMANENT);
    }

    /**
     * Returns this classification as a failed outcome.
     */
    public <T> Outcome<T> toOutcome() {
        return new Outcome.Fail<>(error, stability);
    }
}
