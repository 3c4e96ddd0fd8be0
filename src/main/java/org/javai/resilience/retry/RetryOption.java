package org.javai.resilience.retry;

/**
 * A single configuration change applied to an {@link ExponentialRetrier.Builder}.
 *
 * <p>Options are applied in the order given, so a later option overrides an earlier one
 * that touches the same setting. See {@link RetryOptions} for the recognised options.
 */
@FunctionalInterface
public interface RetryOption {

    void applyTo(ExponentialRetrier.Builder builder);
}
