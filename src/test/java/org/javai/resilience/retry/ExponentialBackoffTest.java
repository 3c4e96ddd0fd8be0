package org.javai.resilience.retry;

import org.javai.resilience.SdkErrors;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class ExponentialBackoffTest {

    private static RetryContext failedAttempt(int attemptNumber, Duration elapsed) {
        RetryContext context = RetryContext.first();
        for (int i = 1; i < attemptNumber; i++) {
            context = context.next(Duration.ZERO);
        }
        return context.failed(SdkErrors.NET_PEER_CONNECTION, elapsed);
    }

    @Test
    void intervalAfter_growsGeometricallyUpToCap() {
        ExponentialBackoff backoff = new ExponentialBackoff(
                Duration.ofMillis(1), Duration.ofMillis(5), Duration.ZERO, 2.0, 0.0);

        assertThat(backoff.intervalAfter(1)).isEqualTo(Duration.ofMillis(1));
        assertThat(backoff.intervalAfter(2)).isEqualTo(Duration.ofMillis(2));
        assertThat(backoff.intervalAfter(3)).isEqualTo(Duration.ofMillis(4));
        assertThat(backoff.intervalAfter(4)).isEqualTo(Duration.ofMillis(5));
        assertThat(backoff.intervalAfter(5)).isEqualTo(Duration.ofMillis(5));
    }

    @Test
    void intervalAfter_hugeAttemptNumber_staysAtCap() {
        ExponentialBackoff backoff = new ExponentialBackoff(
                Duration.ofMillis(500), Duration.ofSeconds(3), Duration.ZERO, 2.0, 0.0);

        assertThat(backoff.intervalAfter(10_000)).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void decide_randomizedDelay_staysWithinFactor() {
        ExponentialBackoff backoff = new ExponentialBackoff(
                Duration.ofMillis(100), Duration.ofSeconds(1), Duration.ZERO, 2.0, 0.5);

        for (int i = 0; i < 200; i++) {
            RetryDecision decision = backoff.decide(failedAttempt(1, Duration.ZERO));

            assertThat(decision).isInstanceOf(RetryDecision.Retry.class);
            assertThat(((RetryDecision.Retry) decision).delay())
                    .isBetween(Duration.ofMillis(50), Duration.ofMillis(150));
        }
    }

    @Test
    void decide_beyondBudget_givesUp() {
        ExponentialBackoff backoff = new ExponentialBackoff(
                Duration.ofMillis(4), Duration.ofSeconds(1), Duration.ofMillis(10), 2.0, 0.0);

        RetryDecision within = backoff.decide(failedAttempt(1, Duration.ofMillis(6)));
        RetryDecision beyond = backoff.decide(failedAttempt(1, Duration.ofMillis(7)));

        assertThat(within).isEqualTo(RetryDecision.Retry.after(Duration.ofMillis(4)));
        assertThat(beyond).isInstanceOf(RetryDecision.GiveUp.class);
        assertThat(((RetryDecision.GiveUp) beyond).reason()).isSameAs(SdkErrors.RETRY_MAX_ELAPSED_TIME_REACHED);
    }

    @Test
    void decide_zeroBudget_neverGivesUp() {
        ExponentialBackoff backoff = new ExponentialBackoff(
                Duration.ofMillis(1), Duration.ofMillis(2), Duration.ZERO, 2.0, 0.0);

        RetryDecision decision = backoff.decide(failedAttempt(50, Duration.ofDays(365)));

        assertThat(decision).isEqualTo(RetryDecision.Retry.after(Duration.ofMillis(2)));
    }

    @Test
    void constructor_rejectsInvalidSettings() {
        assertThatThrownBy(() -> new ExponentialBackoff(
                Duration.ofMillis(1), Duration.ofMillis(1), Duration.ZERO, 0.9, 0.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("multiplier");
        assertThatThrownBy(() -> new ExponentialBackoff(
                Duration.ofMillis(1), Duration.ofMillis(1), Duration.ZERO, Double.NaN, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExponentialBackoff(
                Duration.ofMillis(1), Duration.ofMillis(1), Duration.ZERO, 2.0, -0.1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("randomizationFactor");
        assertThatThrownBy(() -> new ExponentialBackoff(
                Duration.ofMillis(1), Duration.ofMillis(-1), Duration.ZERO, 2.0, 0.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxInterval");
    }

    @Test
    void attemptLimited_givesUpAtLimitWithConfiguredError() {
        ExponentialBackoff delegate = new ExponentialBackoff(
                Duration.ofMillis(1), Duration.ofMillis(1), Duration.ZERO, 2.0, 0.0);
        AttemptLimitedBackoff limited = new AttemptLimitedBackoff(delegate, 3, SdkErrors.RECOVERY_RETRY_LIMIT_REACHED);

        assertThat(limited.decide(failedAttempt(2, Duration.ZERO))).isInstanceOf(RetryDecision.Retry.class);
        assertThat(limited.decide(failedAttempt(3, Duration.ZERO)))
                .isEqualTo(RetryDecision.GiveUp.because(SdkErrors.RECOVERY_RETRY_LIMIT_REACHED));
        assertThat(limited.id()).isEqualTo("exponential-max-3");
    }

    @Test
    void attemptLimited_rejectsNonPositiveLimit() {
        ExponentialBackoff delegate = new ExponentialBackoff(
                Duration.ofMillis(1), Duration.ofMillis(1), Duration.ZERO, 2.0, 0.0);

        assertThatThrownBy(() -> new AttemptLimitedBackoff(delegate, 0, SdkErrors.RETRY_MAX_ATTEMPTS_REACHED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void retryContext_tracksAttemptsAndTotalDelay() {
        RetryContext context = RetryContext.first()
                .failed(SdkErrors.STATE_NOT_READY, Duration.ofMillis(3))
                .next(Duration.ofMillis(1))
                .failed(SdkErrors.NET_PEER_CONNECTION, Duration.ofMillis(9))
                .next(Duration.ofMillis(2));

        assertThat(context.attemptNumber()).isEqualTo(3);
        assertThat(context.totalDelay()).isEqualTo(Duration.ofMillis(3));
        assertThat(context.elapsed()).isEqualTo(Duration.ofMillis(9));
        assertThat(context.lastError()).isSameAs(SdkErrors.NET_PEER_CONNECTION);
    }
}
