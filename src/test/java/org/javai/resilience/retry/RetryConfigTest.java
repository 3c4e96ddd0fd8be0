package org.javai.resilience.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RetryConfigTest {

    private final Map<String, String> properties = new HashMap<>();
    private final Map<String, String> environment = new HashMap<>();

    private RetryConfig load() {
        return RetryConfig.load(properties::get, environment::get);
    }

    @Test
    void load_nothingSet_returnsDefaults() {
        assertThat(load()).isEqualTo(RetryConfig.defaults());
        assertThat(RetryConfig.defaults().initialInterval()).isEqualTo(Duration.ofMillis(500));
        assertThat(RetryConfig.defaults().maxInterval()).isEqualTo(Duration.ofSeconds(3));
        assertThat(RetryConfig.defaults().maxElapsedTime()).isEqualTo(Duration.ofSeconds(30));
        assertThat(RetryConfig.defaults().maxAttempts()).isZero();
    }

    @Test
    void load_readsEnvironment() {
        environment.put("RESILIENCE_RETRY_INITIAL_INTERVAL", "250ms");
        environment.put("RESILIENCE_RETRY_MAX_INTERVAL", "2s");
        environment.put("RESILIENCE_RETRY_MAX_ELAPSED_TIME", "1m");
        environment.put("RESILIENCE_RETRY_MULTIPLIER", "1.5");
        environment.put("RESILIENCE_RETRY_RANDOMIZATION_FACTOR", "0");
        environment.put("RESILIENCE_RETRY_MAX_ATTEMPTS", "7");

        RetryConfig config = load();

        assertThat(config).isEqualTo(new RetryConfig(
                Duration.ofMillis(250), Duration.ofSeconds(2), Duration.ofMinutes(1), 1.5, 0.0, 7));
    }

    @Test
    void load_systemPropertyWinsOverEnvironment() {
        properties.put("resilience.retry.max-elapsed-time", "PT5S");
        environment.put("RESILIENCE_RETRY_MAX_ELAPSED_TIME", "1h");

        assertThat(load().maxElapsedTime()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void load_invalidValues_fallBackToDefaults() {
        environment.put("RESILIENCE_RETRY_INITIAL_INTERVAL", "soon");
        environment.put("RESILIENCE_RETRY_MULTIPLIER", "0.5");
        environment.put("RESILIENCE_RETRY_RANDOMIZATION_FACTOR", "abc");
        environment.put("RESILIENCE_RETRY_MAX_ATTEMPTS", "-3");

        RetryConfig config = load();

        assertThat(config).isEqualTo(RetryConfig.defaults());
    }

    @Test
    void parseDuration_acceptsUnitsAndIso() {
        assertThat(RetryConfig.parseDuration("500ms")).isEqualTo(Duration.ofMillis(500));
        assertThat(RetryConfig.parseDuration("2s")).isEqualTo(Duration.ofSeconds(2));
        assertThat(RetryConfig.parseDuration(" 3m ")).isEqualTo(Duration.ofMinutes(3));
        assertThat(RetryConfig.parseDuration("1h")).isEqualTo(Duration.ofHours(1));
        assertThat(RetryConfig.parseDuration("PT1.5S")).isEqualTo(Duration.ofMillis(1500));
        assertThat(RetryConfig.parseDuration("0s")).isEqualTo(Duration.ZERO);
    }

    @Test
    void parseDuration_rejectsMalformed() {
        assertThatThrownBy(() -> RetryConfig.parseDuration("10")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryConfig.parseDuration("xs")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryConfig.parseDuration("-5s")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parseDuration_rejectsOverflow() {
        assertThatThrownBy(() -> RetryConfig.parseDuration("99999999999999999h"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasCauseInstanceOf(ArithmeticException.class);
    }

    @Test
    void load_overflowingDuration_fallsBackToDefault() {
        environment.put("RESILIENCE_RETRY_MAX_ELAPSED_TIME", "99999999999999999h");

        assertThat(load().maxElapsedTime()).isEqualTo(ExponentialRetrier.DEFAULT_MAX_ELAPSED_TIME);
    }

    @Test
    void environmentName_isDerivedFromProperty() {
        assertThat(RetryConfig.environmentName("randomization-factor"))
                .isEqualTo("RESILIENCE_RETRY_RANDOMIZATION_FACTOR");
    }

    @Test
    void asOption_configuresRetrier() {
        RetryConfig config = new RetryConfig(
                Duration.ofMillis(20), Duration.ofMillis(80), Duration.ZERO, 3.0, 0.25, 4);

        ExponentialRetrier retrier = ExponentialRetrier.create(config.asOption());

        AttemptLimitedBackoff limited = (AttemptLimitedBackoff) retrier.policy();
        assertThat(limited.maxAttempts()).isEqualTo(4);
        assertThat(limited.id()).isEqualTo("exponential-max-4");
    }

    @Test
    void asOption_laterOptionsOverride() {
        ExponentialRetrier retrier = ExponentialRetrier.create(
                RetryConfig.defaults().asOption(),
                RetryOptions.multiplier(4.0));

        ExponentialBackoff backoff = (ExponentialBackoff) retrier.policy();
        assertThat(backoff.multiplier()).isEqualTo(4.0);
        assertThat(backoff.initialInterval()).isEqualTo(Duration.ofMillis(500));
    }
}
