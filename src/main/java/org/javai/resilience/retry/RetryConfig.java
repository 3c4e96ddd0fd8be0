package org.javai.resilience.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Retry defaults resolved from the environment.
 *
 * <p>Each setting is read from a system property, falling back to an environment variable,
 * falling back to the built-in default:
 * <table>
 *   <caption>Recognised settings</caption>
 *   <tr><th>System property</th><th>Environment variable</th><th>Default</th></tr>
 *   <tr><td>{@code resilience.retry.initial-interval}</td><td>{@code RESILIENCE_RETRY_INITIAL_INTERVAL}</td><td>500ms</td></tr>
 *   <tr><td>{@code resilience.retry.max-interval}</td><td>{@code RESILIENCE_RETRY_MAX_INTERVAL}</td><td>3s</td></tr>
 *   <tr><td>{@code resilience.retry.max-elapsed-time}</td><td>{@code RESILIENCE_RETRY_MAX_ELAPSED_TIME}</td><td>30s</td></tr>
 *   <tr><td>{@code resilience.retry.multiplier}</td><td>{@code RESILIENCE_RETRY_MULTIPLIER}</td><td>2.0</td></tr>
 *   <tr><td>{@code resilience.retry.randomization-factor}</td><td>{@code RESILIENCE_RETRY_RANDOMIZATION_FACTOR}</td><td>0.5</td></tr>
 *   <tr><td>{@code resilience.retry.max-attempts}</td><td>{@code RESILIENCE_RETRY_MAX_ATTEMPTS}</td><td>0 (unlimited)</td></tr>
 * </table>
 *
 * <p>Durations are written as a number with a unit suffix ({@code 250ms}, {@code 2s},
 * {@code 1m}, {@code 1h}) or in ISO-8601 form ({@code PT2S}). Values that cannot be parsed
 * or are out of range are logged and replaced by the default.
 */
public record RetryConfig(
        Duration initialInterval,
        Duration maxInterval,
        Duration maxElapsedTime,
        double multiplier,
        double randomizationFactor,
        int maxAttempts
) {

    private static final Logger logger = LoggerFactory.getLogger(RetryConfig.class);

    static final String PREFIX = "resilience.retry.";

    public RetryConfig {
        Objects.requireNonNull(initialInterval, "initialInterval must not be null");
        Objects.requireNonNull(maxInterval, "maxInterval must not be null");
        Objects.requireNonNull(maxElapsedTime, "maxElapsedTime must not be null");
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0, was: " + maxAttempts);
        }
    }

    /**
     * Returns the built-in defaults.
     */
    public static RetryConfig defaults() {
        return new RetryConfig(
                ExponentialRetrier.DEFAULT_INITIAL_INTERVAL,
                ExponentialRetrier.DEFAULT_MAX_INTERVAL,
                ExponentialRetrier.DEFAULT_MAX_ELAPSED_TIME,
                ExponentialRetrier.DEFAULT_MULTIPLIER,
                ExponentialRetrier.DEFAULT_RANDOMIZATION_FACTOR,
                0);
    }

    /**
     * Resolves the configuration from system properties and environment variables.
     */
    public static RetryConfig load() {
        return load(System::getProperty, System::getenv);
    }

    static RetryConfig load(UnaryOperator<String> properties, UnaryOperator<String> environment) {
        RetryConfig defaults = defaults();
        Resolver resolver = new Resolver(properties, environment);
        return new RetryConfig(
                resolver.duration("initial-interval", defaults.initialInterval()),
                resolver.duration("max-interval", defaults.maxInterval()),
                resolver.duration("max-elapsed-time", defaults.maxElapsedTime()),
                resolver.decimal("multiplier", defaults.multiplier(), 1.0, Double.MAX_VALUE),
                resolver.decimal("randomization-factor", defaults.randomizationFactor(), 0.0, 1.0),
                resolver.count("max-attempts", defaults.maxAttempts()));
    }

    /**
     * Returns an option that applies every setting of this configuration.
     */
    public RetryOption asOption() {
        return builder -> builder
                .initialInterval(initialInterval)
                .maxInterval(maxInterval)
                .maxElapsedTime(maxElapsedTime)
                .multiplier(multiplier)
                .randomizationFactor(randomizationFactor)
                .maxAttempts(maxAttempts);
    }

    /**
     * Parses {@code 500ms}, {@code 2s}, {@code 1m}, {@code 1h} or an ISO-8601 duration.
     *
     * @throws IllegalArgumentException if the value is not a non-negative duration
     */
    static Duration parseDuration(String text) {
        String value = text.trim().toLowerCase(Locale.ROOT);
        Duration parsed;
        try {
            if (value.startsWith("p")) {
                parsed = Duration.parse(value.toUpperCase(Locale.ROOT));
            } else if (value.endsWith("ms")) {
                parsed = Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2).trim()));
            } else if (value.endsWith("s")) {
                parsed = Duration.ofSeconds(Long.parseLong(value.substring(0, value.length() - 1).trim()));
            } else if (value.endsWith("m")) {
                parsed = Duration.ofMinutes(Long.parseLong(value.substring(0, value.length() - 1).trim()));
            } else if (value.endsWith("h")) {
                parsed = Duration.ofHours(Long.parseLong(value.substring(0, value.length() - 1).trim()));
            } else {
                throw new IllegalArgumentException("missing unit in duration: " + text);
            }
        } catch (NumberFormatException | DateTimeParseException | ArithmeticException e) {
            throw new IllegalArgumentException("invalid duration: " + text, e);
        }
        if (parsed.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative: " + text);
        }
        return parsed;
    }

    private static final class Resolver {
        private final UnaryOperator<String> properties;
        private final UnaryOperator<String> environment;

        Resolver(UnaryOperator<String> properties, UnaryOperator<String> environment) {
            this.properties = properties;
            this.environment = environment;
        }

        Duration duration(String key, Duration fallback) {
            String raw = raw(key);
            if (raw == null) {
                return fallback;
            }
            try {
                return parseDuration(raw);
            } catch (IllegalArgumentException e) {
                return invalid(key, raw, fallback);
            }
        }

        double decimal(String key, double fallback, double min, double max) {
            String raw = raw(key);
            if (raw == null) {
                return fallback;
            }
            double value;
            try {
                value = Double.parseDouble(raw.trim());
            } catch (NumberFormatException e) {
                return invalid(key, raw, fallback);
            }
            return value >= min && value <= max ? value : invalid(key, raw, fallback);
        }

        int count(String key, int fallback) {
            String raw = raw(key);
            if (raw == null) {
                return fallback;
            }
            int value;
            try {
                value = Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                return invalid(key, raw, fallback);
            }
            return value >= 0 ? value : invalid(key, raw, fallback);
        }

        private String raw(String key) {
            String value = properties.apply(PREFIX + key);
            if (value == null || value.isBlank()) {
                value = environment.apply(environmentName(key));
            }
            return value == null || value.isBlank() ? null : value;
        }

        private static <V> V invalid(String key, String raw, V fallback) {
            logger.warn("Ignoring invalid value '{}' for {} (or {}), using default {}",
                    raw, PREFIX + key, environmentName(key), fallback);
            return fallback;
        }
    }

    static String environmentName(String key) {
        return (PREFIX + key).replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
    }
}
