package org.javai.resilience.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;
import org.javai.resilience.Outcome;
import org.javai.resilience.SdkErrors;
import org.javai.resilience.retry.CancellationToken;
import org.javai.resilience.retry.Retries;
import org.javai.resilience.retry.RetryOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class Log4jRetryListenerTest {

    private static final String LOGGER_NAME = "org.javai.resilience.log4j.test";

    private CapturingAppender appender;

    static final class CapturingAppender extends AbstractAppender {
        final List<LogEvent> events = new CopyOnWriteArrayList<>();

        CapturingAppender() {
            super("Capturing", null, null, true, Property.EMPTY_ARRAY);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }
    }

    @BeforeEach
    void setUp() {
        appender = new CapturingAppender();
        appender.start();
        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        Configuration config = context.getConfiguration();
        LoggerConfig loggerConfig = new LoggerConfig(LOGGER_NAME, Level.ALL, false);
        loggerConfig.addAppender(appender, null, null);
        config.addLogger(LOGGER_NAME, loggerConfig);
        context.updateLoggers();
    }

    @AfterEach
    void tearDown() {
        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        context.getConfiguration().removeLogger(LOGGER_NAME);
        context.updateLoggers();
        appender.stop();
    }

    @Test
    void onRetry_logsAtInfoWithRetryMarker() {
        Log4jRetryListener listener = new Log4jRetryListener(LOGGER_NAME);

        listener.onRetry(SdkErrors.NET_PEER_CONNECTION.wrap(new IOException("refused")),
                Duration.ofMillis(250), Duration.ofMillis(750));

        assertThat(appender.events).hasSize(1);
        LogEvent event = appender.events.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.INFO);
        assertThat(event.getMarker()).isEqualTo(Log4jRetryListener.RETRY_MARKER);
        assertThat(event.getMessage().getFormattedMessage())
                .isEqualTo("Retrying in 250 ms (waited 750 ms so far). Code: net_peer_connection, "
                        + "Message: problem connecting to peer, cause=java.io.IOException");
    }

    @Test
    void onRetry_customLevel() {
        Log4jRetryListener listener = new Log4jRetryListener(LogManager.getLogger(LOGGER_NAME), Level.WARN);

        listener.onRetry(SdkErrors.STATE_NOT_READY, Duration.ofSeconds(1), Duration.ofSeconds(1));

        assertThat(appender.events).extracting(LogEvent::getLevel).containsExactly(Level.WARN);
        assertThat(appender.events.get(0).getMessage().getFormattedMessage()).doesNotContain("cause=");
    }

    @Test
    void onRetry_asRetryOption_logsEachRetry() {
        AtomicInteger attempts = new AtomicInteger();

        Outcome<Void> result = Retries.withMaxAttempts(CancellationToken.create(), 3,
                () -> Outcome.ok(attempts.incrementAndGet() == 3),
                RetryOptions.initialInterval(Duration.ofMillis(1)),
                RetryOptions.notify(new Log4jRetryListener(LOGGER_NAME)));

        assertThat(result.isOk()).isTrue();
        assertThat(appender.events).hasSize(2);
        assertThat(appender.events).allSatisfy(event ->
                assertThat(event.getMessage().getFormattedMessage()).contains("retry_operation_failed"));
    }
}
