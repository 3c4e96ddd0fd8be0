package org.javai.resilience.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.resilience.SdkException;
import org.javai.resilience.retry.RetryListener;

import java.time.Duration;
import java.util.Objects;

/**
 * Logs each retry through Log4j2.
 *
 * <p>One entry is written per failed attempt that will be retried, under the {@code RETRY}
 * marker, at {@link Level#INFO} unless another level is given. The entry names the error
 * code and message, the wait before the next attempt and the total wait so far.
 */
public class Log4jRetryListener implements RetryListener {

	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");

	private final Logger logger;
	private final Level level;

	/**
	 * Creates a Log4jRetryListener using the default logger name.
	 */
	public Log4jRetryListener() {
		this(LogManager.getLogger("org.javai.resilience.Retry"));
	}

	/**
	 * Creates a Log4jRetryListener with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jRetryListener(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jRetryListener with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jRetryListener(Logger logger) {
		this(logger, Level.INFO);
	}

	/**
	 * Creates a Log4jRetryListener logging at the given level.
	 *
	 * @param logger the Log4j logger to use
	 * @param level the level of every entry
	 */
	public Log4jRetryListener(Logger logger, Level level) {
		this.logger = Objects.requireNonNull(logger, "logger must not be null");
		this.level = Objects.requireNonNull(level, "level must not be null");
	}

	@Override
	public void onRetry(SdkException error, Duration delay, Duration totalDelay) {
		logger.atLevel(level)
			.withMarker(RETRY_MARKER)
			.log("Retrying in {} ms (waited {} ms so far). Code: {}, Message: {}{}",
				delay.toMillis(),
				totalDelay.toMillis(),
				error.code(),
				error.getMessage(),
				formatCause(error.getCause()));
	}

	private static String formatCause(Throwable cause) {
		return cause != null ? ", cause=" + cause.getClass().getName() : "";
	}
}
