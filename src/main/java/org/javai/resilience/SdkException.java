package org.javai.resilience;

import java.util.Objects;

/**
 * A structured error identified by a stable {@link ErrorCode}.
 *
 * <p>Identity is defined by the code alone: two instances with the same code are the
 * same kind of error regardless of message or cause, so {@link #equals(Object)} and
 * {@link #hashCode()} only consider the code. Chain-aware comparison is done with
 * {@link #is(SdkException)} or {@link SdkErrors#is(Throwable, SdkException)}.
 *
 * <p>Instances are immutable. The sentinels declared in {@link SdkErrors} are shared
 * across threads; customizing one always goes through a method that allocates a new
 * instance:
 * <pre>{@code
 * // Attach the underlying cause
 * throw SdkErrors.ENTITY_NOT_FOUND.wrap(ioException);
 *
 * // Add context to the message
 * return Outcome.fail(SdkErrors.ENTITY_NOT_FOUND.withMessage("secret 'db/creds' not found"));
 *
 * // Compare by code, through wrapping
 * if (SdkErrors.is(error, SdkErrors.ENTITY_NOT_FOUND)) { ... }
 * }</pre>
 */
public class SdkException extends RuntimeException {

    private final ErrorCode code;

    /**
     * Creates an error with the given code, message and optional cause.
     *
     * <p>Prefer wrapping or re-messaging a sentinel from {@link SdkErrors} over
     * constructing errors from codes directly.
     *
     * @param code the error code
     * @param message human-readable description
     * @param cause the underlying error (may be null)
     */
    public SdkException(ErrorCode code, String message, Throwable cause) {
        this(code, message, cause, true);
    }

    private SdkException(ErrorCode code, String message, Throwable cause, boolean captureStackTrace) {
        super(Objects.requireNonNull(message, "message must not be null"), cause, captureStackTrace, captureStackTrace);
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    /**
     * Creates a shared, stackless instance for use as a sentinel.
     */
    static SdkException sentinel(ErrorCode code, String message, Throwable cause) {
        return new SdkException(code, message, cause, false);
    }

    public ErrorCode code() {
        return code;
    }

    /**
     * Returns a new error with the same code and message, and the given cause.
     * This instance is never modified.
     *
     * @param cause the error to attach (may be null)
     * @return a freshly allocated error
     */
    public SdkException wrap(Throwable cause) {
        return new SdkException(code, getMessage(), cause);
    }

    /**
     * Returns a new error with the same code and cause, and the given message.
     *
     * @param message the replacement message
     * @return a freshly allocated error
     */
    public SdkException withMessage(String message) {
        return new SdkException(code, message, getCause());
    }

    /**
     * Returns a shallow copy carrying the same code, message and cause.
     */
    public SdkException copy() {
        return new SdkException(code, getMessage(), getCause());
    }

    public boolean hasCode(ErrorCode other) {
        return code.equals(other);
    }

    /**
     * Returns true if this error, or any error on its cause chain, has the same
     * code as {@code target}.
     */
    public boolean is(SdkException target) {
        return SdkErrors.is(this, target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SdkException other && code.equals(other.code);
    }

    @Override
    public int hashCode() {
        return code.hashCode();
    }

    @Override
    public String toString() {
        Throwable cause = getCause();
        if (cause == null) {
            return "[" + code + "] " + getMessage();
        }
        return "[" + code + "] " + getMessage() + ": " + describe(cause);
    }

    private static String describe(Throwable cause) {
        if (cause instanceof SdkException) {
            return cause.toString();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    }
}
