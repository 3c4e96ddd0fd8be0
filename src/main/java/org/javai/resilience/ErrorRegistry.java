package org.javai.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Maps error codes to their canonical {@link SdkException} instances.
 *
 * <p>All writes go through {@link #register}, all reads through {@link #fromCode} or
 * {@link #lookup}; the map is guarded by a read/write lock so lookups may run
 * concurrently with late registrations. Registering a code twice replaces the earlier
 * instance.
 *
 * <p>A lookup miss never fails: {@link #fromCode} returns the registry's fallback error,
 * so a client can always classify a code introduced by a newer server.
 *
 * <p>The process-wide registry is owned by {@link SdkErrors}.
 */
public final class ErrorRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ErrorRegistry.class);

    private final Map<ErrorCode, SdkException> errors = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final SdkException fallback;

    /**
     * Creates a registry whose fallback error is registered under the given code.
     *
     * @param fallbackCode code of the error returned for unknown codes
     * @param fallbackMessage message of the fallback error
     */
    public ErrorRegistry(String fallbackCode, String fallbackMessage) {
        this.fallback = register(fallbackCode, fallbackMessage, null);
    }

    /**
     * Creates a sentinel error, stores it under its code and returns it.
     *
     * @param code the error code
     * @param message the human-readable message
     * @param cause optional cause, usually null for sentinels
     * @return the registered error
     */
    public SdkException register(String code, String message, Throwable cause) {
        SdkException error = SdkException.sentinel(ErrorCode.of(code), message, cause);
        lock.writeLock().lock();
        try {
            SdkException previous = errors.put(error.code(), error);
            if (previous != null) {
                logger.debug("Error code [{}] registered again, replacing previous entry", code);
            }
        } finally {
            lock.writeLock().unlock();
        }
        return error;
    }

    /**
     * Resolves a code to its registered error, or the fallback error if the code is unknown.
     *
     * @param code the code received, typically from a response body
     * @return the registered error, never null
     */
    public SdkException fromCode(ErrorCode code) {
        return lookup(code).orElse(fallback);
    }

    /**
     * Resolves a code string to its registered error, or the fallback error if the code is
     * unknown, null or blank.
     */
    public SdkException fromCode(String code) {
        if (code == null || code.isBlank()) {
            return fallback;
        }
        return fromCode(ErrorCode.of(code));
    }

    /**
     * Returns the registered error for a code, if any.
     */
    public Optional<SdkException> lookup(ErrorCode code) {
        Objects.requireNonNull(code, "code must not be null");
        lock.readLock().lock();
        try {
            return Optional.ofNullable(errors.get(code));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isRegistered(ErrorCode code) {
        return lookup(code).isPresent();
    }

    public SdkException fallback() {
        return fallback;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return errors.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
