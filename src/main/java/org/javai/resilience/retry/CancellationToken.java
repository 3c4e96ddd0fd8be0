package org.javai.resilience.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A fire-once cancellation signal handed to every retry sequence.
 *
 * <p>A token is cancelled either explicitly through {@link #cancel()} or implicitly when
 * its optional deadline passes. Whichever happens first is recorded as the
 * {@link Reason} and never changes afterwards. Waiting through {@link #await(Duration)}
 * returns as soon as the token is cancelled, so a retrier never sleeps past a
 * cancellation.
 *
 * <p>Tokens are safe to share between threads: typically one thread runs the retry
 * sequence while another decides to abort it.
 */
public final class CancellationToken {

    /**
     * Why a token was cancelled.
     */
    public enum Reason {
        /**
         * {@link #cancel()} was called.
         */
        CANCELLED,

        /**
         * The token's deadline passed.
         */
        DEADLINE_EXCEEDED
    }

    private final CountDownLatch signal = new CountDownLatch(1);
    private final AtomicReference<Reason> reason = new AtomicReference<>();
    private final long deadlineNanos;
    private final boolean hasDeadline;

    private CancellationToken(boolean hasDeadline, long deadlineNanos) {
        this.hasDeadline = hasDeadline;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * Creates a token that is cancelled only through {@link #cancel()}.
     */
    public static CancellationToken create() {
        return new CancellationToken(false, 0L);
    }

    /**
     * Creates a token nobody else holds, for callers that never cancel.
     */
    public static CancellationToken none() {
        return create();
    }

    /**
     * Creates a token that cancels itself once {@code timeout} has passed.
     *
     * @param timeout time until the deadline, must not be negative
     * @return a token with a deadline
     */
    public static CancellationToken withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        return new CancellationToken(true, System.nanoTime() + timeout.toNanos());
    }

    /**
     * Cancels the token. Only the first cancellation has an effect.
     *
     * @return true if this call cancelled the token
     */
    public boolean cancel() {
        return fire(Reason.CANCELLED);
    }

    public boolean isCancelled() {
        return reason().isPresent();
    }

    /**
     * Returns why the token was cancelled, or empty if it is still live.
     */
    public Optional<Reason> reason() {
        if (reason.get() == null && hasDeadline && System.nanoTime() - deadlineNanos >= 0) {
            fire(Reason.DEADLINE_EXCEEDED);
        }
        return Optional.ofNullable(reason.get());
    }

    /**
     * Blocks until the token is cancelled or {@code timeout} elapses, whichever comes first.
     *
     * @param timeout the maximum time to wait
     * @return true if the token is cancelled
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (isCancelled()) {
            return true;
        }
        long waitNanos = Math.max(0L, timeout.toNanos());
        if (hasDeadline) {
            waitNanos = Math.min(waitNanos, Math.max(0L, deadlineNanos - System.nanoTime()));
        }
        signal.await(waitNanos, TimeUnit.NANOSECONDS);
        return isCancelled();
    }

    private boolean fire(Reason cause) {
        if (reason.compareAndSet(null, cause)) {
            signal.countDown();
            return true;
        }
        return false;
    }
}
