package io.github.yok.sqlserverkit.db;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Cooperative cancellation signal for database operations.
 *
 * <p>
 * A token is cancelled at most once. Operations check it before each attempt, register
 * {@link java.sql.Statement#cancel()} as a callback while a statement is running, and wait on it
 * between two retries, so a cancellation aborts both in-flight I/O and a pending retry delay.
 * Cancellation is reported as {@link CancellationException}.
 * </p>
 *
 * <p>
 * Thread-safe.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class CancellationToken {

    /** A token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * Creates a new, not yet cancelled token.
     */
    public CancellationToken() {
        this(true);
    }

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Requests cancellation and runs all registered callbacks. Subsequent calls have no effect.
     *
     * @throws UnsupportedOperationException if called on {@link #NONE}
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
        synchronized (this) {
            if (isCancellationRequested()) {
                return;
            }
            cancelled.countDown();
        }
        // Whoever removes a callback runs it, so each callback runs exactly once
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                runCallback(callback);
            }
        }
    }

    /**
     * Returns whether cancellation was requested.
     *
     * @return {@code true} once {@link #cancel()} was called
     */
    public boolean isCancellationRequested() {
        return cancelled.getCount() == 0;
    }

    /**
     * Throws if cancellation was requested.
     *
     * @throws CancellationException if the token is cancelled
     */
    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("The operation was cancelled.");
        }
    }

    /**
     * Registers a callback that runs when the token is cancelled. If the token is already
     * cancelled, the callback runs immediately.
     *
     * @param callback callback to run on cancellation
     * @return registration; closing it removes the callback
     */
    public Registration register(Runnable callback) {
        Preconditions.checkNotNull(callback, "callback must not be null");
        if (!cancellable) {
            return () -> {
            };
        }
        callbacks.add(callback);
        if (isCancellationRequested() && callbacks.remove(callback)) {
            runCallback(callback);
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Blocks for the given duration unless the token is cancelled earlier.
     *
     * <p>
     * An interrupt of the waiting thread is treated as cancellation; the interrupt flag is
     * restored.
     * </p>
     *
     * @param duration time to wait
     * @throws CancellationException if the token is cancelled before or while waiting, or the
     *         thread is interrupted
     */
    public void await(Duration duration) {
        throwIfCancellationRequested();
        try {
            if (cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new CancellationException("The operation was cancelled while waiting.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException ce =
                    new CancellationException("The operation was interrupted while waiting.");
            ce.initCause(e);
            throw ce;
        }
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Handle of a registered callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        /**
         * Removes the callback. Never throws.
         */
        @Override
        void close();
    }
}
