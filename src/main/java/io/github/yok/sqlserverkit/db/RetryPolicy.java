package io.github.yok.sqlserverkit.db;

import com.google.common.base.Preconditions;
import java.sql.SQLException;
import java.time.Duration;
import java.util.function.Consumer;
import lombok.Value;

/**
 * Retry settings of the administrative operations that may collide with server-side system
 * processes (create, drop, recreate, detach).
 *
 * <p>
 * After the user sessions of a database were killed, a system process (full-text indexing,
 * replication agents, ...) can still hold a lock on it for a short time. Such sessions cannot be
 * killed, so the statement is executed again after {@link #getInterval()} until it succeeds or
 * {@link #getRetryCount()} retries are used up.
 * </p>
 *
 * <p>
 * The {@link #getExceptionObserver() exception observer} is called for every caught
 * {@link SQLException}, including the one that is finally rethrown. It is meant for logging and
 * never changes the control flow.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class RetryPolicy {

    /** Default number of retries. */
    public static final int DEFAULT_RETRY_COUNT = 3;

    /** Default interval between two attempts. */
    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(750);

    /** 3 retries (4 attempts in total), 750 ms apart, no observer. */
    public static final RetryPolicy DEFAULT =
            new RetryPolicy(DEFAULT_RETRY_COUNT, DEFAULT_INTERVAL);

    int retryCount;

    Duration interval;

    Consumer<SQLException> exceptionObserver;

    /**
     * Creates a policy without an exception observer.
     *
     * @param retryCount number of retries after the first attempt; must be {@code >= 0}
     * @param interval delay between two attempts; must be positive
     * @throws IllegalArgumentException if a value is out of range
     */
    public RetryPolicy(int retryCount, Duration interval) {
        this(retryCount, interval, null);
    }

    /**
     * Creates a policy.
     *
     * @param retryCount number of retries after the first attempt; must be {@code >= 0}
     * @param interval delay between two attempts; must be positive
     * @param exceptionObserver called with every caught exception, may be {@code null}
     * @throws IllegalArgumentException if a value is out of range
     */
    public RetryPolicy(int retryCount, Duration interval,
            Consumer<SQLException> exceptionObserver) {
        Preconditions.checkArgument(retryCount >= 0, "retryCount must be >= 0 but was %s",
                retryCount);
        Preconditions.checkArgument(
                interval != null && !interval.isZero() && !interval.isNegative(),
                "interval must be positive but was %s", interval);
        this.retryCount = retryCount;
        this.interval = interval;
        this.exceptionObserver = exceptionObserver != null ? exceptionObserver : e -> {
        };
    }

    /**
     * Convenience factory taking the interval in milliseconds.
     *
     * @param retryCount number of retries; must be {@code >= 0}
     * @param intervalMillis delay in milliseconds; must be {@code > 0}
     * @return retry policy
     */
    public static RetryPolicy of(int retryCount, long intervalMillis) {
        Preconditions.checkArgument(intervalMillis > 0, "interval must be positive but was %sms",
                intervalMillis);
        return new RetryPolicy(retryCount, Duration.ofMillis(intervalMillis));
    }

    /**
     * Returns a copy of this policy with the given exception observer.
     *
     * @param observer exception observer
     * @return new policy
     */
    public RetryPolicy withExceptionObserver(Consumer<SQLException> observer) {
        return new RetryPolicy(retryCount, interval, observer);
    }

    /**
     * Returns the total number of attempts ({@code retryCount + 1}).
     *
     * @return maximum attempts
     */
    public int getMaxAttempts() {
        return retryCount + 1;
    }
}
