package io.github.yok.sqlserverkit.util;

import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports failed commands of the command-line front end.
 *
 * <p>
 * A failure is logged with SLF4J, a concise message is written to {@code System.err} and the
 * failure is counted. The front end keeps processing the remaining connections and ends the
 * process with {@link #EXIT_CODE_FAILURE} once it is done if {@link #hasFailures()} is set.
 * </p>
 *
 * <p>
 * Tests switch the current thread to throwing an {@link IllegalStateException} instead of
 * printing.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    /** Process exit code after at least one failed command. */
    public static final int EXIT_CODE_FAILURE = 1;

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private static final AtomicInteger FAILURES = new AtomicInteger();

    /**
     * Makes {@code errorAndExit} throw on the current thread.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restores the default behavior on the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Returns whether a failure was reported since the last {@link #resetFailures()}.
     *
     * @return {@code true} if at least one failure was reported
     */
    public static boolean hasFailures() {
        return FAILURES.get() > 0;
    }

    /**
     * Returns the number of reported failures.
     *
     * @return failure count
     */
    public static int getFailureCount() {
        return FAILURES.get();
    }

    /**
     * Clears the failure count.
     */
    public static void resetFailures() {
        FAILURES.set(0);
    }

    /**
     * Reports a failed command together with its cause.
     *
     * @param message message
     * @param cause cause
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        FAILURES.incrementAndGet();
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
    }

    /**
     * Reports an invalid invocation.
     *
     * @param message message
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        FAILURES.incrementAndGet();
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
