package io.github.yok.sqlserverkit.db;

import java.sql.SQLException;
import java.util.concurrent.CancellationException;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded retry loop for administrative statements.
 *
 * <p>
 * The call is executed up to {@link RetryPolicy#getMaxAttempts()} times. Every caught
 * {@link SQLException} is passed to the policy's exception observer; the last one is rethrown
 * unchanged. Cancellation of the token takes precedence over a pending {@link SQLException}.
 * </p>
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class Retry {

    /**
     * SQL work that may fail with {@link SQLException}.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    interface SqlCall<T> {

        /**
         * Executes the work.
         *
         * @return result
         * @throws SQLException on database errors
         */
        T call() throws SQLException;
    }

    /**
     * Executes the call with retries.
     *
     * @param description short description used in log messages
     * @param call statement execution
     * @param policy retry policy
     * @param token cancellation token
     * @param <T> result type
     * @return result of the first successful attempt
     * @throws SQLException the last failure once all attempts are used up
     * @throws CancellationException if the token is cancelled
     */
    static <T> T execute(String description, SqlCall<T> call, RetryPolicy policy,
            CancellationToken token) throws SQLException {
        int attempt = 1;
        while (true) {
            token.throwIfCancellationRequested();
            try {
                return call.call();
            } catch (SQLException e) {
                if (token.isCancellationRequested()) {
                    CancellationException ce =
                            new CancellationException(description + " was cancelled.");
                    ce.initCause(e);
                    throw ce;
                }

                policy.getExceptionObserver().accept(e);
                if (attempt > policy.getRetryCount()) {
                    log.warn("{} failed on attempt {}/{}; giving up: {}", description, attempt,
                            policy.getMaxAttempts(), e.getMessage());
                    throw e;
                }

                log.warn("{} failed on attempt {}/{}; retrying in {} ms: {}", description, attempt,
                        policy.getMaxAttempts(), policy.getInterval().toMillis(), e.getMessage());
                attempt++;
                token.await(policy.getInterval());
            }
        }
    }
}
