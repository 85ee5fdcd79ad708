package io.github.yok.sqlserverkit.db;

import com.google.common.base.Preconditions;
import io.github.yok.sqlserverkit.naming.DatabaseName;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;

/**
 * Asynchronous variants of the {@link DatabaseAdministration} operations.
 *
 * <p>
 * Each call runs the blocking operation on the configured {@link Executor} and returns a
 * {@link CompletableFuture}. JDBC failures complete the future exceptionally with the original
 * {@link SQLException}. Invalid arguments are rejected synchronously, before anything is submitted.
 * </p>
 *
 * <p>
 * The operation observes its own {@link CancellationToken}, linked to the one passed by the
 * caller. Cancelling either the caller's token or the returned future cancels it, which aborts the
 * running statement and any pending retry delay; the future then completes with a
 * {@link java.util.concurrent.CancellationException}.
 * </p>
 *
 * <pre>
 * ExecutorService executor = Executors.newSingleThreadExecutor();
 * AsyncDatabaseAdministration admin = new AsyncDatabaseAdministration(executor);
 * CompletableFuture&lt;Boolean&gt; created =
 *         admin.tryCreateAsync(connection, DatabaseName.of("MyDb"), RetryPolicy.DEFAULT,
 *                 CancellationToken.NONE);
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class AsyncDatabaseAdministration {

    /**
     * Work executed on the executor thread.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    private interface AsyncWork<T> {
        T run(CancellationToken token) throws SQLException;
    }

    private final Executor executor;

    /**
     * Constructor.
     *
     * @param executor executor running the blocking JDBC calls
     */
    public AsyncDatabaseAdministration(Executor executor) {
        this.executor = Preconditions.checkNotNull(executor, "executor must not be null");
    }

    /**
     * Asynchronous {@link DatabaseAdministration#exists(Connection, DatabaseName,
     * CancellationToken)}.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param token caller's cancellation token
     * @return future completed with {@code true} if the database exists
     */
    public CompletableFuture<Boolean> existsAsync(Connection connection,
            DatabaseName databaseName, CancellationToken token) {
        checkArguments(connection, databaseName, token);
        return submit(token,
                linked -> DatabaseAdministration.exists(connection, databaseName, linked));
    }

    /**
     * Asynchronous {@link DatabaseAdministration#killAllConnections(Connection, DatabaseName,
     * CancellationToken)}.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param token caller's cancellation token
     * @return future completed when the sessions were killed
     */
    public CompletableFuture<Void> killAllConnectionsAsync(Connection connection,
            DatabaseName databaseName, CancellationToken token) {
        checkArguments(connection, databaseName, token);
        return submit(token, linked -> {
            DatabaseAdministration.killAllConnections(connection, databaseName, linked);
            return null;
        });
    }

    /**
     * Asynchronous {@link DatabaseAdministration#setSingleUser(Connection, DatabaseName,
     * CancellationToken)}.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param token caller's cancellation token
     * @return future completed when the database is in single-user mode
     */
    public CompletableFuture<Void> setSingleUserAsync(Connection connection,
            DatabaseName databaseName, CancellationToken token) {
        checkArguments(connection, databaseName, token);
        return submit(token, linked -> {
            DatabaseAdministration.setSingleUser(connection, databaseName, linked);
            return null;
        });
    }

    /**
     * Asynchronous {@link DatabaseAdministration#tryCreate(Connection, DatabaseName, RetryPolicy,
     * CancellationToken)}.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param policy retry policy
     * @param token caller's cancellation token
     * @return future completed with {@code true} if the database was created
     */
    public CompletableFuture<Boolean> tryCreateAsync(Connection connection,
            DatabaseName databaseName, RetryPolicy policy, CancellationToken token) {
        checkArguments(connection, databaseName, policy, token);
        return submit(token, linked -> DatabaseAdministration.tryCreate(connection, databaseName,
                policy, linked));
    }

    /**
     * Asynchronous {@link DatabaseAdministration#tryDrop(Connection, DatabaseName, RetryPolicy,
     * CancellationToken)}.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param policy retry policy
     * @param token caller's cancellation token
     * @return future completed with {@code true} if the database was dropped
     */
    public CompletableFuture<Boolean> tryDropAsync(Connection connection,
            DatabaseName databaseName, RetryPolicy policy, CancellationToken token) {
        checkArguments(connection, databaseName, policy, token);
        return submit(token, linked -> DatabaseAdministration.tryDrop(connection, databaseName,
                policy, linked));
    }

    /**
     * Asynchronous {@link DatabaseAdministration#dropAndCreate(Connection, DatabaseName,
     * RetryPolicy, CancellationToken)}.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param policy retry policy
     * @param token caller's cancellation token
     * @return future completed with {@code true} if an existing database was dropped first
     */
    public CompletableFuture<Boolean> dropAndCreateAsync(Connection connection,
            DatabaseName databaseName, RetryPolicy policy, CancellationToken token) {
        checkArguments(connection, databaseName, policy, token);
        return submit(token, linked -> DatabaseAdministration.dropAndCreate(connection,
                databaseName, policy, linked));
    }

    /**
     * Asynchronous {@link DatabaseAdministration#detach(Connection, DatabaseName, RetryPolicy,
     * CancellationToken)}.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param policy retry policy
     * @param token caller's cancellation token
     * @return future completed with the files of the detached database
     */
    public CompletableFuture<DatabasePhysicalFilesInfo> detachAsync(Connection connection,
            DatabaseName databaseName, RetryPolicy policy, CancellationToken token) {
        checkArguments(connection, databaseName, policy, token);
        return submit(token,
                linked -> DatabaseAdministration.detach(connection, databaseName, policy, linked));
    }

    /**
     * Asynchronous {@link DatabaseAdministration#attach(Connection, DatabaseName, List,
     * CancellationToken)}.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param files database files; must not be empty
     * @param token caller's cancellation token
     * @return future completed when the database is attached
     */
    public CompletableFuture<Void> attachAsync(Connection connection, DatabaseName databaseName,
            List<DatabaseFileInfo> files, CancellationToken token) {
        checkArguments(connection, databaseName, token);
        Preconditions.checkNotNull(files, "files must not be null");
        Preconditions.checkArgument(!files.isEmpty(), "files must not be empty");
        return submit(token, linked -> {
            DatabaseAdministration.attach(connection, databaseName, files, linked);
            return null;
        });
    }

    private <T> CompletableFuture<T> submit(CancellationToken callerToken, AsyncWork<T> work) {
        CompletableFuture<T> future = new CompletableFuture<>();
        CancellationToken linked = new CancellationToken();
        CancellationToken.Registration registration = callerToken.register(linked::cancel);
        future.whenComplete((result, error) -> {
            registration.close();
            if (future.isCancelled()) {
                linked.cancel();
            }
        });

        try {
            executor.execute(() -> {
                if (future.isDone()) {
                    return;
                }
                try {
                    future.complete(work.run(linked));
                } catch (Throwable t) {
                    future.completeExceptionally(t);
                    // Errors still reach the executor's uncaught exception handling
                    if (t instanceof Error) {
                        throw (Error) t;
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Database operation rejected by executor: {}", e.getMessage());
            future.completeExceptionally(e);
        }
        return future;
    }

    private static void checkArguments(Connection connection, DatabaseName databaseName,
            CancellationToken token) {
        Preconditions.checkNotNull(connection, "connection must not be null");
        Preconditions.checkNotNull(databaseName, "databaseName must not be null");
        Preconditions.checkNotNull(token, "token must not be null");
    }

    private static void checkArguments(Connection connection, DatabaseName databaseName,
            RetryPolicy policy, CancellationToken token) {
        checkArguments(connection, databaseName, token);
        Preconditions.checkNotNull(policy, "policy must not be null");
    }
}
