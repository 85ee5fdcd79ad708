package io.github.yok.sqlserverkit.db;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.concurrent.CancellationException;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Helpers that execute a single SQL command on an open connection.
 *
 * <p>
 * Three flavors are provided:
 * </p>
 * <ul>
 * <li>{@code executeNonQuery}: runs the command and returns the total number of affected rows</li>
 * <li>{@code executeScalar}: returns the first column of the first row of the first result
 * set</li>
 * <li>{@code executeReader}: maps every row of the first result set</li>
 * </ul>
 *
 * <p>
 * Without a {@link StatementBinder} the text is sent as is through a plain {@link Statement}
 * (required for batches with DDL such as {@code CREATE DATABASE}); with a binder a
 * {@link PreparedStatement} is used. All results of a batch are consumed so that errors raised by
 * later statements of the batch are reported.
 * </p>
 *
 * <p>
 * A running statement is cancelled via {@link Statement#cancel()} when the given
 * {@link CancellationToken} is cancelled; the failure is then reported as
 * {@link CancellationException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class DatabaseCommands {

    /**
     * Configures a {@link PreparedStatement} (parameters, timeouts, ...) before it is executed.
     */
    @FunctionalInterface
    public interface StatementBinder {

        /**
         * Binds parameters to the statement.
         *
         * @param statement statement to configure
         * @throws SQLException on JDBC errors
         */
        void bind(PreparedStatement statement) throws SQLException;
    }

    /**
     * Maps the current row of a {@link ResultSet}.
     *
     * @param <T> row type
     */
    @FunctionalInterface
    public interface RowMapper<T> {

        /**
         * Maps the current row.
         *
         * @param resultSet result set positioned on a row
         * @return mapped row
         * @throws SQLException on JDBC errors
         */
        T map(ResultSet resultSet) throws SQLException;
    }

    @FunctionalInterface
    private interface StatementWork<T> {
        T execute(Statement statement, String sql) throws SQLException;
    }

    /**
     * Executes the command and returns the number of affected rows.
     *
     * @param connection open connection
     * @param sql SQL text
     * @return total update count of the batch
     * @throws SQLException on database errors
     */
    public static int executeNonQuery(Connection connection, String sql) throws SQLException {
        return executeNonQuery(connection, sql, null, CancellationToken.NONE);
    }

    /**
     * Executes the command and returns the number of affected rows.
     *
     * @param connection open connection
     * @param sql SQL text
     * @param binder parameter binder, or {@code null} to send the text as is
     * @param token cancellation token
     * @return total update count of the batch
     * @throws SQLException on database errors
     * @throws CancellationException if the token is cancelled
     */
    public static int executeNonQuery(Connection connection, String sql, StatementBinder binder,
            CancellationToken token) throws SQLException {
        return run(connection, sql, binder, token, DatabaseCommands::executeAndDrain);
    }

    /**
     * Executes the command inside its own transaction.
     *
     * @param connection open connection
     * @param sql SQL text
     * @param binder parameter binder, or {@code null}
     * @param isolationLevel JDBC isolation level (e.g.
     *        {@link Connection#TRANSACTION_SERIALIZABLE})
     * @param token cancellation token
     * @return total update count of the batch
     * @throws SQLException on database errors; the transaction is rolled back
     */
    public static int executeNonQueryInTransaction(Connection connection, String sql,
            StatementBinder binder, int isolationLevel, CancellationToken token)
            throws SQLException {
        return inTransaction(connection, isolationLevel,
                () -> executeNonQuery(connection, sql, binder, token));
    }

    /**
     * Executes the command and returns the first column of the first row.
     *
     * @param connection open connection
     * @param sql SQL text
     * @param type expected value type
     * @param <T> value type
     * @return value, or {@code null} if the value is SQL NULL or no row was returned
     * @throws SQLException on database errors or if the value cannot be converted
     */
    public static <T> T executeScalar(Connection connection, String sql, Class<T> type)
            throws SQLException {
        return executeScalar(connection, sql, type, null, CancellationToken.NONE);
    }

    /**
     * Executes the command and returns the first column of the first row.
     *
     * @param connection open connection
     * @param sql SQL text
     * @param type expected value type
     * @param binder parameter binder, or {@code null}
     * @param token cancellation token
     * @param <T> value type
     * @return value, or {@code null} if the value is SQL NULL or no row was returned
     * @throws SQLException on database errors or if the value cannot be converted
     * @throws CancellationException if the token is cancelled
     */
    public static <T> T executeScalar(Connection connection, String sql, Class<T> type,
            StatementBinder binder, CancellationToken token) throws SQLException {
        Preconditions.checkNotNull(type, "type must not be null");
        return run(connection, sql, binder, token, (statement, text) -> {
            ResultSet resultSet = nextResultSet(statement, execute(statement, text));
            if (resultSet == null) {
                return null;
            }
            try (ResultSet rs = resultSet) {
                T value = rs.next() ? convert(rs.getObject(1), type) : null;
                drainUpdateCount(statement, statement.getMoreResults());
                return value;
            }
        });
    }

    /**
     * Executes the command inside its own transaction and returns the first column of the first
     * row.
     *
     * @param connection open connection
     * @param sql SQL text
     * @param type expected value type
     * @param binder parameter binder, or {@code null}
     * @param isolationLevel JDBC isolation level
     * @param token cancellation token
     * @param <T> value type
     * @return value, or {@code null}
     * @throws SQLException on database errors; the transaction is rolled back
     */
    public static <T> T executeScalarInTransaction(Connection connection, String sql,
            Class<T> type, StatementBinder binder, int isolationLevel, CancellationToken token)
            throws SQLException {
        return inTransaction(connection, isolationLevel,
                () -> executeScalar(connection, sql, type, binder, token));
    }

    /**
     * Executes the query and maps all rows of the first result set.
     *
     * @param connection open connection
     * @param sql SQL text
     * @param mapper row mapper
     * @param <T> row type
     * @return mapped rows (empty if the command returned no result set)
     * @throws SQLException on database errors
     */
    public static <T> List<T> executeReader(Connection connection, String sql,
            RowMapper<T> mapper) throws SQLException {
        return executeReader(connection, sql, mapper, null, CancellationToken.NONE);
    }

    /**
     * Executes the query and maps all rows of the first result set.
     *
     * @param connection open connection
     * @param sql SQL text
     * @param mapper row mapper
     * @param binder parameter binder, or {@code null}
     * @param token cancellation token
     * @param <T> row type
     * @return mapped rows (empty if the command returned no result set)
     * @throws SQLException on database errors
     * @throws CancellationException if the token is cancelled
     */
    public static <T> List<T> executeReader(Connection connection, String sql,
            RowMapper<T> mapper, StatementBinder binder, CancellationToken token)
            throws SQLException {
        Preconditions.checkNotNull(mapper, "mapper must not be null");
        return run(connection, sql, binder, token, (statement, text) -> {
            ResultSet resultSet = nextResultSet(statement, execute(statement, text));
            if (resultSet == null) {
                return ImmutableList.of();
            }
            ImmutableList.Builder<T> rows = ImmutableList.builder();
            try (ResultSet rs = resultSet) {
                while (rs.next()) {
                    token.throwIfCancellationRequested();
                    rows.add(mapper.map(rs));
                }
            }
            return rows.build();
        });
    }

    private static <T> T run(Connection connection, String sql, StatementBinder binder,
            CancellationToken token, StatementWork<T> work) throws SQLException {
        Preconditions.checkNotNull(connection, "connection must not be null");
        Preconditions.checkArgument(StringUtils.isNotBlank(sql), "sql must not be blank");
        Preconditions.checkNotNull(token, "token must not be null");
        token.throwIfCancellationRequested();

        try (Statement statement = createStatement(connection, sql, binder);
                CancellationToken.Registration ignored =
                        token.register(() -> cancelQuietly(statement))) {
            log.debug("Executing SQL: {}", sql);
            return work.execute(statement, sql);
        } catch (SQLException e) {
            if (token.isCancellationRequested()) {
                CancellationException ce = new CancellationException("The command was cancelled.");
                ce.initCause(e);
                throw ce;
            }
            throw e;
        }
    }

    private static Statement createStatement(Connection connection, String sql,
            StatementBinder binder) throws SQLException {
        if (binder == null) {
            return connection.createStatement();
        }
        PreparedStatement prepared = connection.prepareStatement(sql);
        try {
            binder.bind(prepared);
        } catch (SQLException | RuntimeException e) {
            prepared.close();
            throw e;
        }
        return prepared;
    }

    private static boolean execute(Statement statement, String sql) throws SQLException {
        if (statement instanceof PreparedStatement) {
            return ((PreparedStatement) statement).execute();
        }
        return statement.execute(sql);
    }

    private static int executeAndDrain(Statement statement, String sql) throws SQLException {
        return drainUpdateCount(statement, execute(statement, sql));
    }

    // Consumes every remaining result of the batch and sums the update counts
    private static int drainUpdateCount(Statement statement, boolean isResultSet)
            throws SQLException {
        int total = 0;
        while (true) {
            if (isResultSet) {
                ResultSet skipped = statement.getResultSet();
                if (skipped != null) {
                    skipped.close();
                }
            } else {
                int count = statement.getUpdateCount();
                if (count == -1) {
                    return total;
                }
                total += count;
            }
            isResultSet = statement.getMoreResults();
        }
    }

    // Skips update counts until the next result set; null when the batch has none left
    private static ResultSet nextResultSet(Statement statement, boolean isResultSet)
            throws SQLException {
        while (!isResultSet) {
            if (statement.getUpdateCount() == -1) {
                return null;
            }
            isResultSet = statement.getMoreResults();
        }
        return statement.getResultSet();
    }

    private static <T> T inTransaction(Connection connection, int isolationLevel,
            Retry.SqlCall<T> work) throws SQLException {
        Preconditions.checkNotNull(connection, "connection must not be null");
        boolean previousAutoCommit = connection.getAutoCommit();
        int previousIsolation = connection.getTransactionIsolation();
        connection.setTransactionIsolation(isolationLevel);
        connection.setAutoCommit(false);
        T result;
        try {
            result = work.call();
            connection.commit();
        } catch (SQLException | RuntimeException e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            try {
                restore(connection, previousAutoCommit, previousIsolation);
            } catch (SQLException restoreFailure) {
                e.addSuppressed(restoreFailure);
            }
            throw e;
        }
        restore(connection, previousAutoCommit, previousIsolation);
        return result;
    }

    private static void restore(Connection connection, boolean autoCommit, int isolationLevel)
            throws SQLException {
        connection.setAutoCommit(autoCommit);
        connection.setTransactionIsolation(isolationLevel);
    }

    @SuppressWarnings("unchecked")
    static <T> T convert(Object value, Class<T> type) throws SQLException {
        if (value == null) {
            return null;
        }
        if (type.isInstance(value)) {
            return (T) value;
        }
        if (value instanceof Number
                && (type == Integer.class || type == Long.class || type == Short.class)) {
            try {
                BigDecimal exact = toBigDecimal((Number) value);
                if (type == Integer.class) {
                    return (T) Integer.valueOf(exact.intValueExact());
                }
                if (type == Long.class) {
                    return (T) Long.valueOf(exact.longValueExact());
                }
                return (T) Short.valueOf(exact.shortValueExact());
            } catch (ArithmeticException | NumberFormatException e) {
                throw new SQLException("Cannot convert value " + value + " to " + type.getName(),
                        e);
            }
        }
        if (type == String.class) {
            return (T) value.toString();
        }
        throw new SQLException("Cannot convert value of type " + value.getClass().getName()
                + " to " + type.getName());
    }

    // Fractions and out-of-range values make the *ValueExact methods throw ArithmeticException
    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger) number);
        }
        if (number instanceof Long || number instanceof Integer || number instanceof Short
                || number instanceof Byte) {
            return BigDecimal.valueOf(number.longValue());
        }
        return new BigDecimal(number.toString());
    }

    private static void cancelQuietly(Statement statement) {
        try {
            statement.cancel();
        } catch (SQLException e) {
            log.debug("Statement.cancel() failed: {}", e.getMessage());
        }
    }
}
