package io.github.yok.sqlserverkit.session;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Session that only reads data. It wraps one connection and, optionally, a transaction that is
 * never committed.
 *
 * @author Yasuharu.Okawauchi
 */
public interface ReadOnlySqlSession extends AutoCloseable {

    /**
     * Returns the connection of this session.
     *
     * @return open connection
     * @throws IllegalStateException if the session is not initialized
     */
    Connection getConnection();

    /**
     * Prepares a statement on the session's connection (and thus inside its transaction).
     *
     * @param sql SQL text
     * @return prepared statement, to be closed by the caller
     * @throws SQLException on JDBC errors
     * @throws IllegalStateException if the session is not initialized
     */
    PreparedStatement prepareStatement(String sql) throws SQLException;

    /**
     * Returns whether the connection is open and, for transactional sessions, the transaction was
     * started.
     *
     * @return {@code true} once the session is usable
     */
    boolean isInitialized();

    /**
     * Rolls back an uncommitted transaction and closes the connection.
     *
     * @throws SQLException on JDBC errors
     */
    @Override
    void close() throws SQLException;
}
