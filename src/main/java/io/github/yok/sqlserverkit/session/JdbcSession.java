package io.github.yok.sqlserverkit.session;

import com.google.common.base.Preconditions;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import lombok.Getter;

/**
 * {@link SqlSession} on a plain JDBC connection.
 *
 * <p>
 * The connection is obtained from a {@link ConnectionProvider} in {@link #initialize()}. When an
 * isolation level other than {@link Connection#TRANSACTION_NONE} is given, auto-commit is switched
 * off and the isolation level is set, so every statement of the session runs in one transaction
 * until {@link #saveChanges()} commits it. {@link #close()} rolls back whatever was not committed.
 * </p>
 *
 * <p>
 * Not thread-safe; a session is used by one thread at a time.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class JdbcSession implements SqlSession {

    private final ConnectionProvider connectionProvider;

    // Connection.TRANSACTION_NONE means "no transaction"
    @Getter
    private final int isolationLevel;

    private Connection connection;

    /**
     * Constructor.
     *
     * @param connectionProvider supplies the connection in {@link #initialize()}
     * @param isolationLevel JDBC isolation level, or {@link Connection#TRANSACTION_NONE}
     */
    public JdbcSession(ConnectionProvider connectionProvider, int isolationLevel) {
        this.connectionProvider = Preconditions.checkNotNull(connectionProvider,
                "connectionProvider must not be null");
        this.isolationLevel = isolationLevel;
    }

    /**
     * Opens the connection and starts the transaction. Calling it again has no effect.
     *
     * @throws SQLException if the connection cannot be opened or configured
     */
    public void initialize() throws SQLException {
        if (connection != null) {
            return;
        }
        Connection opened = connectionProvider.getConnection();
        Preconditions.checkState(opened != null, "ConnectionProvider returned null");
        try {
            if (isTransactional()) {
                opened.setTransactionIsolation(isolationLevel);
                opened.setAutoCommit(false);
            }
        } catch (SQLException | RuntimeException e) {
            try {
                opened.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        connection = opened;
    }

    @Override
    public boolean isInitialized() {
        return connection != null;
    }

    /**
     * Returns whether statements of this session run inside a transaction.
     *
     * @return {@code true} unless the isolation level is {@link Connection#TRANSACTION_NONE}
     */
    public boolean isTransactional() {
        return isolationLevel != Connection.TRANSACTION_NONE;
    }

    @Override
    public Connection getConnection() {
        Preconditions.checkState(connection != null, "The session is not initialized.");
        return connection;
    }

    @Override
    public PreparedStatement prepareStatement(String sql) throws SQLException {
        return getConnection().prepareStatement(sql);
    }

    @Override
    public void saveChanges() throws SQLException {
        if (isTransactional()) {
            getConnection().commit();
        }
    }

    @Override
    public void close() throws SQLException {
        if (connection == null) {
            return;
        }
        Connection closing = connection;
        connection = null;
        try {
            // After saveChanges() there is nothing left to roll back
            if (isTransactional() && !closing.isClosed()) {
                closing.rollback();
            }
        } finally {
            closing.close();
        }
    }
}
