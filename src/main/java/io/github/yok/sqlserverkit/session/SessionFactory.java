package io.github.yok.sqlserverkit.session;

import com.google.common.base.Preconditions;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens initialized sessions on connections of one {@link ConnectionProvider}.
 *
 * <pre>
 * SessionFactory factory = new SessionFactory(connector::openConnection);
 * try (SqlSession session = factory.openSession()) {
 *     try (PreparedStatement ps = session.prepareStatement("INSERT INTO ...")) {
 *         ps.executeUpdate();
 *     }
 *     session.saveChanges();
 * }
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
public class SessionFactory {

    /** Isolation level of {@link #openSession()}. */
    public static final int DEFAULT_ISOLATION_LEVEL = Connection.TRANSACTION_SERIALIZABLE;

    private final ConnectionProvider connectionProvider;

    /**
     * Constructor.
     *
     * @param connectionProvider connection source
     */
    public SessionFactory(ConnectionProvider connectionProvider) {
        this.connectionProvider = Preconditions.checkNotNull(connectionProvider,
                "connectionProvider must not be null");
    }

    /**
     * Opens a read-only session without transaction.
     *
     * @return initialized session
     * @throws SQLException if the connection cannot be opened
     */
    public ReadOnlySqlSession openReadOnlySession() throws SQLException {
        return openReadOnlySession(Connection.TRANSACTION_NONE);
    }

    /**
     * Opens a read-only session, inside a transaction unless {@code isolationLevel} is
     * {@link Connection#TRANSACTION_NONE}.
     *
     * @param isolationLevel JDBC isolation level
     * @return initialized session
     * @throws SQLException if the connection cannot be opened or configured
     */
    public ReadOnlySqlSession openReadOnlySession(int isolationLevel) throws SQLException {
        return open(isolationLevel);
    }

    /**
     * Opens a session with a {@link Connection#TRANSACTION_SERIALIZABLE serializable}
     * transaction.
     *
     * @return initialized session
     * @throws SQLException if the connection cannot be opened or configured
     */
    public SqlSession openSession() throws SQLException {
        return openSession(DEFAULT_ISOLATION_LEVEL);
    }

    /**
     * Opens a session with the given isolation level.
     *
     * @param isolationLevel JDBC isolation level
     * @return initialized session
     * @throws SQLException if the connection cannot be opened or configured
     */
    public SqlSession openSession(int isolationLevel) throws SQLException {
        return open(isolationLevel);
    }

    private JdbcSession open(int isolationLevel) throws SQLException {
        JdbcSession session = new JdbcSession(connectionProvider, isolationLevel);
        session.initialize();
        return session;
    }
}
