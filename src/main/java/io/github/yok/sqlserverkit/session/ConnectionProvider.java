package io.github.yok.sqlserverkit.session;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies a new, open JDBC connection, e.g.
 * {@link io.github.yok.sqlserverkit.db.DatabaseConnector#openConnection()} or
 * {@code DataSource::getConnection}.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Opens a connection. The caller owns and closes it.
     *
     * @return open connection
     * @throws SQLException if the connection cannot be opened
     */
    Connection getConnection() throws SQLException;
}
