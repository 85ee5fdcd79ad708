package io.github.yok.sqlserverkit.db;

import com.google.common.base.Preconditions;
import io.github.yok.sqlserverkit.config.ConnectionConfig;
import io.github.yok.sqlserverkit.naming.DatabaseName;
import io.github.yok.sqlserverkit.util.JdbcDriverLoader;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Opens JDBC connections for one configured SQL Server connection.
 *
 * <p>
 * Two kinds of connections are available:
 * </p>
 * <ul>
 * <li>{@link #openConnection()}: the configured URL as is, i.e. a connection to the target
 * database</li>
 * <li>{@link #openAdministrativeConnection()}: the same server without the catalog, i.e. a
 * connection to the login's default database. Administrative statements such as
 * {@code DROP DATABASE} must not run on a connection that uses the database itself.</li>
 * </ul>
 *
 * <p>
 * Connections are not pooled; each call opens a new one that the caller must close.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DatabaseConnector {

    // Logical connection ID from application.yml
    @Getter
    private final String id;

    // Parsed target URL
    @Getter
    private final SqlServerConnectionString connectionString;

    private final String user;
    private final String password;
    private final String driverClass;

    /**
     * Constructor.
     *
     * @param entry connection entry
     * @throws IllegalArgumentException if the URL is not a SQL Server JDBC URL
     */
    public DatabaseConnector(ConnectionConfig.Entry entry) {
        Preconditions.checkNotNull(entry, "entry must not be null");
        this.id = entry.getId();
        this.connectionString = SqlServerConnectionString.parse(entry.getUrl());
        this.user = entry.getUser();
        this.password = entry.getPassword();
        this.driverClass = entry.getDriverClass();
    }

    /**
     * Returns the catalog of the URL as validated database name.
     *
     * @return database name, or empty if the URL names no catalog or {@code master}
     * @throws io.github.yok.sqlserverkit.naming.InvalidDatabaseNameException if the catalog is not
     *         a valid database name
     */
    public Optional<DatabaseName> findDatabaseName() {
        if (!connectionString.hasNonAdministrativeDatabaseName()) {
            return Optional.empty();
        }
        return connectionString.getDatabaseName().map(DatabaseName::of);
    }

    /**
     * Returns the catalog of the URL as validated database name.
     *
     * @return database name
     * @throws IllegalStateException if the URL names no catalog or {@code master}
     * @throws io.github.yok.sqlserverkit.naming.InvalidDatabaseNameException if the catalog is not
     *         a valid database name
     */
    public DatabaseName getDatabaseName() {
        return findDatabaseName().orElseThrow(() -> new IllegalStateException(
                "Connection '" + id + "' does not name a target database (databaseName=...) in "
                        + "its URL: " + connectionString.getServer()));
    }

    /**
     * Opens a connection to the target database.
     *
     * @return new connection
     * @throws SQLException if the connection cannot be opened
     */
    public Connection openConnection() throws SQLException {
        return open(connectionString);
    }

    /**
     * Opens a connection to the same server without catalog.
     *
     * @return new administrative connection
     * @throws SQLException if the connection cannot be opened
     */
    public Connection openAdministrativeConnection() throws SQLException {
        return open(connectionString.withoutDatabaseName());
    }

    /**
     * Executes a command on a new connection to the target database.
     *
     * @param sql SQL text
     * @return total update count
     * @throws SQLException on database errors
     */
    public int executeNonQuery(String sql) throws SQLException {
        try (Connection connection = openConnection()) {
            return DatabaseCommands.executeNonQuery(connection, sql);
        }
    }

    /**
     * Executes a query on a new connection to the target database and returns the first column of
     * the first row.
     *
     * @param sql SQL text
     * @param type expected value type
     * @param <T> value type
     * @return value, or {@code null}
     * @throws SQLException on database errors
     */
    public <T> T executeScalar(String sql, Class<T> type) throws SQLException {
        try (Connection connection = openConnection()) {
            return DatabaseCommands.executeScalar(connection, sql, type);
        }
    }

    private Connection open(SqlServerConnectionString target) throws SQLException {
        try {
            JdbcDriverLoader.loadIfConfigured(driverClass);
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("JDBC driver class not found: " + driverClass, e);
        }
        // The URL may carry credentials; only server and catalog are logged
        log.debug("[{}] Opening connection to {} (catalog: {})", id, target.getServer(),
                target.getDatabaseName().orElse("<default>"));
        return DriverManager.getConnection(target.toString(), user, password);
    }
}
