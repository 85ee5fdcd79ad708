package io.github.yok.sqlserverkit.db;

import com.google.common.base.Preconditions;
import io.github.yok.sqlserverkit.naming.DatabaseName;
import java.sql.Connection;
import java.sql.SQLException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Administrative commands for the database named in a connection's URL.
 *
 * <p>
 * Each command opens its own administrative connection through the {@link DatabaseConnector}
 * (same server, no catalog), runs the corresponding {@link DatabaseAdministration} operation and
 * closes the connection again. Dropping commands kill the user sessions of the database before
 * every drop attempt.
 * </p>
 *
 * <pre>
 * DatabaseAdministrator admin = new DatabaseAdministrator(connector, RetryPolicy.DEFAULT);
 * admin.dropAndCreateDatabase();
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DatabaseAdministrator {

    @Getter
    private final DatabaseConnector connector;

    @Getter
    private final RetryPolicy retryPolicy;

    /**
     * Constructor.
     *
     * @param connector connector of the target connection
     * @param retryPolicy retry policy of the retried commands
     */
    public DatabaseAdministrator(DatabaseConnector connector, RetryPolicy retryPolicy) {
        this.connector = Preconditions.checkNotNull(connector, "connector must not be null");
        this.retryPolicy = Preconditions.checkNotNull(retryPolicy, "retryPolicy must not be null");
    }

    /**
     * Checks whether the target database exists.
     *
     * @return {@code true} if it exists
     * @throws SQLException on database errors
     */
    public boolean databaseExists() throws SQLException {
        DatabaseName name = connector.getDatabaseName();
        try (Connection connection = connector.openAdministrativeConnection()) {
            return DatabaseAdministration.exists(connection, name);
        }
    }

    /**
     * Creates the target database if it does not exist.
     *
     * @return {@code true} if it was created
     * @throws SQLException on database errors
     */
    public boolean tryCreateDatabase() throws SQLException {
        DatabaseName name = connector.getDatabaseName();
        try (Connection connection = connector.openAdministrativeConnection()) {
            return DatabaseAdministration.tryCreate(connection, name, retryPolicy);
        }
    }

    /**
     * Kills the sessions of the target database and drops it if it exists.
     *
     * @return {@code true} if it was dropped
     * @throws SQLException on database errors
     */
    public boolean tryDropDatabase() throws SQLException {
        DatabaseName name = connector.getDatabaseName();
        try (Connection connection = connector.openAdministrativeConnection()) {
            return DatabaseAdministration.tryDrop(connection, name, retryPolicy);
        }
    }

    /**
     * Kills the sessions of the target database, drops it if it exists and creates it again.
     *
     * @return {@code true} if an existing database was dropped
     * @throws SQLException on database errors
     */
    public boolean dropAndCreateDatabase() throws SQLException {
        DatabaseName name = connector.getDatabaseName();
        try (Connection connection = connector.openAdministrativeConnection()) {
            return DatabaseAdministration.dropAndCreate(connection, name, retryPolicy);
        }
    }

    /**
     * Detaches the target database.
     *
     * @return the files of the detached database
     * @throws IllegalStateException if the database does not exist
     * @throws SQLException on database errors
     */
    public DatabasePhysicalFilesInfo detachDatabase() throws SQLException {
        DatabaseName name = connector.getDatabaseName();
        try (Connection connection = connector.openAdministrativeConnection()) {
            return DatabaseAdministration.detach(connection, name, retryPolicy);
        }
    }

    /**
     * Attaches the given files. The database is named after the catalog of the URL when it names
     * one (other than {@code master}), otherwise after the name stored in {@code filesInfo}.
     *
     * @param filesInfo files to attach
     * @return name the database was attached under
     * @throws SQLException on database errors
     */
    public DatabaseName attachDatabase(DatabasePhysicalFilesInfo filesInfo) throws SQLException {
        Preconditions.checkNotNull(filesInfo, "filesInfo must not be null");
        DatabaseName name = connector.findDatabaseName().orElse(filesInfo.getDatabaseName());
        try (Connection connection = connector.openAdministrativeConnection()) {
            DatabaseAdministration.attach(connection, name, filesInfo.getFiles());
        }
        return name;
    }
}
