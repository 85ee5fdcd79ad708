package io.github.yok.sqlserverkit.db;

import com.google.common.base.Preconditions;
import io.github.yok.sqlserverkit.naming.DatabaseName;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.CancellationException;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Administrative operations on SQL Server databases.
 *
 * <p>
 * Every operation runs on an already opened <em>administrative</em> connection, i.e. a connection
 * to {@code master} or to the login's default database, never to the target database itself
 * (SQL Server does not allow dropping the database a session is using). The connection is owned by
 * the caller and must not be used concurrently.
 * </p>
 *
 * <p>
 * Only {@link DatabaseName} values are interpolated into the statements: the plain name inside
 * {@code N'...'} literals and {@link DatabaseName#getIdentifier()} in DDL.
 * </p>
 *
 * <p>
 * {@link #tryCreate}, {@link #tryDrop}, {@link #dropAndCreate} and {@link #detach} are executed
 * with a {@link RetryPolicy}; the remaining operations are executed once.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class DatabaseAdministration {

    /**
     * Checks whether a database with the given name exists on the server.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @return {@code true} if the database exists
     * @throws SQLException on database errors
     */
    public static boolean exists(Connection connection, DatabaseName databaseName)
            throws SQLException {
        return exists(connection, databaseName, CancellationToken.NONE);
    }

    /**
     * Checks whether a database with the given name exists on the server.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param token cancellation token
     * @return {@code true} if the database exists
     * @throws SQLException on database errors
     * @throws CancellationException if the token is cancelled
     */
    public static boolean exists(Connection connection, DatabaseName databaseName,
            CancellationToken token) throws SQLException {
        checkArguments(connection, databaseName);
        String sql = "SELECT DB_ID(N'" + databaseName + "');";
        return DatabaseCommands.executeScalar(connection, sql, Object.class, null, token) != null;
    }

    /**
     * Kills all user sessions connected to the database. Does nothing when the database does not
     * exist.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param token cancellation token
     * @throws SQLException on database errors
     */
    public static void killAllConnections(Connection connection, DatabaseName databaseName,
            CancellationToken token) throws SQLException {
        checkArguments(connection, databaseName);
        // Concatenates "kill <session_id>;" for every user session and executes the result
        String sql = "DECLARE @kill nvarchar(max) = N'';\n"
                + "SELECT @kill = @kill + N'kill ' + CONVERT(nvarchar(10), session_id) + N';'\n"
                + "FROM sys.dm_exec_sessions\n"
                + "WHERE database_id = DB_ID(N'" + databaseName + "') AND is_user_process = 1\n"
                + "  AND session_id <> @@SPID;\n"
                + "EXEC(@kill);";
        DatabaseCommands.executeNonQuery(connection, sql, null, token);
        log.debug("Killed user sessions of database {}", databaseName);
    }

    /**
     * Switches the database to single-user mode, rolling back open transactions of other sessions
     * immediately.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param token cancellation token
     * @throws SQLException on database errors (e.g. the database does not exist)
     */
    public static void setSingleUser(Connection connection, DatabaseName databaseName,
            CancellationToken token) throws SQLException {
        checkArguments(connection, databaseName);
        String sql = "ALTER DATABASE " + databaseName.getIdentifier()
                + " SET SINGLE_USER WITH ROLLBACK IMMEDIATE;";
        DatabaseCommands.executeNonQuery(connection, sql, null, token);
    }

    /**
     * Creates the database if it does not exist yet.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param policy retry policy
     * @param token cancellation token
     * @return {@code true} if the database was created, {@code false} if it already existed
     * @throws SQLException the last failure once all attempts are used up
     * @throws CancellationException if the token is cancelled
     */
    public static boolean tryCreate(Connection connection, DatabaseName databaseName,
            RetryPolicy policy, CancellationToken token) throws SQLException {
        checkArguments(connection, databaseName, policy, token);
        String sql = "DECLARE @DbId INT;\n"
                + "SELECT @DbId = DB_ID(N'" + databaseName + "');\n"
                + "IF @DbId IS NULL\n"
                + "    CREATE DATABASE " + databaseName.getIdentifier() + ";\n"
                + "SELECT @DbId;";

        boolean created = Retry.execute("Creating database " + databaseName,
                () -> DatabaseCommands.executeScalar(connection, sql, Object.class, null,
                        token) == null,
                policy, token);
        log.info("Database {} {}", databaseName, created ? "created" : "already exists");
        return created;
    }

    /**
     * Drops the database if it exists. Each attempt first {@link #killAllConnections kills the
     * user sessions} of the database, then drops it.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param policy retry policy
     * @param token cancellation token
     * @return {@code true} if the database was dropped, {@code false} if it did not exist
     * @throws SQLException the last failure once all attempts are used up
     * @throws CancellationException if the token is cancelled
     */
    public static boolean tryDrop(Connection connection, DatabaseName databaseName,
            RetryPolicy policy, CancellationToken token) throws SQLException {
        checkArguments(connection, databaseName, policy, token);
        String sql = "DECLARE @DbId INT;\n"
                + "SELECT @DbId = DB_ID(N'" + databaseName + "');\n"
                + dropIfExistsBlock(databaseName)
                + "SELECT @DbId;";

        boolean dropped = Retry.execute("Dropping database " + databaseName, () -> {
            killAllConnections(connection, databaseName, token);
            return DatabaseCommands.executeScalar(connection, sql, Object.class, null,
                    token) != null;
        }, policy, token);
        log.info("Database {} {}", databaseName, dropped ? "dropped" : "does not exist");
        return dropped;
    }

    /**
     * Drops the database if it exists and creates it again, in one batch. Each attempt first
     * {@link #killAllConnections kills the user sessions} of the database. Leaves an empty database
     * behind; typically used to set up test fixtures.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param policy retry policy
     * @param token cancellation token
     * @return {@code true} if an existing database was dropped before it was created
     * @throws SQLException the last failure once all attempts are used up
     * @throws CancellationException if the token is cancelled
     */
    public static boolean dropAndCreate(Connection connection, DatabaseName databaseName,
            RetryPolicy policy, CancellationToken token) throws SQLException {
        checkArguments(connection, databaseName, policy, token);
        String sql = "DECLARE @DbId INT;\n"
                + "SELECT @DbId = DB_ID(N'" + databaseName + "');\n"
                + dropIfExistsBlock(databaseName)
                + "CREATE DATABASE " + databaseName.getIdentifier() + ";\n"
                + "SELECT @DbId;";

        boolean dropped = Retry.execute("Recreating database " + databaseName, () -> {
            killAllConnections(connection, databaseName, token);
            return DatabaseCommands.executeScalar(connection, sql, Object.class, null,
                    token) != null;
        }, policy, token);
        log.info("Database {} recreated (previous database dropped: {})", databaseName, dropped);
        return dropped;
    }

    /**
     * Reads the physical files of the database from {@code sys.master_files}.
     *
     * @param connection open connection (administrative or to the database itself)
     * @param databaseName database name
     * @param token cancellation token
     * @return files in {@code file_id} order; empty if the database does not exist
     * @throws SQLException on database errors
     */
    public static List<DatabaseFileInfo> getPhysicalFiles(Connection connection,
            DatabaseName databaseName, CancellationToken token) throws SQLException {
        checkArguments(connection, databaseName);
        String sql = "SELECT type_desc, physical_name\n"
                + "FROM sys.master_files\n"
                + "WHERE database_id = DB_ID(N'" + databaseName + "')\n"
                + "ORDER BY file_id;";
        return DatabaseCommands.executeReader(connection, sql,
                rs -> new DatabaseFileInfo(rs.getString(1), rs.getString(2)), null, token);
    }

    /**
     * Reads the physical layout of an existing database.
     *
     * @param connection open connection
     * @param databaseName database name
     * @param token cancellation token
     * @return the database name and its files
     * @throws IllegalStateException if the database does not exist
     * @throws SQLException on database errors
     */
    public static DatabasePhysicalFilesInfo getPhysicalFilesInfo(Connection connection,
            DatabaseName databaseName, CancellationToken token) throws SQLException {
        List<DatabaseFileInfo> files = getPhysicalFiles(connection, databaseName, token);
        if (files.isEmpty()) {
            throw new IllegalStateException(
                    "The database \"" + databaseName + "\" does not exist.");
        }
        return new DatabasePhysicalFilesInfo(databaseName, files);
    }

    /**
     * Detaches the database from the server. The file inventory is captured first; then the
     * database is switched to single-user mode (so that no session keeps it locked) and
     * {@code sp_detach_db} is executed. The last two steps are retried.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param policy retry policy
     * @param token cancellation token
     * @return the files of the detached database
     * @throws IllegalStateException if the database does not exist
     * @throws SQLException the last failure once all attempts are used up
     * @throws CancellationException if the token is cancelled
     */
    public static DatabasePhysicalFilesInfo detach(Connection connection,
            DatabaseName databaseName, RetryPolicy policy, CancellationToken token)
            throws SQLException {
        checkArguments(connection, databaseName, policy, token);
        DatabasePhysicalFilesInfo info = getPhysicalFilesInfo(connection, databaseName, token);

        String sql = "EXEC sp_detach_db @dbname = N'" + databaseName + "', @skipchecks = 'true';";
        Retry.execute("Detaching database " + databaseName, () -> {
            setSingleUser(connection, databaseName, token);
            DatabaseCommands.executeNonQuery(connection, sql, null, token);
            return null;
        }, policy, token);
        log.info("Database {} detached ({} file(s))", databaseName, info.getFiles().size());
        return info;
    }

    /**
     * Attaches previously detached files as a database.
     *
     * @param connection open administrative connection
     * @param databaseName name under which the files are attached
     * @param files files of the database; must not be empty
     * @param token cancellation token
     * @throws SQLException on database errors (e.g. missing files); not retried
     */
    public static void attach(Connection connection, DatabaseName databaseName,
            List<DatabaseFileInfo> files, CancellationToken token) throws SQLException {
        checkArguments(connection, databaseName);
        Preconditions.checkNotNull(files, "files must not be null");
        Preconditions.checkArgument(!files.isEmpty(), "files must not be empty");
        DatabaseCommands.executeNonQuery(connection, createAttachStatement(databaseName, files),
                null, token);
        log.info("Database {} attached ({} file(s))", databaseName, files.size());
    }

    /**
     * Attaches the files of the given layout under its database name.
     *
     * @param connection open administrative connection
     * @param filesInfo layout returned by {@link #detach}
     * @param token cancellation token
     * @throws SQLException on database errors; not retried
     */
    public static void attach(Connection connection, DatabasePhysicalFilesInfo filesInfo,
            CancellationToken token) throws SQLException {
        Preconditions.checkNotNull(filesInfo, "filesInfo must not be null");
        attach(connection, filesInfo.getDatabaseName(), filesInfo.getFiles(), token);
    }

    /**
     * Token-less variant of {@link #killAllConnections(Connection, DatabaseName,
     * CancellationToken)}.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @throws SQLException on database errors
     */
    public static void killAllConnections(Connection connection, DatabaseName databaseName)
            throws SQLException {
        killAllConnections(connection, databaseName, CancellationToken.NONE);
    }

    /**
     * Token-less variant of {@link #setSingleUser(Connection, DatabaseName, CancellationToken)}.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @throws SQLException on database errors
     */
    public static void setSingleUser(Connection connection, DatabaseName databaseName)
            throws SQLException {
        setSingleUser(connection, databaseName, CancellationToken.NONE);
    }

    /**
     * Token-less variant of {@link #tryCreate(Connection, DatabaseName, RetryPolicy,
     * CancellationToken)}.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param policy retry policy
     * @return {@code true} if the database was created
     * @throws SQLException the last failure once all attempts are used up
     */
    public static boolean tryCreate(Connection connection, DatabaseName databaseName,
            RetryPolicy policy) throws SQLException {
        return tryCreate(connection, databaseName, policy, CancellationToken.NONE);
    }

    /**
     * Token-less variant of {@link #tryDrop(Connection, DatabaseName, RetryPolicy,
     * CancellationToken)}.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param policy retry policy
     * @return {@code true} if the database was dropped
     * @throws SQLException the last failure once all attempts are used up
     */
    public static boolean tryDrop(Connection connection, DatabaseName databaseName,
            RetryPolicy policy) throws SQLException {
        return tryDrop(connection, databaseName, policy, CancellationToken.NONE);
    }

    /**
     * Token-less variant of {@link #dropAndCreate(Connection, DatabaseName, RetryPolicy,
     * CancellationToken)}.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param policy retry policy
     * @return {@code true} if an existing database was dropped first
     * @throws SQLException the last failure once all attempts are used up
     */
    public static boolean dropAndCreate(Connection connection, DatabaseName databaseName,
            RetryPolicy policy) throws SQLException {
        return dropAndCreate(connection, databaseName, policy, CancellationToken.NONE);
    }

    /**
     * Token-less variant of {@link #getPhysicalFilesInfo(Connection, DatabaseName,
     * CancellationToken)}.
     *
     * @param connection open connection
     * @param databaseName database name
     * @return the database name and its files
     * @throws SQLException on database errors
     */
    public static DatabasePhysicalFilesInfo getPhysicalFilesInfo(Connection connection,
            DatabaseName databaseName) throws SQLException {
        return getPhysicalFilesInfo(connection, databaseName, CancellationToken.NONE);
    }

    /**
     * Token-less variant of {@link #getPhysicalFiles(Connection, DatabaseName,
     * CancellationToken)}.
     *
     * @param connection open connection
     * @param databaseName database name
     * @return files in {@code file_id} order; empty if the database does not exist
     * @throws SQLException on database errors
     */
    public static List<DatabaseFileInfo> getPhysicalFiles(Connection connection,
            DatabaseName databaseName) throws SQLException {
        return getPhysicalFiles(connection, databaseName, CancellationToken.NONE);
    }

    /**
     * Token-less variant of {@link #detach(Connection, DatabaseName, RetryPolicy,
     * CancellationToken)}.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param policy retry policy
     * @return the files of the detached database
     * @throws SQLException the last failure once all attempts are used up
     */
    public static DatabasePhysicalFilesInfo detach(Connection connection,
            DatabaseName databaseName, RetryPolicy policy) throws SQLException {
        return detach(connection, databaseName, policy, CancellationToken.NONE);
    }

    /**
     * Token-less variant of {@link #attach(Connection, DatabaseName, List, CancellationToken)}.
     *
     * @param connection open administrative connection
     * @param databaseName database name
     * @param files database files
     * @throws SQLException on database errors
     */
    public static void attach(Connection connection, DatabaseName databaseName,
            List<DatabaseFileInfo> files) throws SQLException {
        attach(connection, databaseName, files, CancellationToken.NONE);
    }

    /**
     * Builds the {@code CREATE DATABASE ... FOR ATTACH} statement.
     *
     * @param databaseName database name
     * @param files database files
     * @return SQL statement
     */
    static String createAttachStatement(DatabaseName databaseName, List<DatabaseFileInfo> files) {
        StringBuilder sb = new StringBuilder("CREATE DATABASE ")
                .append(databaseName.getIdentifier()).append(" ON\n");
        for (int i = 0; i < files.size(); i++) {
            sb.append("    (FILENAME = N'")
                    .append(files.get(i).getPhysicalFilePath().replace("'", "''")).append("')");
            if (i < files.size() - 1) {
                sb.append(',');
            }
            sb.append('\n');
        }
        return sb.append("FOR ATTACH;").toString();
    }

    private static String dropIfExistsBlock(DatabaseName databaseName) {
        return "IF @DbId IS NOT NULL\n"
                + "    DROP DATABASE " + databaseName.getIdentifier() + ";\n";
    }

    private static void checkArguments(Connection connection, DatabaseName databaseName) {
        Preconditions.checkNotNull(connection, "connection must not be null");
        Preconditions.checkNotNull(databaseName, "databaseName must not be null");
    }

    private static void checkArguments(Connection connection, DatabaseName databaseName,
            RetryPolicy policy, CancellationToken token) {
        checkArguments(connection, databaseName);
        Preconditions.checkNotNull(policy, "policy must not be null");
        Preconditions.checkNotNull(token, "token must not be null");
    }
}
