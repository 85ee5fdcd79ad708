package io.github.yok.sqlserverkit.session;

import java.sql.SQLException;

/**
 * Session that changes data inside a transaction. Changes not saved with {@link #saveChanges()}
 * are rolled back when the session is closed.
 *
 * @author Yasuharu.Okawauchi
 */
public interface SqlSession extends ReadOnlySqlSession {

    /**
     * Commits the transaction. Does nothing for sessions without transaction.
     *
     * @throws SQLException on JDBC errors
     */
    void saveChanges() throws SQLException;
}
