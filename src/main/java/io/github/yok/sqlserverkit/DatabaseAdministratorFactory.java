package io.github.yok.sqlserverkit;

import io.github.yok.sqlserverkit.config.ConnectionConfig;
import io.github.yok.sqlserverkit.config.RetryConfig;
import io.github.yok.sqlserverkit.db.DatabaseAdministrator;
import io.github.yok.sqlserverkit.db.DatabaseConnector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Creates a {@link DatabaseAdministrator} per configured connection, using the retry settings of
 * {@link RetryConfig}.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseAdministratorFactory {

    // retry.retry-count / retry.interval
    private final RetryConfig retryConfig;

    /**
     * Creates an administrator for the connection entry.
     *
     * @param entry connection information (ID, URL, user, password)
     * @return administrator of the database named in the entry's URL
     * @throws IllegalStateException if the entry or the retry settings are invalid
     */
    public DatabaseAdministrator create(ConnectionConfig.Entry entry) {
        try {
            return new DatabaseAdministrator(new DatabaseConnector(entry), retryConfig.toPolicy());
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration for connection id={}", entry.getId(), e);
            throw new IllegalStateException(e.getMessage(), e);
        }
    }
}
