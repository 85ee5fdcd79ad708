package io.github.yok.sqlserverkit.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * SQL Server connections loaded from {@code application.yml}.
 *
 * <p>
 * The catalog of each URL ({@code databaseName=...}) names the database the administrative
 * commands act on; the commands themselves run on a connection to the same server without the
 * catalog.
 * </p>
 *
 * <pre>
 * connections:
 *   - id: db1
 *     url: jdbc:sqlserver://localhost:1433;databaseName=TestDb;encrypt=false
 *     user: sa
 *     password: password
 *     driverClass: com.microsoft.sqlserver.jdbc.SQLServerDriver
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class ConnectionConfig {

    /**
     * List of connection entries.
     */
    private List<Entry> connections = new ArrayList<>();

    /**
     * Looks up a connection entry by its logical ID.
     *
     * @param id logical connection ID
     * @return entry, or empty if no entry has the ID
     */
    public Optional<Entry> getEntry(String id) {
        return connections.stream().filter(entry -> Objects.equals(entry.getId(), id))
                .findFirst();
    }

    /**
     * One connection setting.
     */
    @Data
    public static class Entry {
        // Logical ID of the connection (e.g., "db1")
        private String id;
        // JDBC URL including the target catalog
        private String url;
        // Login name
        private String user;
        // Password
        private String password;
        // Optional JDBC driver class name; JDBC 4 auto-loading is used when blank
        private String driverClass;
    }
}
