package io.github.yok.sqlserverkit.db;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import org.apache.commons.lang3.StringUtils;

/**
 * Parsed SQL Server JDBC URL of the form
 * {@code jdbc:sqlserver://[serverName[\instanceName][:portNumber]][;property=value[;...]]}.
 *
 * <p>
 * Only the catalog ({@code databaseName}, alias {@code database}) is interpreted; every other
 * property is kept verbatim and in order. Instances are immutable.
 * </p>
 *
 * <pre>
 * SqlServerConnectionString target = SqlServerConnectionString
 *         .parse("jdbc:sqlserver://localhost:1433;databaseName=MyDb;encrypt=false");
 * target.getDatabaseName();           // Optional[MyDb]
 * target.withoutDatabaseName();       // jdbc:sqlserver://localhost:1433;encrypt=false
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@EqualsAndHashCode
public final class SqlServerConnectionString {

    /** URL prefix of the Microsoft JDBC driver. */
    public static final String PREFIX = "jdbc:sqlserver://";

    /** Name of the administrative database. */
    public static final String MASTER = "master";

    private static final String DATABASE_NAME = "databaseName";
    private static final String DATABASE = "database";

    private final String server;
    private final List<Map.Entry<String, String>> properties;

    private SqlServerConnectionString(String server, List<Map.Entry<String, String>> properties) {
        this.server = server;
        this.properties = properties;
    }

    /**
     * Parses a SQL Server JDBC URL.
     *
     * @param url JDBC URL
     * @return parsed connection string
     * @throws IllegalArgumentException if the URL is blank, not a SQL Server URL, or contains a
     *         property without {@code =}
     */
    public static SqlServerConnectionString parse(String url) {
        Preconditions.checkArgument(StringUtils.isNotBlank(url), "url must not be blank");
        String trimmed = url.trim();
        Preconditions.checkArgument(StringUtils.startsWithIgnoreCase(trimmed, PREFIX),
                "Not a SQL Server JDBC URL (expected prefix %s): %s", PREFIX, url);

        List<String> parts = Splitter.on(';').splitToList(trimmed.substring(PREFIX.length()));
        String server = parts.get(0);
        List<Map.Entry<String, String>> properties = new ArrayList<>();
        for (String part : parts.subList(1, parts.size())) {
            if (part.isBlank()) {
                continue;
            }
            int eq = part.indexOf('=');
            Preconditions.checkArgument(eq > 0, "Malformed property '%s' in URL", part);
            properties.add(Map.entry(part.substring(0, eq).trim(), part.substring(eq + 1)));
        }
        return new SqlServerConnectionString(server, List.copyOf(properties));
    }

    /**
     * Returns the server part ({@code host[\instance][:port]}), may be empty.
     *
     * @return server part
     */
    public String getServer() {
        return server;
    }

    /**
     * Returns the value of a property (case-insensitive key lookup).
     *
     * @param key property name
     * @return value, or empty if the property is absent
     */
    public Optional<String> getProperty(String key) {
        for (Map.Entry<String, String> property : properties) {
            if (property.getKey().equalsIgnoreCase(key)) {
                return Optional.of(property.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the catalog named in the URL.
     *
     * @return the non-blank {@code databaseName} (or {@code database}) value, or empty
     */
    public Optional<String> getDatabaseName() {
        return getProperty(DATABASE_NAME).filter(StringUtils::isNotBlank)
                .or(() -> getProperty(DATABASE).filter(StringUtils::isNotBlank))
                .map(String::trim);
    }

    /**
     * Returns whether the URL names a catalog other than {@code master}.
     *
     * @return {@code true} if a non-administrative catalog is present
     */
    public boolean hasNonAdministrativeDatabaseName() {
        return getDatabaseName().filter(name -> !MASTER.equalsIgnoreCase(name)).isPresent();
    }

    /**
     * Returns a copy pointing to the given catalog.
     *
     * @param databaseName catalog name
     * @return rewritten connection string
     */
    public SqlServerConnectionString withDatabaseName(String databaseName) {
        Preconditions.checkArgument(StringUtils.isNotBlank(databaseName),
                "databaseName must not be blank");
        List<Map.Entry<String, String>> rewritten = withoutCatalogProperties();
        rewritten.add(Map.entry(DATABASE_NAME, databaseName.trim()));
        return new SqlServerConnectionString(server, List.copyOf(rewritten));
    }

    /**
     * Returns a copy without catalog, i.e. a connection to the login's default database. This is
     * the connection used for administrative statements such as {@code CREATE DATABASE}.
     *
     * @return administrative connection string
     */
    public SqlServerConnectionString withoutDatabaseName() {
        return new SqlServerConnectionString(server, List.copyOf(withoutCatalogProperties()));
    }

    private List<Map.Entry<String, String>> withoutCatalogProperties() {
        List<Map.Entry<String, String>> result = new ArrayList<>();
        for (Map.Entry<String, String> property : properties) {
            String key = property.getKey().toLowerCase(Locale.ROOT);
            if (key.equals(DATABASE_NAME.toLowerCase(Locale.ROOT)) || key.equals(DATABASE)) {
                continue;
            }
            result.add(property);
        }
        return result;
    }

    /**
     * Renders the JDBC URL.
     *
     * @return JDBC URL
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(PREFIX).append(server);
        for (Map.Entry<String, String> property : properties) {
            sb.append(';').append(property.getKey()).append('=').append(property.getValue());
        }
        return sb.toString();
    }
}
