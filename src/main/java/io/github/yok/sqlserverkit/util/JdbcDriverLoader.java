package io.github.yok.sqlserverkit.util;

import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Loads an explicitly configured JDBC driver class.
 *
 * <p>
 * The Microsoft driver registers itself through JDBC 4 service loading, so a blank
 * {@code driverClass} is the usual configuration. A configured class is loaded with
 * {@link Class#forName(String)} before the first connection is opened.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class JdbcDriverLoader {

    /** Driver class of mssql-jdbc. */
    public static final String SQL_SERVER_DRIVER = "com.microsoft.sqlserver.jdbc.SQLServerDriver";

    @Generated
    private JdbcDriverLoader() {}

    /**
     * Loads the JDBC driver class only when the class name is configured.
     *
     * @param driverClass fully qualified JDBC driver class name, or {@code null}/blank
     * @return {@code true} if a class was loaded
     * @throws ClassNotFoundException when the specified class cannot be found
     */
    public static boolean loadIfConfigured(String driverClass) throws ClassNotFoundException {
        if (StringUtils.isBlank(driverClass)) {
            return false;
        }
        Class.forName(driverClass.trim());
        return true;
    }
}
