package io.github.yok.sqlserverkit.naming;

import java.util.Locale;
import lombok.Getter;

/**
 * A string value that is a valid SQL Server database name.
 *
 * <p>
 * Instances are created by {@link DatabaseNameValidator#normalize(String)} (or {@link #of(String)})
 * and are immutable. Two names are equal when they differ only in case, matching the
 * case-insensitive collation SQL Server uses for database names.
 * </p>
 *
 * <ul>
 * <li>{@link #getName()} / {@link #toString()}: the trimmed name, safe to embed in a string literal
 * such as {@code DB_ID(N'name')}</li>
 * <li>{@link #getIdentifier()}: the name to embed in DDL, escaped with brackets when it collides
 * with a reserved keyword</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class DatabaseName {

    // Trimmed name
    private final String name;

    // Name as it appears in DDL (bracket-escaped for reserved keywords)
    private final String identifier;

    DatabaseName(String name, String identifier) {
        this.name = name;
        this.identifier = identifier;
    }

    /**
     * Validates the given string with the default validator.
     *
     * @param rawName raw database name
     * @return database name
     * @throws InvalidDatabaseNameException if the name is invalid
     */
    public static DatabaseName of(String rawName) {
        return DatabaseNameValidator.getDefault().normalize(rawName);
    }

    /**
     * Returns whether the identifier form differs from the plain name.
     *
     * @return {@code true} if the name is escaped with brackets in DDL
     */
    public boolean requiresEscaping() {
        return !name.equals(identifier);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DatabaseName)) {
            return false;
        }
        return comparisonKey().equals(((DatabaseName) other).comparisonKey());
    }

    @Override
    public int hashCode() {
        return comparisonKey().hashCode();
    }

    /**
     * Returns the trimmed database name.
     *
     * @return database name
     */
    @Override
    public String toString() {
        return name;
    }

    private String comparisonKey() {
        return name.toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT);
    }
}
