package io.github.yok.sqlserverkit.naming;

import lombok.Getter;

/**
 * Thrown when a string is not a valid SQL Server database name.
 *
 * <p>
 * The {@link Reason} tells which rule of the regular identifier syntax was violated.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class InvalidDatabaseNameException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * Violated identifier rule.
     */
    public enum Reason {
        /** The name is {@code null}, empty or consists of white space only. */
        NULL_OR_BLANK,
        /** The trimmed name is longer than {@value DatabaseNameValidator#MAX_LENGTH} characters. */
        TOO_LONG,
        /** The name does not start with a letter or an underscore. */
        INVALID_FIRST_CHARACTER,
        /** The name contains a character other than letters, digits, {@code @ $ # _}. */
        INVALID_CHARACTER
    }

    private final Reason reason;

    /**
     * Constructor.
     *
     * @param reason violated rule
     * @param message detail message
     */
    public InvalidDatabaseNameException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
