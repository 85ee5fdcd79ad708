package io.github.yok.sqlserverkit.naming;

import com.google.common.base.Preconditions;
import io.github.yok.sqlserverkit.naming.InvalidDatabaseNameException.Reason;

/**
 * Validates and normalizes SQL Server database names.
 *
 * <p>
 * The rules follow the SQL Server syntax for regular identifiers:
 * </p>
 * <ul>
 * <li>leading and trailing white space is removed</li>
 * <li>the trimmed name has 1 to {@value #MAX_LENGTH} characters</li>
 * <li>the first character is a letter or an underscore {@code _}</li>
 * <li>the following characters are letters, digits, {@code @}, {@code $}, {@code #} or
 * {@code _}</li>
 * </ul>
 *
 * <p>
 * Names that collide with a reserved keyword are escaped with brackets, e.g. {@code Update} becomes
 * {@code [Update]}. Because quotes and white space are rejected, a validated name can be embedded
 * in string literals ({@code DB_ID(N'...')}) and DDL statements without further escaping.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class DatabaseNameValidator {

    /** Maximum length of a database name after trimming. */
    public static final int MAX_LENGTH = 123;

    private final SqlKeywords keywords;

    /**
     * Constructor.
     *
     * @param keywords reserved keyword table used to decide whether a name must be escaped
     */
    public DatabaseNameValidator(SqlKeywords keywords) {
        this.keywords = Preconditions.checkNotNull(keywords, "keywords must not be null");
    }

    /**
     * Returns the validator backed by the bundled keyword table.
     *
     * @return default validator
     */
    public static DatabaseNameValidator getDefault() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * Checks and normalizes the given database name.
     *
     * @param rawName raw database name
     * @return validated database name
     * @throws InvalidDatabaseNameException if the name violates the identifier rules
     */
    public DatabaseName normalize(String rawName) {
        if (rawName == null || rawName.isEmpty()) {
            throw new InvalidDatabaseNameException(Reason.NULL_OR_BLANK,
                    "The database name must not be null or empty.");
        }

        String name = trim(rawName);
        if (name.isEmpty()) {
            throw new InvalidDatabaseNameException(Reason.NULL_OR_BLANK,
                    "The database name must not consist of white space only.");
        }
        if (name.length() > MAX_LENGTH) {
            throw new InvalidDatabaseNameException(Reason.TOO_LONG,
                    "The specified database name \"" + name
                            + "\" is too long. The maximum length is restricted to " + MAX_LENGTH
                            + " characters.");
        }
        if (!isValidFirstCharacter(name.charAt(0))) {
            throw new InvalidDatabaseNameException(Reason.INVALID_FIRST_CHARACTER,
                    "The specified database name \"" + name
                            + "\" does not start with a letter or an underscore '_'.");
        }
        for (int i = 1; i < name.length(); i++) {
            if (!isValidSubsequentCharacter(name.charAt(i))) {
                throw new InvalidDatabaseNameException(Reason.INVALID_CHARACTER,
                        "The specified database name \"" + name
                                + "\" contains invalid characters. It must start with a letter or "
                                + "an underscore '_', and continue with letters, digits, or the "
                                + "signs '@', '$', '#', or the underscore '_'.");
            }
        }

        String identifier = keywords.isKeyword(name) ? padWithBrackets(name) : name;
        return new DatabaseName(name, identifier);
    }

    /**
     * Checks whether the character may start a database name.
     *
     * @param character character to check
     * @return {@code true} for letters and {@code _}
     */
    public static boolean isValidFirstCharacter(char character) {
        return Character.isLetter(character) || character == '_';
    }

    /**
     * Checks whether the character may appear after the first position of a database name.
     *
     * @param character character to check
     * @return {@code true} for letters, digits, {@code @}, {@code $}, {@code #} and {@code _}
     */
    public static boolean isValidSubsequentCharacter(char character) {
        switch (character) {
            case '@':
            case '$':
            case '#':
            case '_':
                return true;
            default:
                return Character.isLetterOrDigit(character);
        }
    }

    /**
     * Wraps the identifier in brackets, e.g. {@code foo} becomes {@code [foo]}.
     *
     * @param identifier identifier to escape
     * @return escaped identifier
     * @throws IllegalArgumentException if {@code identifier} is {@code null} or empty
     */
    public static String padWithBrackets(String identifier) {
        Preconditions.checkArgument(identifier != null && !identifier.isEmpty(),
                "identifier must not be null or empty");
        return "[" + identifier + "]";
    }

    private static String trim(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isSpace(value.charAt(start))) {
            start++;
        }
        while (end > start && isSpace(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    // isSpaceChar also covers the no-break spaces U+00A0, U+2007 and U+202F
    private static boolean isSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private static final class DefaultHolder {
        static final DatabaseNameValidator INSTANCE =
                new DatabaseNameValidator(SqlKeywords.loadDefault());
    }
}
