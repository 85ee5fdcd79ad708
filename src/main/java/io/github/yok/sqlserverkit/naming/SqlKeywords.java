package io.github.yok.sqlserverkit.naming;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Immutable lookup table of SQL Server reserved keywords.
 *
 * <p>
 * The table contains the reserved keywords of SQL Server (T-SQL), the ODBC reserved keywords and
 * the ISO SQL reserved words. An identifier that matches one of these entries must be escaped with
 * brackets before it can be used in a DDL statement.
 * </p>
 *
 * <p>
 * Lookups are case-insensitive. Instances are thread-safe and meant to be built once and shared
 * (see {@link #loadDefault()}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class SqlKeywords {

    /** Classpath location of the bundled keyword list. */
    static final String DEFAULT_RESOURCE = "/io/github/yok/sqlserverkit/naming/sql-keywords.txt";

    private final ImmutableSet<String> keywords;

    /**
     * Creates a lookup table from the given keywords.
     *
     * @param keywords reserved keywords (blank entries are ignored)
     * @throws NullPointerException if {@code keywords} is {@code null}
     */
    public SqlKeywords(Collection<String> keywords) {
        Preconditions.checkNotNull(keywords, "keywords must not be null");
        ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        for (String keyword : keywords) {
            if (StringUtils.isNotBlank(keyword)) {
                builder.add(normalize(keyword));
            }
        }
        this.keywords = builder.build();
    }

    /**
     * Returns the bundled keyword table. The table is read from the classpath on first use and
     * shared afterwards.
     *
     * @return default keyword table
     */
    public static SqlKeywords loadDefault() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * Reads a keyword table from a classpath resource. The resource holds one keyword per line;
     * empty lines and lines starting with {@code #} are skipped.
     *
     * @param resource absolute classpath resource name
     * @return keyword table
     * @throws IllegalArgumentException if the resource does not exist
     * @throws UncheckedIOException if the resource cannot be read
     */
    public static SqlKeywords fromResource(String resource) {
        InputStream in = SqlKeywords.class.getResourceAsStream(resource);
        Preconditions.checkArgument(in != null, "Keyword resource not found: %s", resource);

        ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        try (BufferedReader reader =
                new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                builder.add(trimmed);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read keyword resource: " + resource, e);
        }
        SqlKeywords result = new SqlKeywords(builder.build());
        log.debug("Loaded {} SQL keywords from {}", result.size(), resource);
        return result;
    }

    /**
     * Checks whether the identifier is a reserved keyword (case-insensitive).
     *
     * @param identifier identifier to check
     * @return {@code true} if the identifier is a reserved keyword
     */
    public boolean isKeyword(String identifier) {
        if (identifier == null) {
            return false;
        }
        return keywords.contains(normalize(identifier));
    }

    /**
     * Returns the number of keywords in this table.
     *
     * @return keyword count
     */
    public int size() {
        return keywords.size();
    }

    private static String normalize(String keyword) {
        return keyword.trim().toUpperCase(Locale.ROOT);
    }

    private static final class DefaultHolder {
        static final SqlKeywords INSTANCE = fromResource(DEFAULT_RESOURCE);
    }
}
