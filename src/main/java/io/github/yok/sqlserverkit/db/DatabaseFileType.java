package io.github.yok.sqlserverkit.db;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * File type descriptions as reported by {@code sys.master_files.type_desc}.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class DatabaseFileType {

    /** Data file (mdf/ndf). */
    public static final String ROWS = "ROWS";

    /** Transaction log file (ldf). */
    public static final String LOG = "LOG";

    /** FILESTREAM data container. */
    public static final String FILESTREAM = "FILESTREAM";

    /** Full-text catalog (SQL Server 2005 and earlier). */
    public static final String FULLTEXT = "FULLTEXT";
}
