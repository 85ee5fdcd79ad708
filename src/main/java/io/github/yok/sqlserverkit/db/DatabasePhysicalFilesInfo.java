package io.github.yok.sqlserverkit.db;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.sqlserverkit.naming.DatabaseName;
import java.util.List;
import java.util.function.Function;
import lombok.Value;

/**
 * The physical layout of a database: its name and all files backing it.
 *
 * <p>
 * Produced by {@link DatabaseAdministration#detach} and consumed by
 * {@link DatabaseAdministration#attach}, possibly after the caller moved the files and called
 * {@link #relocate(Function)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class DatabasePhysicalFilesInfo {

    DatabaseName databaseName;

    ImmutableList<DatabaseFileInfo> files;

    /**
     * Constructor.
     *
     * @param databaseName database name
     * @param files files in {@code file_id} order; must not be empty
     * @throws NullPointerException if an argument or a file entry is {@code null}
     * @throws IllegalArgumentException if {@code files} is empty
     */
    public DatabasePhysicalFilesInfo(DatabaseName databaseName, List<DatabaseFileInfo> files) {
        this.databaseName =
                Preconditions.checkNotNull(databaseName, "databaseName must not be null");
        Preconditions.checkNotNull(files, "files must not be null");
        Preconditions.checkArgument(!files.isEmpty(),
                "The database \"%s\" must have at least one file.", databaseName);
        this.files = ImmutableList.copyOf(files);
    }

    /**
     * Returns a copy whose file paths are mapped to new locations.
     *
     * @param newPathResolver function returning the new absolute path for each file
     * @return relocated layout
     */
    public DatabasePhysicalFilesInfo relocate(Function<DatabaseFileInfo, String> newPathResolver) {
        Preconditions.checkNotNull(newPathResolver, "newPathResolver must not be null");
        ImmutableList.Builder<DatabaseFileInfo> relocated = ImmutableList.builder();
        for (DatabaseFileInfo file : files) {
            relocated.add(file.withPhysicalFilePath(newPathResolver.apply(file)));
        }
        return new DatabasePhysicalFilesInfo(databaseName, relocated.build());
    }
}
