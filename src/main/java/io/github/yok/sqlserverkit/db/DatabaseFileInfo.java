package io.github.yok.sqlserverkit.db;

import lombok.Value;
import org.apache.commons.lang3.Validate;

/**
 * One physical file that belongs to a database.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class DatabaseFileInfo {

    // File type, see DatabaseFileType
    String type;

    // Absolute path of the file on the database server
    String physicalFilePath;

    /**
     * Constructor.
     *
     * @param type file type description (e.g. {@link DatabaseFileType#ROWS})
     * @param physicalFilePath absolute file path
     * @throws NullPointerException if an argument is {@code null}
     * @throws IllegalArgumentException if an argument is blank
     */
    public DatabaseFileInfo(String type, String physicalFilePath) {
        this.type = Validate.notBlank(type, "type must not be blank");
        this.physicalFilePath =
                Validate.notBlank(physicalFilePath, "physicalFilePath must not be blank");
    }

    /**
     * Returns a copy of this file info pointing to another location.
     *
     * @param newPhysicalFilePath new absolute file path
     * @return relocated file info
     */
    public DatabaseFileInfo withPhysicalFilePath(String newPhysicalFilePath) {
        return new DatabaseFileInfo(type, newPhysicalFilePath);
    }
}
