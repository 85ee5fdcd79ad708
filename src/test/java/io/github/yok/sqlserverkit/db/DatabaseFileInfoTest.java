package io.github.yok.sqlserverkit.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.sqlserverkit.naming.DatabaseName;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link DatabaseFileInfo} and {@link DatabasePhysicalFilesInfo}.
 */
class DatabaseFileInfoTest {

    @Test
    void コンストラクタ_異常ケース_空白の種別またはパスを指定する_例外が送出されること() {
        assertThrows(IllegalArgumentException.class, () -> new DatabaseFileInfo(" ", "C:\\a.mdf"));
        assertThrows(IllegalArgumentException.class, () -> new DatabaseFileInfo("ROWS", ""));
        assertThrows(NullPointerException.class, () -> new DatabaseFileInfo(null, "C:\\a.mdf"));
    }

    @Test
    void withPhysicalFilePath_正常ケース_新しいパスを指定する_種別を保ったまま移動されること() {
        DatabaseFileInfo file = new DatabaseFileInfo(DatabaseFileType.LOG, "/old/db_log.ldf");
        DatabaseFileInfo moved = file.withPhysicalFilePath("/new/db_log.ldf");
        assertEquals(DatabaseFileType.LOG, moved.getType());
        assertEquals("/new/db_log.ldf", moved.getPhysicalFilePath());
        assertEquals("/old/db_log.ldf", file.getPhysicalFilePath());
    }

    @Test
    void DatabasePhysicalFilesInfo_異常ケース_空のファイル一覧を指定する_IllegalArgumentExceptionが送出されること() {
        DatabaseName name = DatabaseName.of("MyDb");
        assertThrows(IllegalArgumentException.class,
                () -> new DatabasePhysicalFilesInfo(name, List.of()));
        assertThrows(NullPointerException.class,
                () -> new DatabasePhysicalFilesInfo(null, List.of(
                        new DatabaseFileInfo(DatabaseFileType.ROWS, "/data/MyDb.mdf"))));
    }

    @Test
    void relocate_正常ケース_パス変換関数を指定する_順序を保ってパスが置き換えられること() {
        DatabasePhysicalFilesInfo info = new DatabasePhysicalFilesInfo(DatabaseName.of("MyDb"),
                List.of(new DatabaseFileInfo(DatabaseFileType.ROWS, "/data/MyDb.mdf"),
                        new DatabaseFileInfo(DatabaseFileType.LOG, "/data/MyDb_log.ldf")));

        DatabasePhysicalFilesInfo relocated =
                info.relocate(file -> file.getPhysicalFilePath().replace("/data/", "/backup/"));

        assertEquals(DatabaseName.of("MyDb"), relocated.getDatabaseName());
        assertEquals(2, relocated.getFiles().size());
        assertEquals("/backup/MyDb.mdf", relocated.getFiles().get(0).getPhysicalFilePath());
        assertEquals(DatabaseFileType.LOG, relocated.getFiles().get(1).getType());
        assertEquals("/backup/MyDb_log.ldf", relocated.getFiles().get(1).getPhysicalFilePath());
    }
}
