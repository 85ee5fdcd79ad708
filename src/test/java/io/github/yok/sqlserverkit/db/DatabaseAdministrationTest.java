package io.github.yok.sqlserverkit.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import io.github.yok.sqlserverkit.naming.DatabaseName;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link DatabaseAdministration}.
 *
 * <p>
 * The JDBC objects are mocks; every SQL text sent to {@link Statement#execute(String)} is
 * recorded in {@link #executed}.
 * </p>
 */
class DatabaseAdministrationTest {

    private static final RetryPolicy FAST_RETRY = RetryPolicy.of(2, 1);

    private Connection connection;
    private Statement statement;
    private ResultSet resultSet;
    private final List<String> executed = new ArrayList<>();

    // Value returned by the first result set of a scalar batch
    private Object scalarValue;

    // Rows of sys.master_files: {type_desc, physical_name}
    private List<String[]> fileRows = new ArrayList<>();

    @BeforeEach
    void setup() throws Exception {
        connection = mock(Connection.class);
        statement = mock(Statement.class);
        resultSet = mock(ResultSet.class);
        when(connection.createStatement()).thenReturn(statement);

        when(statement.execute(anyString())).thenAnswer(invocation -> {
            String sql = invocation.getArgument(0);
            executed.add(sql);
            return sql.contains("SELECT");
        });
        when(statement.getUpdateCount()).thenReturn(-1);
        when(statement.getMoreResults()).thenReturn(false);
        when(statement.getResultSet()).thenReturn(resultSet);
    }

    private void givenScalar(Object value) throws SQLException {
        scalarValue = value;
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getObject(1)).thenAnswer(invocation -> scalarValue);
    }

    private void givenFiles(String[]... rows) throws SQLException {
        fileRows = List.of(rows);
        int[] cursor = {-1};
        when(resultSet.next()).thenAnswer(invocation -> ++cursor[0] < fileRows.size());
        when(resultSet.getString(1)).thenAnswer(invocation -> fileRows.get(cursor[0])[0]);
        when(resultSet.getString(2)).thenAnswer(invocation -> fileRows.get(cursor[0])[1]);
    }

    @Test
    void exists_正常ケース_DB_IDが値を返す_trueが返ること() throws Exception {
        givenScalar(5);

        assertTrue(DatabaseAdministration.exists(connection, DatabaseName.of("MyDb")));
        assertEquals("SELECT DB_ID(N'MyDb');", executed.get(0));
    }

    @Test
    void exists_正常ケース_DB_IDがNULLを返す_falseが返ること() throws Exception {
        givenScalar(null);

        assertFalse(DatabaseAdministration.exists(connection, DatabaseName.of("MyDb")));
    }

    @Test
    void exists_異常ケース_名前にnullを指定する_入出力前にNullPointerExceptionが送出されること() {
        assertThrows(NullPointerException.class,
                () -> DatabaseAdministration.exists(connection, null));
        verifyNoInteractions(connection);
    }

    @Test
    void killAllConnections_正常ケース_ユーザーセッションをkillするバッチが実行されること() throws Exception {
        DatabaseAdministration.killAllConnections(connection, DatabaseName.of("MyDb"));

        String sql = executed.get(0);
        assertTrue(sql.contains("sys.dm_exec_sessions"), sql);
        assertTrue(sql.contains("DB_ID(N'MyDb')"), sql);
        assertTrue(sql.contains("is_user_process = 1"), sql);
        assertTrue(sql.contains("EXEC(@kill)"), sql);
    }

    @Test
    void setSingleUser_正常ケース_予約語の名前を指定する_エスケープされた識別子で実行されること()
            throws Exception {
        DatabaseAdministration.setSingleUser(connection, DatabaseName.of("Table"));

        assertEquals("ALTER DATABASE [Table] SET SINGLE_USER WITH ROLLBACK IMMEDIATE;",
                executed.get(0));
    }

    @Test
    void tryCreate_正常ケース_存在しないDB_作成されてtrueが返ること() throws Exception {
        givenScalar(null);

        assertTrue(DatabaseAdministration.tryCreate(connection, DatabaseName.of("Update"),
                FAST_RETRY));

        String sql = executed.get(0);
        assertTrue(sql.contains("SELECT @DbId = DB_ID(N'Update');"), sql);
        assertTrue(sql.contains("IF @DbId IS NULL"), sql);
        assertTrue(sql.contains("CREATE DATABASE [Update];"), sql);
    }

    @Test
    void tryCreate_正常ケース_既存のDB_falseが返ること() throws Exception {
        givenScalar(9);

        assertFalse(DatabaseAdministration.tryCreate(connection, DatabaseName.of("MyDb"),
                FAST_RETRY));
    }

    @Test
    void tryDrop_正常ケース_存在するDB_セッションをkillしてから削除されtrueが返ること() throws Exception {
        givenScalar(9);

        assertTrue(DatabaseAdministration.tryDrop(connection, DatabaseName.of("MyDb"),
                FAST_RETRY));

        assertEquals(2, executed.size());
        assertTrue(executed.get(0).contains("EXEC(@kill)"), executed.get(0));
        String sql = executed.get(1);
        assertTrue(sql.contains("IF @DbId IS NOT NULL"), sql);
        assertTrue(sql.contains("DROP DATABASE MyDb;"), sql);
        assertFalse(sql.contains("SINGLE_USER"), sql);
        assertFalse(sql.contains("CREATE DATABASE"), sql);
    }

    @Test
    void tryDrop_異常ケース_削除が一度失敗する_再試行の前にもセッションがkillされること() throws Exception {
        givenScalar(9);
        SQLException inUse = new SQLException("Cannot drop database \"MyDb\" because it is "
                + "currently in use.");
        int[] dropAttempts = {0};
        when(statement.execute(anyString())).thenAnswer(invocation -> {
            String sql = invocation.getArgument(0);
            executed.add(sql);
            if (sql.contains("DROP DATABASE") && dropAttempts[0]++ == 0) {
                throw inUse;
            }
            return sql.contains("SELECT");
        });

        assertTrue(DatabaseAdministration.tryDrop(connection, DatabaseName.of("MyDb"),
                FAST_RETRY));

        assertEquals(4, executed.size());
        assertTrue(executed.get(0).contains("EXEC(@kill)"), executed.get(0));
        assertTrue(executed.get(1).contains("DROP DATABASE MyDb;"), executed.get(1));
        assertTrue(executed.get(2).contains("EXEC(@kill)"), executed.get(2));
        assertTrue(executed.get(3).contains("DROP DATABASE MyDb;"), executed.get(3));
    }

    @Test
    void tryDrop_正常ケース_存在しないDB_falseが返ること() throws Exception {
        givenScalar(null);

        assertFalse(DatabaseAdministration.tryDrop(connection, DatabaseName.of("MyDb"),
                FAST_RETRY));
    }

    @Test
    void dropAndCreate_正常ケース_存在するDB_削除後に作成されtrueが返ること() throws Exception {
        givenScalar(9);

        assertTrue(DatabaseAdministration.dropAndCreate(connection, DatabaseName.of("MyDb"),
                FAST_RETRY));

        assertTrue(executed.get(0).contains("EXEC(@kill)"), executed.get(0));
        String sql = executed.get(1);
        assertFalse(sql.contains("SINGLE_USER"), sql);
        assertTrue(sql.indexOf("DROP DATABASE MyDb;") < sql.indexOf("CREATE DATABASE MyDb;"),
                sql);
    }

    @Test
    void dropAndCreate_正常ケース_存在しないDB_作成されfalseが返ること() throws Exception {
        givenScalar(null);

        assertFalse(DatabaseAdministration.dropAndCreate(connection, DatabaseName.of("MyDb"),
                FAST_RETRY));
    }

    @Test
    void tryCreate_異常ケース_常に失敗する_リトライ後に元の例外が送出され監視関数が毎回呼ばれること()
            throws Exception {
        SQLException failure = new SQLException("Database 'MyDb' is in use.");
        when(statement.execute(anyString())).thenAnswer(invocation -> {
            executed.add(invocation.getArgument(0));
            throw failure;
        });
        List<SQLException> observed = new ArrayList<>();
        RetryPolicy policy = FAST_RETRY.withExceptionObserver(observed::add);

        SQLException ex = assertThrows(SQLException.class, () -> DatabaseAdministration
                .tryCreate(connection, DatabaseName.of("MyDb"), policy));

        assertSame(failure, ex);
        assertEquals(3, executed.size());
        assertEquals(3, observed.size());
    }

    @Test
    void getPhysicalFilesInfo_正常ケース_ファイルがある_file_id順の一覧が返ること() throws Exception {
        givenFiles(new String[] {"ROWS", "/var/opt/mssql/data/MyDb.mdf"},
                new String[] {"LOG", "/var/opt/mssql/data/MyDb_log.ldf"});

        DatabasePhysicalFilesInfo info =
                DatabaseAdministration.getPhysicalFilesInfo(connection, DatabaseName.of("MyDb"));

        assertEquals(DatabaseName.of("MyDb"), info.getDatabaseName());
        assertEquals(2, info.getFiles().size());
        assertEquals(DatabaseFileType.ROWS, info.getFiles().get(0).getType());
        assertEquals("/var/opt/mssql/data/MyDb_log.ldf",
                info.getFiles().get(1).getPhysicalFilePath());
        assertTrue(executed.get(0).contains("ORDER BY file_id"), executed.get(0));
    }

    @Test
    void detach_正常ケース_存在するDB_ファイル一覧取得後にシングルユーザー化してデタッチされること()
            throws Exception {
        givenFiles(new String[] {"ROWS", "/data/MyDb.mdf"},
                new String[] {"LOG", "/data/MyDb_log.ldf"});

        DatabasePhysicalFilesInfo info =
                DatabaseAdministration.detach(connection, DatabaseName.of("MyDb"), FAST_RETRY);

        assertEquals(2, info.getFiles().size());
        assertEquals(3, executed.size());
        assertTrue(executed.get(0).contains("sys.master_files"));
        assertTrue(executed.get(1).contains("SET SINGLE_USER WITH ROLLBACK IMMEDIATE"));
        assertEquals("EXEC sp_detach_db @dbname = N'MyDb', @skipchecks = 'true';",
                executed.get(2));
    }

    @Test
    void detach_異常ケース_存在しないDB_IllegalStateExceptionが送出され破壊的な文が実行されないこと()
            throws Exception {
        givenFiles();

        assertThrows(IllegalStateException.class,
                () -> DatabaseAdministration.detach(connection, DatabaseName.of("MyDb"),
                        FAST_RETRY));

        assertEquals(1, executed.size());
    }

    @Test
    void attach_正常ケース_複数ファイルを指定する_FOR_ATTACH文が実行されること() throws Exception {
        List<DatabaseFileInfo> files =
                List.of(new DatabaseFileInfo(DatabaseFileType.ROWS, "/data/MyDb.mdf"),
                        new DatabaseFileInfo(DatabaseFileType.LOG, "/data/MyDb_log.ldf"));

        DatabaseAdministration.attach(connection, DatabaseName.of("MyDb"), files);

        assertEquals("CREATE DATABASE MyDb ON\n"
                + "    (FILENAME = N'/data/MyDb.mdf'),\n"
                + "    (FILENAME = N'/data/MyDb_log.ldf')\n"
                + "FOR ATTACH;", executed.get(0));
    }

    @Test
    void createAttachStatement_正常ケース_パスに引用符を含む_引用符が二重化されること() {
        String sql = DatabaseAdministration.createAttachStatement(DatabaseName.of("Order"),
                List.of(new DatabaseFileInfo(DatabaseFileType.ROWS, "C:\\O'Brien\\db.mdf")));

        assertEquals("CREATE DATABASE [Order] ON\n"
                + "    (FILENAME = N'C:\\O''Brien\\db.mdf')\n"
                + "FOR ATTACH;", sql);
    }

    @Test
    void attach_異常ケース_空のファイル一覧を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> DatabaseAdministration.attach(connection, DatabaseName.of("MyDb"),
                        List.of()));
        verifyNoInteractions(connection);
    }
}
