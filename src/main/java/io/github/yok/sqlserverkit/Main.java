package io.github.yok.sqlserverkit;

import io.github.yok.sqlserverkit.config.ConnectionConfig;
import io.github.yok.sqlserverkit.config.RetryConfig;
import io.github.yok.sqlserverkit.db.DatabaseAdministrator;
import io.github.yok.sqlserverkit.db.DatabaseFileInfo;
import io.github.yok.sqlserverkit.db.DatabaseFileType;
import io.github.yok.sqlserverkit.db.DatabasePhysicalFilesInfo;
import io.github.yok.sqlserverkit.naming.DatabaseName;
import io.github.yok.sqlserverkit.util.ErrorHandler;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Runs one administrative command against the databases named in the URLs of the connections in
 * {@code application.yml}.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --exists} or {@code -e}: reports whether each database exists (default)</li>
 * <li>{@code --create} or {@code -c}: creates each database unless it exists</li>
 * <li>{@code --drop} or {@code -d}: kills the sessions of each database and drops it</li>
 * <li>{@code --recreate} or {@code -r}: drops each database if it exists and creates it again</li>
 * <li>{@code --detach}: detaches each database and logs its files</li>
 * <li>{@code --attach path1,path2,...}: attaches the given files as the target database; files
 * ending in {@code .ldf} are log files</li>
 * <li>{@code --target [db1,db2,…]} or {@code -t [db1,db2,…]} specifies the target connection ID
 * list. If omitted, all connections are targeted.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 * @see ConnectionConfig
 * @see RetryConfig
 * @see DatabaseAdministratorFactory
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConnectionConfig.class, RetryConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final ConnectionConfig connectionConfig;
    private final DatabaseAdministratorFactory administratorFactory;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
        if (ErrorHandler.hasFailures()) {
            System.exit(ErrorHandler.EXIT_CODE_FAILURE);
        }
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String mode = null;
        List<String> attachPaths = new ArrayList<>();
        List<String> targetDbIds = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--exists":
                case "-e":
                    mode = "exists";
                    break;
                case "--create":
                case "-c":
                    mode = "create";
                    break;
                case "--drop":
                case "-d":
                    mode = "drop";
                    break;
                case "--recreate":
                case "-r":
                    mode = "recreate";
                    break;
                case "--detach":
                    mode = "detach";
                    break;
                case "--attach":
                    mode = "attach";
                    if (i + 1 < args.length) {
                        attachPaths = splitList(args[++i]);
                    }
                    break;
                case "--target":
                case "-t":
                    if (i + 1 < args.length) {
                        targetDbIds = splitList(args[++i]);
                    }
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (mode == null) {
            mode = "exists";
        }
        if ("attach".equals(mode) && attachPaths.isEmpty()) {
            ErrorHandler.errorAndExit("File paths are required in attach mode.");
            return;
        }

        // When --target is not specified, all connections from application.yml are processed
        if (targetDbIds.isEmpty()) {
            targetDbIds = connectionConfig.getConnections().stream()
                    .map(ConnectionConfig.Entry::getId).collect(Collectors.toList());
        }
        log.info("Mode: {}, Target DBs: {}", mode, targetDbIds);

        for (String dbId : targetDbIds) {
            ConnectionConfig.Entry entry = connectionConfig.getEntry(dbId).orElse(null);
            if (entry == null) {
                log.warn("[{}] No connection with this ID in application.yml → skipping", dbId);
                continue;
            }
            try {
                execute(mode, administratorFactory.create(entry), attachPaths);
            } catch (SQLException | RuntimeException e) {
                log.error("Command failed (mode={}, DB={}): {}", mode, dbId, e.getMessage(), e);
                ErrorHandler.errorAndExit("Command '" + mode + "' failed (DB=" + dbId + ")", e);
            }
        }
    }

    private void execute(String mode, DatabaseAdministrator administrator,
            List<String> attachPaths) throws SQLException {
        String dbId = administrator.getConnector().getId();
        switch (mode) {
            case "create":
                log.info("[{}] Created: {}", dbId, administrator.tryCreateDatabase());
                break;
            case "drop":
                log.info("[{}] Dropped: {}", dbId, administrator.tryDropDatabase());
                break;
            case "recreate":
                log.info("[{}] Recreated (previous database dropped: {})", dbId,
                        administrator.dropAndCreateDatabase());
                break;
            case "detach":
                DatabasePhysicalFilesInfo detached = administrator.detachDatabase();
                for (DatabaseFileInfo file : detached.getFiles()) {
                    log.info("[{}] Detached file: {} {}", dbId, file.getType(),
                            file.getPhysicalFilePath());
                }
                break;
            case "attach":
                DatabaseName name = administrator.getConnector().getDatabaseName();
                DatabasePhysicalFilesInfo filesInfo =
                        new DatabasePhysicalFilesInfo(name, toFileInfos(attachPaths));
                DatabaseName attached = administrator.attachDatabase(filesInfo);
                log.info("[{}] Attached database {}", dbId, attached);
                break;
            default:
                log.info("[{}] Exists: {}", dbId, administrator.databaseExists());
        }
    }

    static List<DatabaseFileInfo> toFileInfos(List<String> paths) {
        List<DatabaseFileInfo> files = new ArrayList<>();
        for (String path : paths) {
            String type = path.toLowerCase(Locale.ROOT).endsWith(".ldf") ? DatabaseFileType.LOG
                    : DatabaseFileType.ROWS;
            files.add(new DatabaseFileInfo(type, path));
        }
        return files;
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
