package com.backupcenter.server.service.dump;

import com.backupcenter.server.enums.DumpFormatEnum;
import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.model.dump.CommandExecResult;
import com.backupcenter.server.model.entity.DatabaseBackupTaskEntity;
import com.backupcenter.server.service.command.ExternalCommandRunner;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.exec.CommandLine;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Builds and runs pg_dump, pg_restore and psql. The password only ever travels in the PGPASSWORD
 * environment entry of the child process.
 */
@Slf4j
@Service
public class PgDumpService {

    public static final String PASSWORD_ENV = "PGPASSWORD";

    public static final int DEFAULT_COMPRESSION_LEVEL = 6;

    private final ExternalCommandRunner commandRunner;

    @Value("${backupcenter.server.dump.dumpBinary:pg_dump}")
    private String dumpBinary;

    @Value("${backupcenter.server.dump.restoreBinary:pg_restore}")
    private String restoreBinary;

    @Value("${backupcenter.server.dump.psqlBinary:psql}")
    private String psqlBinary;

    @Value("${backupcenter.server.dump.timeoutSec:21600}")
    private long timeoutSec;

    @Autowired
    public PgDumpService(ExternalCommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    public CommandExecResult dump(
            DatabaseBackupTaskEntity task,
            DumpFormatEnum format,
            String password,
            Path outputFile) throws ValidationException {
        CommandLine commandLine = this.buildDumpCommand(task, format, outputFile);
        log.info("pg_dump database {} on {}:{}", task.getDatabaseName(), task.getHost(), task.getPort());
        return this.commandRunner.execute(commandLine, passwordEnv(password), Duration.ofSeconds(this.timeoutSec));
    }

    public CommandExecResult restore(
            DatabaseBackupTaskEntity task,
            String targetDatabase,
            String password,
            Path artifactFile) throws ValidationException {
        CommandLine commandLine = this.buildRestoreCommand(task, targetDatabase, artifactFile);
        log.info("restore database {} on {}:{} from {}",
                targetDatabase, task.getHost(), task.getPort(), artifactFile.getFileName());
        return this.commandRunner.execute(commandLine, passwordEnv(password), Duration.ofSeconds(this.timeoutSec));
    }

    public CommandLine buildDumpCommand(
            DatabaseBackupTaskEntity task,
            DumpFormatEnum format,
            Path outputFile) throws ValidationException {
        checkConnection(task);
        if (ObjectUtils.anyNull(format, outputFile)) {
            throw new ValidationException("buildDumpCommand failed. format or outputFile is null");
        }
        CommandLine commandLine =
                new CommandLine(StringUtils.defaultIfBlank(this.dumpBinary, "pg_dump"));
        addConnectionArguments(commandLine, task, task.getDatabaseName());
        commandLine.addArgument("--format=" + format.getName());
        commandLine.addArgument("--file=" + outputFile.toAbsolutePath(), false);
        // 1. 压缩级别只对 custom 生效
        if (format == DumpFormatEnum.CUSTOM) {
            int level = ObjectUtils.defaultIfNull(task.getCompressionLevel(), DEFAULT_COMPRESSION_LEVEL);
            commandLine.addArgument("--compress=" + Math.max(0, Math.min(9, level)));
        }
        // 2. 角色和表空间
        if (format == DumpFormatEnum.PLAIN || Boolean.FALSE.equals(task.getIncludeRoles())) {
            commandLine.addArgument("--no-owner");
            commandLine.addArgument("--no-privileges");
        }
        if (Boolean.FALSE.equals(task.getIncludeTablespaces())) {
            commandLine.addArgument("--no-tablespaces");
        }
        // 3. schema 和 data 都关闭时等同于都包含
        boolean includeSchema = !Boolean.FALSE.equals(task.getIncludeSchema());
        boolean includeData = !Boolean.FALSE.equals(task.getIncludeData());
        if (!includeSchema && includeData) {
            commandLine.addArgument("--data-only");
        } else if (includeSchema && !includeData) {
            commandLine.addArgument("--schema-only");
        }
        return commandLine;
    }

    public CommandLine buildRestoreCommand(
            DatabaseBackupTaskEntity task,
            String targetDatabase,
            Path artifactFile) throws ValidationException {
        checkConnection(task);
        if (StringUtils.isBlank(targetDatabase) || ObjectUtils.isEmpty(artifactFile)) {
            throw new ValidationException("buildRestoreCommand failed. targetDatabase or artifactFile is empty");
        }
        CommandLine commandLine;
        if (DumpFormatEnum.isArchiveFile(artifactFile.getFileName().toString())) {
            commandLine = new CommandLine(
                    StringUtils.defaultIfBlank(this.restoreBinary, "pg_restore"));
            addConnectionArguments(commandLine, task, targetDatabase);
            commandLine.addArgument("--clean");
            commandLine.addArgument("--if-exists");
            commandLine.addArgument(artifactFile.toAbsolutePath().toString(), false);
        } else {
            commandLine = new CommandLine(
                    StringUtils.defaultIfBlank(this.psqlBinary, "psql"));
            addConnectionArguments(commandLine, task, targetDatabase);
            commandLine.addArgument("--file=" + artifactFile.toAbsolutePath(), false);
        }
        return commandLine;
    }

    private static void addConnectionArguments(
            CommandLine commandLine,
            DatabaseBackupTaskEntity task,
            String database) {
        commandLine.addArgument("--host=" + task.getHost(), false);
        commandLine.addArgument("--port=" + ObjectUtils.defaultIfNull(task.getPort(), 5432));
        commandLine.addArgument("--username=" + task.getUsername(), false);
        commandLine.addArgument("--dbname=" + database, false);
    }

    private static void checkConnection(DatabaseBackupTaskEntity task) throws ValidationException {
        if (ObjectUtils.isEmpty(task)) {
            throw new ValidationException("database task is null");
        }
        if (StringUtils.isAnyBlank(task.getHost(), task.getUsername(), task.getDatabaseName())) {
            throw new ValidationException("host, username or databaseName is blank. task is %s".formatted(task));
        }
    }

    private static Map<String, String> passwordEnv(String password) {
        return password == null ? Map.of() : Map.of(PASSWORD_ENV, password);
    }
}
