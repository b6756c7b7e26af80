package com.backupcenter.server.service.dump;

import com.backupcenter.server.enums.DumpFormatEnum;
import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.model.dump.CommandExecResult;
import com.backupcenter.server.model.entity.DatabaseBackupTaskEntity;
import com.backupcenter.server.service.command.ExternalCommandRunner;
import org.apache.commons.exec.CommandLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PgDumpServiceTest {

    private ExternalCommandRunner commandRunner;

    private PgDumpService pgDumpService;

    private DatabaseBackupTaskEntity task;

    @BeforeEach
    void setUp() {
        this.commandRunner = mock(ExternalCommandRunner.class);
        this.pgDumpService = new PgDumpService(this.commandRunner);
        ReflectionTestUtils.setField(this.pgDumpService, "dumpBinary", "pg_dump");
        ReflectionTestUtils.setField(this.pgDumpService, "restoreBinary", "pg_restore");
        ReflectionTestUtils.setField(this.pgDumpService, "psqlBinary", "psql");
        ReflectionTestUtils.setField(this.pgDumpService, "timeoutSec", 60L);

        this.task = new DatabaseBackupTaskEntity();
        this.task.setName("orders nightly");
        this.task.setHost("db.internal");
        this.task.setPort(5433);
        this.task.setUsername("backup");
        this.task.setDatabaseName("orders");
        this.task.setEncryptedPassword("ignored");
    }

    private static List<String> args(CommandLine commandLine) {
        return Arrays.asList(commandLine.getArguments());
    }

    @Test
    void ShouldBuildCustomDumpWhenDefaults() {
        CommandLine commandLine = this.pgDumpService.buildDumpCommand(
                this.task, DumpFormatEnum.CUSTOM, Path.of("/tmp/orders.dump"));

        assertEquals("pg_dump", commandLine.getExecutable());
        List<String> args = args(commandLine);
        assertTrue(args.contains("--host=db.internal"));
        assertTrue(args.contains("--port=5433"));
        assertTrue(args.contains("--username=backup"));
        assertTrue(args.contains("--dbname=orders"));
        assertTrue(args.contains("--format=custom"));
        assertTrue(args.contains("--compress=6"));
        assertFalse(args.contains("--no-owner"));
        assertFalse(args.contains("--data-only"));
        assertFalse(args.contains("--schema-only"));
    }

    @Test
    void ShouldAddFlagsWhenOptionsDisabled() {
        this.task.setCompressionLevel(12);
        this.task.setIncludeRoles(false);
        this.task.setIncludeTablespaces(false);
        this.task.setIncludeData(false);

        List<String> args = args(this.pgDumpService.buildDumpCommand(
                this.task, DumpFormatEnum.CUSTOM, Path.of("/tmp/orders.dump")));

        assertTrue(args.contains("--compress=9"));
        assertTrue(args.contains("--no-owner"));
        assertTrue(args.contains("--no-privileges"));
        assertTrue(args.contains("--no-tablespaces"));
        assertTrue(args.contains("--schema-only"));
    }

    @Test
    void ShouldOmitCompressWhenPlainFormat() {
        this.task.setIncludeSchema(false);
        this.task.setIncludeData(false);

        List<String> args = args(this.pgDumpService.buildDumpCommand(
                this.task, DumpFormatEnum.PLAIN, Path.of("/tmp/orders.sql")));

        assertTrue(args.contains("--format=plain"));
        assertTrue(args.stream().noneMatch(arg -> arg.startsWith("--compress")));
        assertTrue(args.contains("--no-owner"));
        // 两者都关闭等同于都包含
        assertFalse(args.contains("--data-only"));
        assertFalse(args.contains("--schema-only"));
    }

    @Test
    void ShouldPassPasswordOnlyInEnvironmentWhenDumping() {
        when(this.commandRunner.execute(any(), any(), any()))
                .thenReturn(CommandExecResult.success(0, "", ""));

        this.pgDumpService.dump(this.task, DumpFormatEnum.CUSTOM, "hunter2", Path.of("/tmp/orders.dump"));

        ArgumentCaptor<CommandLine> commandCaptor = ArgumentCaptor.forClass(CommandLine.class);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> envCaptor = ArgumentCaptor.forClass(Map.class);
        verify(this.commandRunner).execute(commandCaptor.capture(), envCaptor.capture(), eq(Duration.ofSeconds(60)));
        assertEquals(Map.of("PGPASSWORD", "hunter2"), envCaptor.getValue());
        assertTrue(args(commandCaptor.getValue()).stream().noneMatch(arg -> arg.contains("hunter2")));
        assertFalse(commandCaptor.getValue().toString().contains("hunter2"));
    }

    @Test
    void ShouldUsePgRestoreWhenArchiveAndPsqlWhenPlain() {
        CommandLine archive = this.pgDumpService.buildRestoreCommand(
                this.task, "orders_copy", Path.of("/tmp/orders_20240101000000.dump"));
        assertEquals("pg_restore", archive.getExecutable());
        assertTrue(args(archive).contains("--dbname=orders_copy"));
        assertTrue(args(archive).contains("--clean"));
        assertTrue(args(archive).contains("--if-exists"));

        CommandLine plain = this.pgDumpService.buildRestoreCommand(
                this.task, "orders", Path.of("/tmp/orders_20240101000000.sql"));
        assertEquals("psql", plain.getExecutable());
        assertTrue(args(plain).stream().anyMatch(arg -> arg.startsWith("--file=")));
    }

    @Test
    void ShouldThrowWhenConnectionIncomplete() {
        this.task.setHost(" ");
        assertThrows(ValidationException.class, () -> this.pgDumpService.buildDumpCommand(
                this.task, DumpFormatEnum.CUSTOM, Path.of("/tmp/orders.dump")));
    }
}
