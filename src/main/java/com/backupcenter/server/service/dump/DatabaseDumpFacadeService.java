package com.backupcenter.server.service.dump;

import com.backupcenter.server.enums.DumpFormatEnum;
import com.backupcenter.server.exception.ExternalToolException;
import com.backupcenter.server.exception.TransportException;
import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.model.dump.CommandExecResult;
import com.backupcenter.server.model.dump.DumpResult;
import com.backupcenter.server.model.entity.DatabaseBackupTaskEntity;
import com.backupcenter.server.model.entity.StorageConfigEntity;
import com.backupcenter.server.service.secret.CredentialCipherService;
import com.backupcenter.server.service.storage.StorageBackend;
import com.backupcenter.server.service.storage.StorageBackendFactory;
import com.backupcenter.server.util.FilesystemUtil;
import com.backupcenter.server.util.TimeUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

@Slf4j
@Service
public class DatabaseDumpFacadeService {

    private final PgDumpService pgDumpService;

    private final CredentialCipherService credentialCipherService;

    private final StorageBackendFactory storageBackendFactory;

    @Value("${backupcenter.server.dump.namespace:backups}")
    private String namespace;

    @Value("${backupcenter.server.dump.tempPath:${java.io.tmpdir}/backup-center/dumps}")
    private String tempPath;

    @Autowired
    public DatabaseDumpFacadeService(
            PgDumpService pgDumpService,
            CredentialCipherService credentialCipherService,
            StorageBackendFactory storageBackendFactory) {
        this.pgDumpService = pgDumpService;
        this.credentialCipherService = credentialCipherService;
        this.storageBackendFactory = storageBackendFactory;
    }

    public DumpResult backup(DatabaseBackupTaskEntity task, StorageConfigEntity storageConfig) {
        if (ObjectUtils.anyNull(task, storageConfig)) {
            throw new ValidationException("backup failed. task or storageConfig is null");
        }
        // 1. 解密, 失败时不启动任何子进程
        String password = this.credentialCipherService.decrypt(task.getEncryptedPassword());
        // 2. 生成文件名
        DumpFormatEnum format = DumpFormatEnum.fromName(
                StringUtils.defaultIfBlank(task.getDumpFormat(), DumpFormatEnum.CUSTOM.getName()));
        String sanitizedName = FilesystemUtil.sanitizeName(task.getDatabaseName());
        String artifactFilename = "%s_%s.%s".formatted(
                sanitizedName,
                LocalDateTime.now().format(TimeUtil.ARTIFACT_TIMESTAMP),
                format.getExtension());
        // 每次运行独立目录, 同名数据库的并发任务互不覆盖
        Path runDir = this.createRunDir();
        Path dumpFile = runDir.resolve(artifactFilename);
        try {
            // 3. pg_dump
            CommandExecResult execResult = this.pgDumpService.dump(task, format, password, dumpFile);
            if (!execResult.isSuccess()) {
                throw execResult.getExternalToolException("pg_dump");
            }
            if (!Files.isRegularFile(dumpFile)) {
                throw new ExternalToolException(0, "pg_dump exited 0 but produced no artifact %s"
                        .formatted(artifactFilename));
            }
            double sizeMb = FilesystemUtil.bytesToMb(Files.size(dumpFile));
            // 4. 上传
            String storagePath = this.getStoragePrefix(task) + "/" + artifactFilename;
            String storageUri;
            try (StorageBackend backend = this.storageBackendFactory.create(storageConfig)) {
                storageUri = backend.upload(dumpFile, storagePath);
            }
            log.info("backup of {} finished. uri is {}, size is {} MB",
                    task.getDatabaseName(), storageUri, sizeMb);
            return new DumpResult(artifactFilename, storagePath, storageUri, sizeMb);
        } catch (IOException e) {
            throw new TransportException("read dump artifact %s failed".formatted(dumpFile), e);
        } finally {
            // best effort
            FilesystemUtil.deleteDirectoryQuietly(runDir);
        }
    }

    /**
     * Downloads {@code storageUri} and replays it into {@code targetDatabase}, or into the task's own
     * database when no target is given.
     */
    public void restore(
            DatabaseBackupTaskEntity task,
            StorageConfigEntity storageConfig,
            String storageUri,
            String targetDatabase) {
        if (ObjectUtils.anyNull(task, storageConfig) || StringUtils.isBlank(storageUri)) {
            throw new ValidationException("restore failed. task, storageConfig or storageUri is empty");
        }
        String password = this.credentialCipherService.decrypt(task.getEncryptedPassword());
        String database = StringUtils.defaultIfBlank(targetDatabase, task.getDatabaseName());
        Path runDir = this.createRunDir();
        Path localFile;
        try (StorageBackend backend = this.storageBackendFactory.create(storageConfig)) {
            String relativePath = backend.toRelativePath(storageUri);
            localFile = runDir.resolve(FilesystemUtil.fileName(relativePath));
            backend.download(relativePath, localFile);
        } catch (RuntimeException e) {
            FilesystemUtil.deleteDirectoryQuietly(runDir);
            throw e;
        }
        try {
            CommandExecResult execResult = this.pgDumpService.restore(task, database, password, localFile);
            if (!execResult.isSuccess()) {
                String tool = DumpFormatEnum.isArchiveFile(localFile.getFileName().toString()) ? "pg_restore" : "psql";
                throw execResult.getExternalToolException(tool);
            }
            log.info("restore of {} into {} finished", storageUri, database);
        } finally {
            FilesystemUtil.deleteDirectoryQuietly(runDir);
        }
    }

    // {namespace}/{sanitizedDatabaseName}
    public String getStoragePrefix(DatabaseBackupTaskEntity task) throws ValidationException {
        return FilesystemUtil.joinPath(this.namespace, FilesystemUtil.sanitizeName(task.getDatabaseName()));
    }

    private Path prepareTempDir() throws TransportException {
        Path dir = Path.of(this.tempPath);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new TransportException("create dump temp dir %s failed".formatted(dir), e);
        }
        return dir;
    }

    private Path createRunDir() throws TransportException {
        Path dir = this.prepareTempDir();
        try {
            return Files.createTempDirectory(dir, "run-");
        } catch (IOException e) {
            throw new TransportException("create run dir under %s failed".formatted(dir), e);
        }
    }
}
