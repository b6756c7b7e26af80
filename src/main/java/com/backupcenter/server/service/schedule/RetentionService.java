package com.backupcenter.server.service.schedule;

import com.backupcenter.server.exception.BackupCenterException;
import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.model.entity.DatabaseBackupTaskEntity;
import com.backupcenter.server.model.entity.StorageConfigEntity;
import com.backupcenter.server.model.storage.StorageObject;
import com.backupcenter.server.service.db.impl.DatabaseBackupHistoryService;
import com.backupcenter.server.service.dump.DatabaseDumpFacadeService;
import com.backupcenter.server.service.storage.StorageBackend;
import com.backupcenter.server.service.storage.StorageBackendFactory;
import com.backupcenter.server.util.FilesystemUtil;
import com.backupcenter.server.util.TimeUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Expires dump artifacts older than the task's {@code cleanupDays}.
 * <p>
 * An artifact's age comes from the finishedAt of the successful history row with the same file name,
 * then from the backend's modification time. Artifacts with neither are kept.
 */
@Slf4j
@Service
public class RetentionService {

    private final DatabaseBackupHistoryService databaseBackupHistoryService;

    private final DatabaseDumpFacadeService databaseDumpFacadeService;

    private final StorageBackendFactory storageBackendFactory;

    @Autowired
    public RetentionService(
            DatabaseBackupHistoryService databaseBackupHistoryService,
            DatabaseDumpFacadeService databaseDumpFacadeService,
            StorageBackendFactory storageBackendFactory) {
        this.databaseBackupHistoryService = databaseBackupHistoryService;
        this.databaseDumpFacadeService = databaseDumpFacadeService;
        this.storageBackendFactory = storageBackendFactory;
    }

    public List<String> cleanup(DatabaseBackupTaskEntity task, StorageConfigEntity storageConfig) {
        try (StorageBackend backend = this.storageBackendFactory.create(storageConfig)) {
            return this.cleanup(task, backend, LocalDateTime.now());
        }
    }

    /**
     * @return backend relative paths that were deleted
     */
    public List<String> cleanup(DatabaseBackupTaskEntity task, StorageBackend backend, LocalDateTime now) {
        if (ObjectUtils.anyNull(task, backend, now)) {
            throw new ValidationException("cleanup failed. task, backend or now is null");
        }
        Integer cleanupDays = task.getCleanupDays();
        if (cleanupDays == null || cleanupDays <= 0) {
            log.info("cleanup skipped. task {} has no positive cleanupDays", task.getName());
            return List.of();
        }
        Instant cutoff = TimeUtil.toInstant(now.minusDays(cleanupDays));
        String prefix = this.databaseDumpFacadeService.getStoragePrefix(task) + "/";
        Map<String, LocalDateTime> finishTimes =
                this.databaseBackupHistoryService.getSuccessFinishTimes(task.getDatabaseBackupTaskId());
        List<String> deleted = new ArrayList<>();
        for (StorageObject storageObject : backend.listObjects(prefix)) {
            Instant artifactTime = this.getArtifactTime(storageObject, finishTimes);
            if (artifactTime == null) {
                log.warn("cleanup keeps {}. age is unknown", storageObject.path());
                continue;
            }
            if (!artifactTime.isBefore(cutoff)) {
                continue;
            }
            try {
                backend.delete(storageObject.path());
                deleted.add(storageObject.path());
            } catch (BackupCenterException e) {
                log.error("cleanup delete failed. path is {}", storageObject.path(), e);
            }
        }
        log.info("cleanup of task {} deleted {} artifacts older than {} days",
                task.getName(), deleted.size(), cleanupDays);
        return deleted;
    }

    private Instant getArtifactTime(StorageObject storageObject, Map<String, LocalDateTime> finishTimes) {
        LocalDateTime finishedAt = finishTimes.get(FilesystemUtil.fileName(storageObject.path()));
        if (finishedAt != null) {
            return TimeUtil.toInstant(finishedAt);
        }
        return storageObject.lastModified();
    }
}
