package com.backupcenter.server.service.db.impl;

import com.backupcenter.server.enums.CommonStatus;
import com.backupcenter.server.exception.DbException;
import com.backupcenter.server.mapper.DatabaseBackupHistoryMapper;
import com.backupcenter.server.model.dump.DumpResult;
import com.backupcenter.server.model.entity.DatabaseBackupHistoryEntity;
import com.backupcenter.server.model.entity.DatabaseBackupTaskEntity;
import com.backupcenter.server.service.db.IDatabaseBackupHistoryService;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * History rows are append-only. Every method that writes a row also writes the task run state in the
 * same transaction, so a task's lastStatus never disagrees with its newest history row.
 */
@Service
@Slf4j
public class DatabaseBackupHistoryService
        extends ServiceImpl<DatabaseBackupHistoryMapper, DatabaseBackupHistoryEntity>
        implements IDatabaseBackupHistoryService {

    private final DatabaseBackupTaskService databaseBackupTaskService;

    @Autowired
    public DatabaseBackupHistoryService(DatabaseBackupTaskService databaseBackupTaskService) {
        this.databaseBackupTaskService = databaseBackupTaskService;
    }

    @Transactional
    public DatabaseBackupHistoryEntity startExecution(
            DatabaseBackupTaskEntity task, LocalDateTime startedAt) throws DbException {
        DatabaseBackupHistoryEntity history = new DatabaseBackupHistoryEntity();
        history.setDatabaseBackupTaskId(task.getDatabaseBackupTaskId());
        history.setStatus(CommonStatus.RUNNING.getName());
        history.setStartedAt(startedAt);
        boolean saved = this.save(history);
        if (!saved) {
            throw new DbException("startExecution failed. can't write to database.");
        }
        this.databaseBackupTaskService.updateRunState(
                task.getDatabaseBackupTaskId(), CommonStatus.RUNNING.getName(), startedAt, null);
        return history;
    }

    @Transactional
    public void finishWithSuccess(
            DatabaseBackupHistoryEntity history,
            DumpResult dumpResult,
            LocalDateTime finishedAt) throws DbException {
        history.setStatus(CommonStatus.SUCCESS.getName());
        history.setFinishedAt(finishedAt);
        history.setDurationSeconds(durationSeconds(history.getStartedAt(), finishedAt));
        history.setArtifactSizeMb(dumpResult.sizeMb());
        history.setStoragePath(dumpResult.storagePath());
        history.setArtifactFilename(dumpResult.artifactFilename());
        boolean updated = this.updateById(history);
        if (!updated) {
            throw new DbException("finishWithSuccess failed. can't write to database.");
        }
        this.databaseBackupTaskService.updateRunState(
                history.getDatabaseBackupTaskId(), CommonStatus.SUCCESS.getName(), null, null);
    }

    @Transactional
    public void finishWithError(
            DatabaseBackupHistoryEntity history,
            String errorMessage,
            LocalDateTime finishedAt) throws DbException {
        if (StringUtils.isBlank(errorMessage)) {
            errorMessage = "unknown error";
        }
        history.setStatus(CommonStatus.ERROR.getName());
        history.setFinishedAt(finishedAt);
        history.setDurationSeconds(durationSeconds(history.getStartedAt(), finishedAt));
        history.setErrorMessage(errorMessage);
        boolean updated = this.updateById(history);
        if (!updated) {
            throw new DbException("finishWithError failed. can't write to database.");
        }
        this.databaseBackupTaskService.updateRunState(
                history.getDatabaseBackupTaskId(), CommonStatus.ERROR.getName(), null, errorMessage);
    }

    // artifactFilename -> finishedAt, 用于 retention 判断文件年龄
    public Map<String, LocalDateTime> getSuccessFinishTimes(long taskId) {
        LambdaQueryWrapper<DatabaseBackupHistoryEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(DatabaseBackupHistoryEntity::getDatabaseBackupTaskId, taskId);
        queryWrapper.eq(DatabaseBackupHistoryEntity::getStatus, CommonStatus.SUCCESS.getName());
        queryWrapper.isNotNull(DatabaseBackupHistoryEntity::getArtifactFilename);
        List<DatabaseBackupHistoryEntity> dbResult = this.list(queryWrapper);
        Map<String, LocalDateTime> result = new HashMap<>();
        for (DatabaseBackupHistoryEntity history : dbResult) {
            if (history.getFinishedAt() != null) {
                result.put(history.getArtifactFilename(), history.getFinishedAt());
            }
        }
        return result;
    }

    public List<DatabaseBackupHistoryEntity> getByTaskId(long taskId) {
        LambdaQueryWrapper<DatabaseBackupHistoryEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(DatabaseBackupHistoryEntity::getDatabaseBackupTaskId, taskId);
        queryWrapper.orderByAsc(DatabaseBackupHistoryEntity::getDatabaseBackupHistoryId);
        return this.list(queryWrapper);
    }

    public long countByStatusSince(Collection<Long> taskIds, CommonStatus status, LocalDateTime since) {
        if (CollectionUtils.isEmpty(taskIds)) {
            return 0L;
        }
        LambdaQueryWrapper<DatabaseBackupHistoryEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.in(DatabaseBackupHistoryEntity::getDatabaseBackupTaskId, taskIds);
        queryWrapper.eq(DatabaseBackupHistoryEntity::getStatus, status.getName());
        queryWrapper.ge(DatabaseBackupHistoryEntity::getStartedAt, since);
        return this.count(queryWrapper);
    }

    private static Integer durationSeconds(LocalDateTime startedAt, LocalDateTime finishedAt) {
        if (startedAt == null || finishedAt == null) {
            return null;
        }
        return (int) Duration.between(startedAt, finishedAt).getSeconds();
    }
}
