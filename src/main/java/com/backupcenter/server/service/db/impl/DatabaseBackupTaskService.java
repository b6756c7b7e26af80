package com.backupcenter.server.service.db.impl;

import com.backupcenter.server.exception.DbException;
import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.mapper.DatabaseBackupTaskMapper;
import com.backupcenter.server.model.entity.DatabaseBackupTaskEntity;
import com.backupcenter.server.service.db.IDatabaseBackupTaskService;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

@Service
@Slf4j
public class DatabaseBackupTaskService
        extends ServiceImpl<DatabaseBackupTaskMapper, DatabaseBackupTaskEntity>
        implements IDatabaseBackupTaskService {

    public DatabaseBackupTaskEntity getByDatabaseBackupTaskId(Long taskId) throws ValidationException {
        if (ObjectUtils.isEmpty(taskId)) {
            throw new ValidationException("getByDatabaseBackupTaskId failed. taskId is null");
        }
        LambdaQueryWrapper<DatabaseBackupTaskEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(DatabaseBackupTaskEntity::getDatabaseBackupTaskId, taskId);
        return this.getOne(queryWrapper);
    }

    // enabled 且 scheduleEnabled 的任务, 即调度器应当持有的任务
    public List<DatabaseBackupTaskEntity> getSchedulableTasks() {
        LambdaQueryWrapper<DatabaseBackupTaskEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(DatabaseBackupTaskEntity::getEnabled, true);
        queryWrapper.eq(DatabaseBackupTaskEntity::getScheduleEnabled, true);
        return this.list(queryWrapper);
    }

    public List<DatabaseBackupTaskEntity> getByDatabaseBackupTaskIds(Collection<Long> taskIds) {
        if (CollectionUtils.isEmpty(taskIds)) {
            return Collections.emptyList();
        }
        LambdaQueryWrapper<DatabaseBackupTaskEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.in(DatabaseBackupTaskEntity::getDatabaseBackupTaskId, taskIds);
        return this.list(queryWrapper);
    }

    public void updateNextRun(long taskId, LocalDateTime nextRun) throws DbException {
        LambdaUpdateWrapper<DatabaseBackupTaskEntity> updateWrapper = new LambdaUpdateWrapper<>();
        updateWrapper.eq(DatabaseBackupTaskEntity::getDatabaseBackupTaskId, taskId);
        updateWrapper.set(DatabaseBackupTaskEntity::getNextRun, nextRun);
        boolean updated = this.update(updateWrapper);
        if (!updated) {
            throw new DbException("updateNextRun failed. can't write to database. taskId is %s".formatted(taskId));
        }
    }

    public void updateRunState(
            long taskId,
            String status,
            LocalDateTime lastRun,
            String lastError) throws DbException {
        LambdaUpdateWrapper<DatabaseBackupTaskEntity> updateWrapper = new LambdaUpdateWrapper<>();
        updateWrapper.eq(DatabaseBackupTaskEntity::getDatabaseBackupTaskId, taskId);
        updateWrapper.set(DatabaseBackupTaskEntity::getLastStatus, status);
        updateWrapper.set(DatabaseBackupTaskEntity::getLastError, lastError);
        if (ObjectUtils.isNotEmpty(lastRun)) {
            updateWrapper.set(DatabaseBackupTaskEntity::getLastRun, lastRun);
        }
        boolean updated = this.update(updateWrapper);
        if (!updated) {
            throw new DbException("updateRunState failed. can't write to database. taskId is %s".formatted(taskId));
        }
    }
}
