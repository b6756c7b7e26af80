package com.backupcenter.server.service.db.impl;

import com.backupcenter.server.exception.DbException;
import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.mapper.FolderBackupTaskMapper;
import com.backupcenter.server.model.entity.FolderBackupTaskEntity;
import com.backupcenter.server.service.db.IFolderBackupTaskService;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

@Service
public class FolderBackupTaskService
        extends ServiceImpl<FolderBackupTaskMapper, FolderBackupTaskEntity>
        implements IFolderBackupTaskService {

    public FolderBackupTaskEntity getByFolderBackupTaskId(Long folderBackupTaskId) throws ValidationException {
        if (ObjectUtils.isEmpty(folderBackupTaskId)) {
            throw new ValidationException("getByFolderBackupTaskId failed. folderBackupTaskId is null");
        }
        LambdaQueryWrapper<FolderBackupTaskEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(FolderBackupTaskEntity::getFolderBackupTaskId, folderBackupTaskId);
        return this.getOne(queryWrapper);
    }

    public List<FolderBackupTaskEntity> getByAgentId(long agentId) {
        LambdaQueryWrapper<FolderBackupTaskEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(FolderBackupTaskEntity::getAgentId, agentId);
        queryWrapper.orderByAsc(FolderBackupTaskEntity::getFolderBackupTaskId);
        return this.list(queryWrapper);
    }

    // 手动触发 agent 执行后记录结果, lastError 为 null 时显式清空
    public void updateRunState(
            long folderBackupTaskId,
            String status,
            LocalDateTime lastRun,
            String lastError) throws DbException {
        LambdaUpdateWrapper<FolderBackupTaskEntity> updateWrapper = new LambdaUpdateWrapper<>();
        updateWrapper.eq(FolderBackupTaskEntity::getFolderBackupTaskId, folderBackupTaskId);
        updateWrapper.set(FolderBackupTaskEntity::getLastStatus, status);
        updateWrapper.set(FolderBackupTaskEntity::getLastRun, lastRun);
        updateWrapper.set(FolderBackupTaskEntity::getLastError, lastError);
        boolean updated = this.update(updateWrapper);
        if (!updated) {
            throw new DbException("updateRunState failed. can't write to database. folderBackupTaskId is %s"
                    .formatted(folderBackupTaskId));
        }
    }
}
