package com.backupcenter.server.service.db.impl;

import com.backupcenter.server.exception.DbException;
import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.mapper.StorageConfigMapper;
import com.backupcenter.server.model.entity.StorageConfigEntity;
import com.backupcenter.server.model.storage.SpaceInfo;
import com.backupcenter.server.service.db.IStorageConfigService;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

@Service
@Slf4j
public class StorageConfigService
        extends ServiceImpl<StorageConfigMapper, StorageConfigEntity>
        implements IStorageConfigService {

    public StorageConfigEntity getByStorageConfigId(Long storageConfigId) throws ValidationException {
        if (ObjectUtils.isEmpty(storageConfigId)) {
            throw new ValidationException("getByStorageConfigId failed. storageConfigId is null");
        }
        LambdaQueryWrapper<StorageConfigEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(StorageConfigEntity::getStorageConfigId, storageConfigId);
        return this.getOne(queryWrapper);
    }

    public List<StorageConfigEntity> getAllStorageConfig() {
        LambdaQueryWrapper<StorageConfigEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.orderByAsc(StorageConfigEntity::getStorageConfigId);
        return this.list(queryWrapper);
    }

    // connectionError 为 null 表示健康, 需要显式 set null
    public void updateHealth(
            long storageConfigId,
            LocalDateTime checkTime,
            SpaceInfo spaceInfo,
            String connectionError) throws DbException {
        LambdaUpdateWrapper<StorageConfigEntity> updateWrapper = new LambdaUpdateWrapper<>();
        updateWrapper.eq(StorageConfigEntity::getStorageConfigId, storageConfigId);
        updateWrapper.set(StorageConfigEntity::getLastCheck, checkTime);
        updateWrapper.set(StorageConfigEntity::getConnectionError, connectionError);
        if (ObjectUtils.isNotEmpty(spaceInfo)) {
            updateWrapper.set(StorageConfigEntity::getUsedSpaceGb, spaceInfo.usedGb());
            updateWrapper.set(StorageConfigEntity::getFreeSpaceGb, spaceInfo.freeGb());
            updateWrapper.set(StorageConfigEntity::getTotalSpaceGb, spaceInfo.totalGb());
        }
        updateWrapper.set(StorageConfigEntity::getLastUpdatedTime, checkTime);
        boolean updated = this.update(updateWrapper);
        if (!updated) {
            throw new DbException("updateHealth failed. can't write to database. " +
                    "storageConfigId is %s".formatted(storageConfigId));
        }
    }
}
