package com.backupcenter.server.service.storage;

import com.backupcenter.server.exception.BackupCenterException;
import com.backupcenter.server.exception.BusinessException;
import com.backupcenter.server.model.entity.StorageConfigEntity;
import com.backupcenter.server.model.storage.ConnectionCheckResult;
import com.backupcenter.server.model.storage.SpaceInfo;
import com.backupcenter.server.service.db.impl.StorageConfigService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

@Service
@Slf4j
public class StorageHealthCheckService {

    private final StorageConfigService storageConfigService;

    private final StorageBackendFactory storageBackendFactory;

    @Autowired
    public StorageHealthCheckService(
            StorageConfigService storageConfigService,
            StorageBackendFactory storageBackendFactory) {
        this.storageConfigService = storageConfigService;
        this.storageBackendFactory = storageBackendFactory;
    }

    @Scheduled(
            initialDelayString = "${backupcenter.server.storage.initialDelayMillis:300000}",
            fixedDelayString = "${backupcenter.server.storage.checkIntervalMillis:86400000}",
            scheduler = "systemManagementTaskScheduler"
    )
    public void checkAllStorage() {
        log.info("Check All Storage");
        List<StorageConfigEntity> storageConfigList = this.storageConfigService.getAllStorageConfig();
        if (CollectionUtils.isEmpty(storageConfigList)) {
            return;
        }
        for (StorageConfigEntity storageConfig : storageConfigList) {
            try {
                this.checkStorage(storageConfig);
            } catch (Exception e) {
                log.error("checkAllStorage has error. storageConfig is {}", storageConfig,
                        new BusinessException("checkStorage failed", e));
            }
        }
    }

    public ConnectionCheckResult checkStorage(StorageConfigEntity storageConfig) {
        LocalDateTime now = LocalDateTime.now();
        ConnectionCheckResult result;
        SpaceInfo spaceInfo = null;
        try (StorageBackend backend = this.storageBackendFactory.create(storageConfig)) {
            result = backend.testConnection();
            if (result.ok()) {
                spaceInfo = backend.spaceInfo();
            }
        } catch (BackupCenterException e) {
            // 配置错误和传输错误都记录为连接错误
            result = ConnectionCheckResult.failed(e.getBackupCenterMessage());
        }
        this.storageConfigService.updateHealth(
                storageConfig.getStorageConfigId(), now, spaceInfo, result.error());
        if (result.ok()) {
            log.info("storage {} is healthy. space is {}", storageConfig.getName(), spaceInfo);
        } else {
            log.warn("storage {} check failed. {}", storageConfig.getName(), result.error());
        }
        return result;
    }
}
