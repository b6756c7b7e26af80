package com.backupcenter.server.service.storage;

import com.backupcenter.server.enums.StorageTypeEnum;
import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.model.entity.LegacyS3ConfigEntity;
import com.backupcenter.server.model.entity.StorageConfigEntity;
import com.backupcenter.server.service.db.impl.LegacyS3ConfigService;
import com.backupcenter.server.service.db.impl.StorageConfigService;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Finds the storage a task writes to. {@code storageConfigId} wins; a task that only has the legacy
 * {@code s3ConfigId} gets a transient object storage config built from the legacy record.
 */
@Component
public class StorageConfigResolver {

    public static final String DEFAULT_REGION = "us-east-1";

    private final StorageConfigService storageConfigService;

    private final LegacyS3ConfigService legacyS3ConfigService;

    @Autowired
    public StorageConfigResolver(
            StorageConfigService storageConfigService,
            LegacyS3ConfigService legacyS3ConfigService) {
        this.storageConfigService = storageConfigService;
        this.legacyS3ConfigService = legacyS3ConfigService;
    }

    public StorageConfigEntity resolve(Long storageConfigId, Long legacyS3ConfigId) throws ValidationException {
        if (ObjectUtils.isNotEmpty(storageConfigId)) {
            StorageConfigEntity storageConfig = this.storageConfigService.getByStorageConfigId(storageConfigId);
            if (ObjectUtils.isEmpty(storageConfig)) {
                throw new ValidationException("storage config %s not found".formatted(storageConfigId));
            }
            return storageConfig;
        }
        if (ObjectUtils.isNotEmpty(legacyS3ConfigId)) {
            LegacyS3ConfigEntity legacy = this.legacyS3ConfigService.getByLegacyS3ConfigId(legacyS3ConfigId);
            if (ObjectUtils.isEmpty(legacy)) {
                throw new ValidationException("legacy s3 config %s not found".formatted(legacyS3ConfigId));
            }
            return normalize(legacy);
        }
        throw new ValidationException("no storage configured. storageConfigId and s3ConfigId are both null");
    }

    // 旧的扁平 s3 配置转换成通用 object storage 配置, 不落库
    public static StorageConfigEntity normalize(LegacyS3ConfigEntity legacy) throws ValidationException {
        if (ObjectUtils.isEmpty(legacy)) {
            throw new ValidationException("normalize failed. legacy s3 config is null");
        }
        Map<String, Object> configData = new HashMap<>();
        String endpoint = StringUtils.defaultString(legacy.getEndpoint());
        configData.put("endpoint", endpoint);
        configData.put("accessKey", legacy.getAccessKey());
        configData.put("secretKey", legacy.getSecretKey());
        configData.put("bucket", legacy.getBucketName());
        configData.put("region", StringUtils.defaultIfBlank(legacy.getRegion(), DEFAULT_REGION));
        configData.put("useSsl", Boolean.TRUE.equals(legacy.getUseSsl()) || endpoint.startsWith("https://"));
        StorageConfigEntity storageConfig = new StorageConfigEntity();
        storageConfig.setName(legacy.getName());
        storageConfig.setStorageType(StorageTypeEnum.OBJECT.getName());
        storageConfig.setConfigData(configData);
        return storageConfig;
    }
}
