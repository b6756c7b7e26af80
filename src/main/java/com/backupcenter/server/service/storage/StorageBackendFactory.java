package com.backupcenter.server.service.storage;

import com.backupcenter.server.enums.StorageTypeEnum;
import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.model.entity.StorageConfigEntity;
import com.backupcenter.server.service.command.ExternalCommandRunner;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds a fresh {@link StorageBackend} for a storage config. Callers own the returned backend and close
 * it when done.
 */
@Slf4j
@Component
public class StorageBackendFactory {

    public static final String DEFAULT_NFS_OPTIONS = "rw,sync,hard,intr";

    public static final int DEFAULT_SFTP_PORT = 22;

    private final ExternalCommandRunner commandRunner;

    @Autowired
    public StorageBackendFactory(ExternalCommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    public StorageBackend create(StorageConfigEntity storageConfig) throws ValidationException {
        if (ObjectUtils.isEmpty(storageConfig)) {
            throw new ValidationException("create storage backend failed. storageConfig is null");
        }
        StorageTypeEnum storageType = StorageTypeEnum.fromName(storageConfig.getStorageType());
        if (storageType == StorageTypeEnum.UNKNOWN) {
            throw new ValidationException("create storage backend failed. unknown storageType %s. storageConfig is %s"
                    .formatted(storageConfig.getStorageType(), storageConfig));
        }
        StorageConfigData data = new StorageConfigData(storageConfig.getConfigData());
        validateRequiredKeys(storageType, data, storageConfig);
        log.debug("creating {} storage backend for {}", storageType.getName(), storageConfig.getName());
        return switch (storageType) {
            case OBJECT -> new ObjectStorageBackend(
                    data.getString("endpoint"),
                    data.getString("accessKey"),
                    data.getString("secretKey"),
                    data.getString("bucket"),
                    data.getString("region"),
                    data.getBoolean("useSsl", false));
            case SFTP -> new SftpStorageBackend(
                    data.getString("host"),
                    data.getInt("port", DEFAULT_SFTP_PORT),
                    data.getString("username"),
                    data.getString("password"),
                    data.getString("privateKeyPath"),
                    data.getString("basePath"),
                    "yes".equalsIgnoreCase(data.getString("strictHostKeyChecking", "no")));
            case NFS -> new NfsStorageBackend(
                    data.getString("server"),
                    data.getString("exportPath"),
                    Path.of(data.getString("mountPoint")),
                    data.getString("basePath", ""),
                    data.getString("options", DEFAULT_NFS_OPTIONS),
                    data.getBoolean("premounted", false),
                    this.commandRunner);
            case LOCAL -> new LocalStorageBackend(Path.of(data.getString("basePath")));
            default -> throw new ValidationException("create storage backend failed. unsupported storageType %s"
                    .formatted(storageType));
        };
    }

    private static void validateRequiredKeys(
            StorageTypeEnum storageType,
            StorageConfigData data,
            StorageConfigEntity storageConfig) throws ValidationException {
        List<String> missing = storageType.getRequiredKeys().stream().filter(key -> !data.has(key)).toList();
        if (!missing.isEmpty()) {
            throw new ValidationException("%s storage config %s is missing keys %s"
                    .formatted(storageType.getName(), storageConfig.getName(), missing));
        }
        if (storageType == StorageTypeEnum.SFTP && !data.has("password") && !data.has("privateKeyPath")) {
            throw new ValidationException("sftp storage config %s needs password or privateKeyPath"
                    .formatted(storageConfig.getName()));
        }
    }
}
