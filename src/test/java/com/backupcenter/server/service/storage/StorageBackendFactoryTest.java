package com.backupcenter.server.service.storage;

import com.backupcenter.server.enums.StorageTypeEnum;
import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.model.entity.StorageConfigEntity;
import com.backupcenter.server.service.command.ExternalCommandRunner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class StorageBackendFactoryTest {

    @TempDir
    Path tempDir;

    private final StorageBackendFactory factory = new StorageBackendFactory(mock(ExternalCommandRunner.class));

    private static StorageConfigEntity config(String type, Map<String, Object> configData) {
        StorageConfigEntity storageConfig = new StorageConfigEntity();
        storageConfig.setStorageConfigId(1L);
        storageConfig.setName(type + " target");
        storageConfig.setStorageType(type);
        storageConfig.setConfigData(new HashMap<>(configData));
        return storageConfig;
    }

    @Test
    void ShouldCreateBackendOfMatchingTypeWhenConfigComplete() {
        try (StorageBackend local = this.factory.create(config("local", Map.of("basePath", this.tempDir.toString())))) {
            assertInstanceOf(LocalStorageBackend.class, local);
            assertEquals(StorageTypeEnum.LOCAL, local.getStorageType());
        }
        try (StorageBackend nfs = this.factory.create(config("nfs", Map.of(
                "server", "nas.internal",
                "exportPath", "/export/backups",
                "mountPoint", this.tempDir.resolve("mnt").toString())))) {
            assertInstanceOf(NfsStorageBackend.class, nfs);
        }
        try (StorageBackend sftp = this.factory.create(config("sftp", Map.of(
                "host", "sftp.internal",
                "username", "backup",
                "password", "secret",
                "basePath", "/srv/backups")))) {
            assertInstanceOf(SftpStorageBackend.class, sftp);
            assertFalse(sftp.toString().contains("secret"));
        }
        try (StorageBackend object = this.factory.create(config("s3", Map.of(
                "endpoint", "minio.internal:9000",
                "accessKey", "ak",
                "secretKey", "sk",
                "bucket", "backups",
                "region", "us-east-1")))) {
            assertEquals(StorageTypeEnum.OBJECT, object.getStorageType());
        }
    }

    @Test
    void ShouldAcceptSnakeCaseKeysWhenConfigFromOldClient() {
        try (StorageBackend object = this.factory.create(config("object", Map.of(
                "endpoint", "https://s3.example.com",
                "access_key", "ak",
                "secret_key", "sk",
                "bucket_name", "backups",
                "region", "eu-west-1",
                "use_ssl", true)))) {
            assertInstanceOf(ObjectStorageBackend.class, object);
        }
    }

    @Test
    void ShouldThrowWhenRequiredKeyMissing() {
        ValidationException e = assertThrows(ValidationException.class, () -> this.factory.create(config("object",
                Map.of("endpoint", "minio.internal:9000", "accessKey", "ak", "secretKey", "sk", "region", "us-east-1"))));
        assertTrue(e.getMessage().contains("bucket"));

        assertThrows(ValidationException.class, () -> this.factory.create(config("sftp",
                Map.of("host", "sftp.internal", "username", "backup", "basePath", "/srv"))));
    }

    @Test
    void ShouldThrowWhenTypeUnknown() {
        assertThrows(ValidationException.class, () -> this.factory.create(config("ftp", Map.of())));
        assertThrows(ValidationException.class, () -> this.factory.create(null));
    }
}
