package com.backupcenter.server.service.storage;

import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.model.entity.LegacyS3ConfigEntity;
import com.backupcenter.server.model.entity.StorageConfigEntity;
import com.backupcenter.server.service.db.impl.LegacyS3ConfigService;
import com.backupcenter.server.service.db.impl.StorageConfigService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class StorageConfigResolverTest {

    private StorageConfigService storageConfigService;

    private LegacyS3ConfigService legacyS3ConfigService;

    private StorageConfigResolver resolver;

    private LegacyS3ConfigEntity legacy;

    @BeforeEach
    void setUp() {
        this.storageConfigService = mock(StorageConfigService.class);
        this.legacyS3ConfigService = mock(LegacyS3ConfigService.class);
        this.resolver = new StorageConfigResolver(this.storageConfigService, this.legacyS3ConfigService);

        this.legacy = new LegacyS3ConfigEntity();
        this.legacy.setLegacyS3ConfigId(5L);
        this.legacy.setName("old minio");
        this.legacy.setEndpoint("https://minio.internal");
        this.legacy.setAccessKey("ak");
        this.legacy.setSecretKey("sk");
        this.legacy.setBucketName("backups");
    }

    @Test
    void ShouldPreferStorageConfigWhenBothReferenced() {
        StorageConfigEntity storageConfig = new StorageConfigEntity();
        storageConfig.setStorageConfigId(1L);
        when(this.storageConfigService.getByStorageConfigId(1L)).thenReturn(storageConfig);

        assertSame(storageConfig, this.resolver.resolve(1L, 5L));
        verifyNoInteractions(this.legacyS3ConfigService);
    }

    @Test
    void ShouldNormalizeLegacyConfigWhenOnlyS3Referenced() {
        when(this.legacyS3ConfigService.getByLegacyS3ConfigId(5L)).thenReturn(this.legacy);

        StorageConfigEntity resolved = this.resolver.resolve(null, 5L);

        assertEquals("object", resolved.getStorageType());
        assertNull(resolved.getStorageConfigId());
        assertEquals("backups", resolved.getConfigData().get("bucket"));
        assertEquals(StorageConfigResolver.DEFAULT_REGION, resolved.getConfigData().get("region"));
        assertEquals(true, resolved.getConfigData().get("useSsl"));
    }

    @Test
    void ShouldThrowWhenNothingResolves() {
        assertThrows(ValidationException.class, () -> this.resolver.resolve(null, null));
        when(this.storageConfigService.getByStorageConfigId(9L)).thenReturn(null);
        assertThrows(ValidationException.class, () -> this.resolver.resolve(9L, null));
    }
}
