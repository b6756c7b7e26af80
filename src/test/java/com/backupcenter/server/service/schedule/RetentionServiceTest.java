package com.backupcenter.server.service.schedule;

import com.backupcenter.server.exception.TransportException;
import com.backupcenter.server.model.entity.DatabaseBackupTaskEntity;
import com.backupcenter.server.model.storage.StorageObject;
import com.backupcenter.server.service.db.impl.DatabaseBackupHistoryService;
import com.backupcenter.server.service.dump.DatabaseDumpFacadeService;
import com.backupcenter.server.service.storage.StorageBackend;
import com.backupcenter.server.service.storage.StorageBackendFactory;
import com.backupcenter.server.util.TimeUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RetentionServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 0, 0);

    private DatabaseBackupHistoryService historyService;

    private StorageBackend backend;

    private RetentionService retentionService;

    private DatabaseBackupTaskEntity task;

    @BeforeEach
    void setUp() {
        this.historyService = mock(DatabaseBackupHistoryService.class);
        DatabaseDumpFacadeService facadeService = mock(DatabaseDumpFacadeService.class);
        this.backend = mock(StorageBackend.class);
        this.retentionService = new RetentionService(
                this.historyService, facadeService, mock(StorageBackendFactory.class));

        this.task = new DatabaseBackupTaskEntity();
        this.task.setDatabaseBackupTaskId(3L);
        this.task.setName("orders nightly");
        this.task.setDatabaseName("orders");
        this.task.setCleanupEnabled(true);
        this.task.setCleanupDays(30);
        when(facadeService.getStoragePrefix(this.task)).thenReturn("backups/orders");
        when(this.historyService.getSuccessFinishTimes(anyLong())).thenReturn(Map.of());
    }

    private static StorageObject aged(String name, int days) {
        return new StorageObject("backups/orders/" + name, TimeUtil.toInstant(NOW.minusDays(days)), 1024);
    }

    @Test
    void ShouldDeleteOnlyExpiredWhenAgesMixed() {
        when(this.backend.listObjects("backups/orders/")).thenReturn(List.of(
                aged("a.dump", 10), aged("b.dump", 40), aged("c.dump", 100)));

        List<String> deleted = this.retentionService.cleanup(this.task, this.backend, NOW);

        assertEquals(List.of("backups/orders/b.dump", "backups/orders/c.dump"), deleted);
        verify(this.backend, never()).delete("backups/orders/a.dump");
    }

    @Test
    void ShouldPreferHistoryFinishTimeWhenFileNameMatches() {
        // 文件修改时间是新的, 但历史记录显示已过期
        when(this.backend.listObjects("backups/orders/")).thenReturn(List.of(aged("a.dump", 1)));
        when(this.historyService.getSuccessFinishTimes(3L)).thenReturn(Map.of("a.dump", NOW.minusDays(45)));

        assertEquals(List.of("backups/orders/a.dump"), this.retentionService.cleanup(this.task, this.backend, NOW));
    }

    @Test
    void ShouldKeepArtifactWhenAgeUnknown() {
        when(this.backend.listObjects("backups/orders/")).thenReturn(List.of(
                new StorageObject("backups/orders/unknown.dump", null, 10)));

        assertTrue(this.retentionService.cleanup(this.task, this.backend, NOW).isEmpty());
        verify(this.backend, never()).delete(anyString());
    }

    @Test
    void ShouldSkipPassWhenCleanupDaysNotPositive() {
        this.task.setCleanupDays(0);

        assertTrue(this.retentionService.cleanup(this.task, this.backend, NOW).isEmpty());
        verifyNoInteractions(this.backend);
    }

    @Test
    void ShouldContinueWhenOneDeleteFails() {
        when(this.backend.listObjects("backups/orders/")).thenReturn(List.of(
                aged("b.dump", 40), aged("c.dump", 100)));
        doThrow(new TransportException("permission denied")).when(this.backend).delete("backups/orders/b.dump");

        assertEquals(List.of("backups/orders/c.dump"), this.retentionService.cleanup(this.task, this.backend, NOW));
    }
}
