package com.backupcenter.server.service.schedule;

import com.backupcenter.server.exception.ExternalToolException;
import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.model.dump.DumpResult;
import com.backupcenter.server.model.entity.DatabaseBackupHistoryEntity;
import com.backupcenter.server.model.entity.DatabaseBackupTaskEntity;
import com.backupcenter.server.model.entity.StorageConfigEntity;
import com.backupcenter.server.service.db.impl.DatabaseBackupHistoryService;
import com.backupcenter.server.service.db.impl.DatabaseBackupTaskService;
import com.backupcenter.server.service.dump.DatabaseDumpFacadeService;
import com.backupcenter.server.service.storage.StorageConfigResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class TaskSchedulerServiceTest {

    private TaskScheduler taskScheduler;

    private DatabaseBackupTaskService taskService;

    private DatabaseBackupHistoryService historyService;

    private DatabaseDumpFacadeService dumpFacadeService;

    private StorageConfigResolver storageConfigResolver;

    private RetentionService retentionService;

    private TaskSchedulerService schedulerService;

    private ScheduledFuture<?> future;

    private DatabaseBackupHistoryEntity history;

    private StorageConfigEntity storageConfig;

    @BeforeEach
    void setUp() {
        this.taskScheduler = mock(TaskScheduler.class);
        this.taskService = mock(DatabaseBackupTaskService.class);
        this.historyService = mock(DatabaseBackupHistoryService.class);
        this.dumpFacadeService = mock(DatabaseDumpFacadeService.class);
        this.storageConfigResolver = mock(StorageConfigResolver.class);
        this.retentionService = mock(RetentionService.class);
        this.schedulerService = new TaskSchedulerService(
                this.taskScheduler,
                this.taskService,
                this.historyService,
                this.dumpFacadeService,
                this.storageConfigResolver,
                this.retentionService);

        this.future = mock(ScheduledFuture.class);
        doReturn(this.future).when(this.taskScheduler).schedule(any(Runnable.class), any(Trigger.class));

        this.history = new DatabaseBackupHistoryEntity();
        this.history.setDatabaseBackupHistoryId(100L);
        when(this.historyService.startExecution(any(), any())).thenReturn(this.history);

        this.storageConfig = new StorageConfigEntity();
        this.storageConfig.setStorageConfigId(7L);
        this.storageConfig.setStorageType("local");
    }

    private static DatabaseBackupTaskEntity task(long id, String cron) {
        DatabaseBackupTaskEntity task = new DatabaseBackupTaskEntity();
        task.setDatabaseBackupTaskId(id);
        task.setName("task " + id);
        task.setDatabaseName("orders");
        task.setStorageConfigId(7L);
        task.setScheduleCron(cron);
        task.setEnabled(true);
        task.setScheduleEnabled(true);
        return task;
    }

    @Test
    void ShouldRegisterOneJobPerActiveTaskWhenStarted() {
        when(this.taskService.getSchedulableTasks()).thenReturn(List.of(task(1L, "0 2 * * *"), task(2L, "30 * * * *")));

        this.schedulerService.start();

        assertEquals(Map.of("database_task_1", 1L, "database_task_2", 2L), this.schedulerService.getLiveJobs());
        ArgumentCaptor<Trigger> captor = ArgumentCaptor.forClass(Trigger.class);
        verify(this.taskScheduler, times(2)).schedule(any(Runnable.class), captor.capture());
        assertEquals("0 0 2 * * *", ((CronTrigger) captor.getAllValues().get(0)).getExpression());
        verify(this.taskService).updateNextRun(eq(1L), any(LocalDateTime.class));
    }

    @Test
    void ShouldRemoveJobWhenTaskNoLongerActive() {
        when(this.taskService.getSchedulableTasks())
                .thenReturn(List.of(task(1L, "0 2 * * *"), task(2L, "0 3 * * *")))
                .thenReturn(List.of(task(2L, "0 3 * * *")));
        this.schedulerService.start();

        this.schedulerService.resync();

        assertEquals(Map.of("database_task_2", 2L), this.schedulerService.getLiveJobs());
        // job 1 被删除, job 2 被重建
        verify(this.future, times(2)).cancel(false);
    }

    @Test
    void ShouldSkipInvalidCronWithoutBlockingOthers() {
        when(this.taskService.getSchedulableTasks())
                .thenReturn(List.of(task(1L, "not a cron"), task(2L, " "), task(3L, "0 2 * * *")));

        this.schedulerService.start();

        assertEquals(Map.of("database_task_3", 3L), this.schedulerService.getLiveJobs());
    }

    @Test
    void ShouldDoNothingWhenNotStarted() {
        this.schedulerService.resync();

        verifyNoInteractions(this.taskService);
        assertTrue(this.schedulerService.getLiveJobs().isEmpty());
    }

    @Test
    void ShouldCancelAllJobsWhenStopped() {
        when(this.taskService.getSchedulableTasks()).thenReturn(List.of(task(1L, "0 2 * * *")));
        this.schedulerService.start();

        this.schedulerService.stop();

        assertTrue(this.schedulerService.getLiveJobs().isEmpty());
        verify(this.future).cancel(false);
        this.schedulerService.resync();
        verify(this.taskService, times(1)).getSchedulableTasks();
    }

    @Test
    void ShouldRecordSuccessAndRunRetentionWhenBackupSucceeds() {
        DatabaseBackupTaskEntity task = task(1L, "0 2 * * *");
        task.setCleanupEnabled(true);
        task.setCleanupDays(30);
        when(this.taskService.getByDatabaseBackupTaskId(1L)).thenReturn(task);
        when(this.storageConfigResolver.resolve(7L, null)).thenReturn(this.storageConfig);
        DumpResult dumpResult = new DumpResult(
                "orders_20240101020000.dump", "backups/orders/orders_20240101020000.dump",
                "local:///data/backups/orders/orders_20240101020000.dump", 1.5);
        when(this.dumpFacadeService.backup(task, this.storageConfig)).thenReturn(dumpResult);

        this.schedulerService.executeTask(1L);

        verify(this.historyService).finishWithSuccess(eq(this.history), eq(dumpResult), any());
        verify(this.historyService, never()).finishWithError(any(), anyString(), any());
        verify(this.retentionService).cleanup(task, this.storageConfig);
    }

    @Test
    void ShouldRecordErrorWhenDumpExitsNonZero() {
        DatabaseBackupTaskEntity task = task(1L, "0 2 * * *");
        task.setCleanupEnabled(true);
        when(this.taskService.getByDatabaseBackupTaskId(1L)).thenReturn(task);
        when(this.storageConfigResolver.resolve(7L, null)).thenReturn(this.storageConfig);
        when(this.dumpFacadeService.backup(task, this.storageConfig))
                .thenThrow(new ExternalToolException(1, "pg_dump exited with code 1. stderr is connection refused"));

        assertDoesNotThrow(() -> this.schedulerService.executeTask(1L));

        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(this.historyService).finishWithError(eq(this.history), captor.capture(), any());
        assertTrue(captor.getValue().contains("connection refused"));
        verify(this.historyService, never()).finishWithSuccess(any(), any(), any());
        verifyNoInteractions(this.retentionService);
    }

    @Test
    void ShouldRecordErrorWhenStorageMissing() {
        DatabaseBackupTaskEntity task = task(1L, "0 2 * * *");
        task.setStorageConfigId(null);
        when(this.taskService.getByDatabaseBackupTaskId(1L)).thenReturn(task);
        when(this.storageConfigResolver.resolve(null, null))
                .thenThrow(new ValidationException("no storage configured"));

        this.schedulerService.executeTask(1L);

        verify(this.historyService).finishWithError(eq(this.history), contains("no storage configured"), any());
        verifyNoInteractions(this.dumpFacadeService);
    }

    @Test
    void ShouldSkipWhenTaskDeletedBeforeFire() {
        when(this.taskService.getByDatabaseBackupTaskId(anyLong())).thenReturn(null);

        this.schedulerService.executeTask(9L);

        verifyNoInteractions(this.historyService);
    }

    @Test
    void ShouldKeepSuccessWhenRetentionFails() {
        DatabaseBackupTaskEntity task = task(1L, "0 2 * * *");
        task.setCleanupEnabled(true);
        when(this.taskService.getByDatabaseBackupTaskId(1L)).thenReturn(task);
        when(this.storageConfigResolver.resolve(7L, null)).thenReturn(this.storageConfig);
        when(this.dumpFacadeService.backup(task, this.storageConfig))
                .thenReturn(new DumpResult("a.dump", "backups/orders/a.dump", "local:///a.dump", 0.1));
        when(this.retentionService.cleanup(task, this.storageConfig)).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> this.schedulerService.executeTask(1L));
        verify(this.historyService).finishWithSuccess(any(), any(), any());
        verify(this.historyService, never()).finishWithError(any(), anyString(), any());
    }
}
