package com.backupcenter.server.service.schedule;

import com.backupcenter.server.exception.BackupCenterException;
import com.backupcenter.server.exception.BusinessException;
import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.model.dump.DumpResult;
import com.backupcenter.server.model.entity.DatabaseBackupHistoryEntity;
import com.backupcenter.server.model.entity.DatabaseBackupTaskEntity;
import com.backupcenter.server.model.entity.StorageConfigEntity;
import com.backupcenter.server.service.db.impl.DatabaseBackupHistoryService;
import com.backupcenter.server.service.db.impl.DatabaseBackupTaskService;
import com.backupcenter.server.service.dump.DatabaseDumpFacadeService;
import com.backupcenter.server.service.storage.StorageConfigResolver;
import com.backupcenter.server.util.CronUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.stream.Collectors;

/**
 * Keeps one cron trigger per enabled, schedule-enabled database task and runs the dump when it fires.
 * <p>
 * The live job set is owned by this service. Only {@link #resync()}, {@link #start()} and {@link #stop()}
 * mutate it; a firing trigger only reads the task id it was created with.
 */
@Slf4j
@Service
public class TaskSchedulerService {

    public static final String JOB_ID_PREFIX = "database_task_";

    private static final int MAX_ERROR_LENGTH = 4000;

    private final TaskScheduler backupJobScheduler;

    private final DatabaseBackupTaskService databaseBackupTaskService;

    private final DatabaseBackupHistoryService databaseBackupHistoryService;

    private final DatabaseDumpFacadeService databaseDumpFacadeService;

    private final StorageConfigResolver storageConfigResolver;

    private final RetentionService retentionService;

    // jobId -> live trigger
    private final Map<String, LiveJob> liveJobs = new ConcurrentHashMap<>();

    // 同一个 task 同一时间只跑一次
    private final Set<Long> runningTaskIds = ConcurrentHashMap.newKeySet();

    private volatile boolean started = false;

    @Value("${backupcenter.server.scheduler.zone:}")
    private String zone;

    @Autowired
    public TaskSchedulerService(
            @Qualifier("backupJobScheduler") TaskScheduler backupJobScheduler,
            DatabaseBackupTaskService databaseBackupTaskService,
            DatabaseBackupHistoryService databaseBackupHistoryService,
            DatabaseDumpFacadeService databaseDumpFacadeService,
            StorageConfigResolver storageConfigResolver,
            RetentionService retentionService) {
        this.backupJobScheduler = backupJobScheduler;
        this.databaseBackupTaskService = databaseBackupTaskService;
        this.databaseBackupHistoryService = databaseBackupHistoryService;
        this.databaseDumpFacadeService = databaseDumpFacadeService;
        this.storageConfigResolver = storageConfigResolver;
        this.retentionService = retentionService;
    }

    public void start() {
        log.info("Start Task Scheduler");
        this.started = true;
        this.resync();
    }

    public void stop() {
        log.info("Stop Task Scheduler. cancel {} live jobs", this.liveJobs.size());
        this.started = false;
        this.liveJobs.values().forEach(liveJob -> liveJob.future().cancel(false));
        this.liveJobs.clear();
    }

    @Scheduled(
            initialDelayString = "${backupcenter.server.scheduler.resyncIntervalMillis:300000}",
            fixedDelayString = "${backupcenter.server.scheduler.resyncIntervalMillis:300000}",
            scheduler = "systemManagementTaskScheduler"
    )
    public void resync() {
        if (!this.started) {
            return;
        }
        log.info("Resync Database Backup Jobs");
        List<DatabaseBackupTaskEntity> activeTasks = this.databaseBackupTaskService.getSchedulableTasks();
        Set<String> activeJobIds = activeTasks.stream()
                .map(task -> getJobId(task.getDatabaseBackupTaskId()))
                .collect(Collectors.toSet());
        // 1. 删除已经不在 active 集合中的 job
        for (String jobId : Set.copyOf(this.liveJobs.keySet())) {
            if (!activeJobIds.contains(jobId)) {
                this.removeJob(jobId);
                log.info("job {} removed. task is no longer active", jobId);
            }
        }
        // 2. 逐个重建 trigger
        for (DatabaseBackupTaskEntity task : activeTasks) {
            try {
                this.upsertJob(task);
            } catch (Exception e) {
                this.removeJob(getJobId(task.getDatabaseBackupTaskId()));
                log.error("resync skipped task {}. cron is {}", task.getName(), task.getScheduleCron(),
                        new BusinessException("upsertJob failed", e));
            }
        }
    }

    /**
     * Runs one database task now on the calling thread, exactly as a trigger fire does. Every failure
     * ends in an error history row; nothing is thrown.
     */
    public void executeTask(long taskId) {
        if (!this.runningTaskIds.add(taskId)) {
            log.warn("executeTask skipped. task {} is already running", taskId);
            return;
        }
        try {
            this.doExecuteTask(taskId);
        } catch (Exception e) {
            // history 行写入失败等情况
            log.error("executeTask failed. taskId is {}", taskId, new BusinessException("executeTask failed", e));
        } finally {
            this.runningTaskIds.remove(taskId);
        }
    }

    @Async("generalTaskScheduler")
    public void runNow(long taskId) {
        log.info("run now requested for task {}", taskId);
        this.executeTask(taskId);
    }

    @Async("generalTaskScheduler")
    public CompletableFuture<Void> restore(long taskId, String storageUri, String targetDatabase) {
        DatabaseBackupTaskEntity task = this.databaseBackupTaskService.getByDatabaseBackupTaskId(taskId);
        if (ObjectUtils.isEmpty(task)) {
            return CompletableFuture.failedFuture(
                    new ValidationException("restore failed. task %s not found".formatted(taskId)));
        }
        try {
            StorageConfigEntity storageConfig =
                    this.storageConfigResolver.resolve(task.getStorageConfigId(), task.getS3ConfigId());
            this.databaseDumpFacadeService.restore(task, storageConfig, storageUri, targetDatabase);
            return CompletableFuture.completedFuture(null);
        } catch (BackupCenterException e) {
            log.error("restore failed. task is {}, uri is {}", task.getName(), storageUri, e);
            return CompletableFuture.failedFuture(e);
        }
    }

    // jobId -> taskId
    public Map<String, Long> getLiveJobs() {
        Map<String, Long> result = new HashMap<>();
        this.liveJobs.forEach((jobId, liveJob) -> result.put(jobId, liveJob.taskId()));
        return Collections.unmodifiableMap(result);
    }

    public static String getJobId(long taskId) {
        return JOB_ID_PREFIX + taskId;
    }

    private void doExecuteTask(long taskId) {
        // 1. 每次都从数据库重新读取 task
        DatabaseBackupTaskEntity task = this.databaseBackupTaskService.getByDatabaseBackupTaskId(taskId);
        if (ObjectUtils.isEmpty(task)) {
            log.warn("executeTask skipped. task {} not found", taskId);
            return;
        }
        log.info("execute database backup task {}", task.getName());
        // 2. running
        DatabaseBackupHistoryEntity history =
                this.databaseBackupHistoryService.startExecution(task, LocalDateTime.now());
        StorageConfigEntity storageConfig;
        try {
            // 3. 解析存储并执行
            storageConfig = this.storageConfigResolver.resolve(task.getStorageConfigId(), task.getS3ConfigId());
            DumpResult dumpResult = this.databaseDumpFacadeService.backup(task, storageConfig);
            this.databaseBackupHistoryService.finishWithSuccess(history, dumpResult, LocalDateTime.now());
        } catch (Exception e) {
            String errorMessage = e instanceof BackupCenterException backupCenterException
                    ? backupCenterException.getBackupCenterMessage()
                    : e.toString();
            log.error("database backup task {} failed", task.getName(), e);
            this.databaseBackupHistoryService.finishWithError(
                    history, StringUtils.abbreviate(errorMessage, MAX_ERROR_LENGTH), LocalDateTime.now());
            this.refreshNextRun(task);
            return;
        }
        // 4. 成功后清理过期文件
        if (Boolean.TRUE.equals(task.getCleanupEnabled())) {
            try {
                this.retentionService.cleanup(task, storageConfig);
            } catch (Exception e) {
                log.error("cleanup of task {} failed", task.getName(), e);
            }
        }
        this.refreshNextRun(task);
    }

    private void upsertJob(DatabaseBackupTaskEntity task) throws ValidationException {
        long taskId = task.getDatabaseBackupTaskId();
        String jobId = getJobId(taskId);
        if (StringUtils.isBlank(task.getScheduleCron())) {
            throw new ValidationException("task %s has no scheduleCron".formatted(task.getName()));
        }
        String springCron = CronUtil.toSpringCron(task.getScheduleCron());
        // remove then recreate
        this.removeJob(jobId);
        ScheduledFuture<?> future = this.backupJobScheduler.schedule(
                () -> this.executeTask(taskId),
                new CronTrigger(springCron, this.getZoneId()));
        if (future == null) {
            throw new ValidationException("cron %s never fires".formatted(task.getScheduleCron()));
        }
        this.liveJobs.put(jobId, new LiveJob(taskId, springCron, future));
        this.databaseBackupTaskService.updateNextRun(taskId, this.nextRun(springCron));
    }

    private void refreshNextRun(DatabaseBackupTaskEntity task) {
        LiveJob liveJob = this.liveJobs.get(getJobId(task.getDatabaseBackupTaskId()));
        if (liveJob == null) {
            return;
        }
        try {
            this.databaseBackupTaskService.updateNextRun(
                    task.getDatabaseBackupTaskId(), this.nextRun(liveJob.springCron()));
        } catch (BackupCenterException e) {
            log.warn("refreshNextRun failed. task is {}", task.getName(), e);
        }
    }

    private LocalDateTime nextRun(String springCron) {
        ZoneId zoneId = this.getZoneId();
        ZonedDateTime next = CronExpression.parse(springCron).next(ZonedDateTime.now(zoneId));
        return next == null ? null : next.withZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime();
    }

    private void removeJob(String jobId) {
        LiveJob removed = this.liveJobs.remove(jobId);
        if (removed != null) {
            removed.future().cancel(false);
        }
    }

    private ZoneId getZoneId() {
        return StringUtils.isBlank(this.zone) ? ZoneId.systemDefault() : ZoneId.of(this.zone);
    }

    private record LiveJob(long taskId, String springCron, ScheduledFuture<?> future) {
    }
}
