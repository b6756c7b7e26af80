package com.backupcenter.server.service.agent;

import com.backupcenter.server.enums.AgentBackupStatusEnum;
import com.backupcenter.server.exception.DbException;
import com.backupcenter.server.model.agent.AgentBackupInfo;
import com.backupcenter.server.model.agent.AgentSnapshot;
import com.backupcenter.server.model.agent.AgentSystemInfo;
import com.backupcenter.server.model.entity.AgentBackupRecordEntity;
import com.backupcenter.server.model.entity.AgentEntity;
import com.backupcenter.server.model.entity.FolderBackupTaskEntity;
import com.backupcenter.server.service.db.impl.AgentBackupRecordService;
import com.backupcenter.server.service.db.impl.AgentService;
import com.backupcenter.server.service.db.impl.AgentStatusService;
import com.backupcenter.server.service.db.impl.FolderBackupTaskService;
import com.backupcenter.server.util.TimeUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes one agent's poll result in a single transaction, so a failure leaves the previous snapshot
 * in place.
 */
@Slf4j
@Component
public class AgentSnapshotWriter {

    private final AgentService agentService;

    private final AgentStatusService agentStatusService;

    private final AgentBackupRecordService agentBackupRecordService;

    private final FolderBackupTaskService folderBackupTaskService;

    @Autowired
    public AgentSnapshotWriter(
            AgentService agentService,
            AgentStatusService agentStatusService,
            AgentBackupRecordService agentBackupRecordService,
            FolderBackupTaskService folderBackupTaskService) {
        this.agentService = agentService;
        this.agentStatusService = agentStatusService;
        this.agentBackupRecordService = agentBackupRecordService;
        this.folderBackupTaskService = folderBackupTaskService;
    }

    @Transactional
    public void writeOffline(AgentEntity agent, LocalDateTime now) throws DbException {
        this.agentStatusService.markOffline(agent.getAgentId(), now);
    }

    /**
     * @param systemInfo null when the telemetry call failed, the previous values are kept
     * @param backups    null when the backups call failed, the previous records are kept
     */
    @Transactional
    public AgentSnapshot writeOnline(
            AgentEntity agent,
            AgentSystemInfo systemInfo,
            List<AgentBackupInfo> backups,
            LocalDateTime now) throws DbException {
        long agentId = agent.getAgentId();
        // 1. telemetry
        this.agentStatusService.markOnline(agentId, systemInfo, now);
        if (ObjectUtils.isNotEmpty(systemInfo)) {
            this.agentService.updateLastSeen(agentId, now);
        }
        if (backups == null) {
            return AgentSnapshot.empty();
        }
        // 2. 删除前先记下每个 task 的旧状态
        Map<Long, String> previousStatusByTaskId = new HashMap<>();
        latestByTaskId(this.agentBackupRecordService.getByAgentId(agentId))
                .forEach((taskId, oldRecord) -> previousStatusByTaskId.put(taskId, oldRecord.getStatus()));
        this.agentBackupRecordService.deleteByAgentId(agentId);
        // 3. 按 sourcePath 匹配 folder task 后重新插入
        Map<String, FolderBackupTaskEntity> taskBySourcePath = new HashMap<>();
        for (FolderBackupTaskEntity folderTask : this.folderBackupTaskService.getByAgentId(agentId)) {
            taskBySourcePath.put(folderTask.getSourcePath(), folderTask);
        }
        List<AgentBackupRecordEntity> reportedRecords = new ArrayList<>();
        for (AgentBackupInfo backup : backups) {
            FolderBackupTaskEntity folderTask = taskBySourcePath.get(backup.getSourcePath());
            if (ObjectUtils.isEmpty(folderTask)) {
                log.debug("agent {} reported backup of unknown path {}", agent.getName(), backup.getSourcePath());
                continue;
            }
            reportedRecords.add(toRecord(agentId, folderTask, backup));
        }
        // 每个 (agentId, taskId) 只保留一行
        List<AgentBackupRecordEntity> insertedRecords = new ArrayList<>(latestByTaskId(reportedRecords).values());
        if (insertedRecords.size() < reportedRecords.size()) {
            log.debug("agent {} reported {} backups for {} tasks. kept the latest per task",
                    agent.getName(), reportedRecords.size(), insertedRecords.size());
        }
        this.agentBackupRecordService.addRecords(insertedRecords);
        return new AgentSnapshot(insertedRecords, previousStatusByTaskId);
    }

    /**
     * Collapses records to one per folder task: the latest {@code backupDate} wins and a dated record
     * beats an undated one. Otherwise the later entry in the list wins.
     */
    static Map<Long, AgentBackupRecordEntity> latestByTaskId(List<AgentBackupRecordEntity> records) {
        Map<Long, AgentBackupRecordEntity> result = new LinkedHashMap<>();
        for (AgentBackupRecordEntity record : records) {
            Long taskId = record.getFolderBackupTaskId();
            if (taskId == null) {
                continue;
            }
            AgentBackupRecordEntity current = result.get(taskId);
            if (current == null || !isOlder(record, current)) {
                result.put(taskId, record);
            }
        }
        return result;
    }

    private static boolean isOlder(AgentBackupRecordEntity candidate, AgentBackupRecordEntity current) {
        if (current.getBackupDate() == null) {
            return false;
        }
        return candidate.getBackupDate() == null || candidate.getBackupDate().isBefore(current.getBackupDate());
    }

    private static AgentBackupRecordEntity toRecord(
            long agentId, FolderBackupTaskEntity folderTask, AgentBackupInfo backup) {
        AgentBackupRecordEntity record = new AgentBackupRecordEntity();
        record.setAgentId(agentId);
        record.setFolderBackupTaskId(folderTask.getFolderBackupTaskId());
        record.setSourcePath(backup.getSourcePath());
        record.setArchiveName(backup.getArchiveName());
        record.setBackupDate(TimeUtil.parseIsoDateTime(backup.getBackupDate()));
        record.setUploadDate(TimeUtil.parseIsoDateTime(backup.getS3UploadDate()));
        record.setArtifactSizeMb(backup.getArchiveSizeMb());
        record.setStoragePath(backup.getS3Path());
        record.setStatus(StringUtils.defaultIfBlank(backup.getStatus(), AgentBackupStatusEnum.UNKNOWN.getName()));
        record.setErrorMessage(backup.getErrorMessage());
        return record;
    }
}
