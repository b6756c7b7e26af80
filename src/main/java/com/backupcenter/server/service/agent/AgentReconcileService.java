package com.backupcenter.server.service.agent;

import com.backupcenter.server.enums.AgentBackupStatusEnum;
import com.backupcenter.server.exception.BusinessException;
import com.backupcenter.server.model.agent.AgentBackupInfo;
import com.backupcenter.server.model.agent.AgentBackupsResponse;
import com.backupcenter.server.model.agent.AgentHttpResponse;
import com.backupcenter.server.model.agent.AgentSnapshot;
import com.backupcenter.server.model.agent.AgentSystemInfo;
import com.backupcenter.server.model.entity.AgentBackupRecordEntity;
import com.backupcenter.server.model.entity.AgentEntity;
import com.backupcenter.server.model.entity.FolderBackupTaskEntity;
import com.backupcenter.server.service.db.impl.AgentService;
import com.backupcenter.server.service.db.impl.FolderBackupTaskService;
import com.backupcenter.server.service.notification.MattermostService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Polls every active agent and merges what it reports into the local store. A failure alert is sent
 * once when a folder task's reported status turns into error, not on every poll while it stays there.
 */
@Slf4j
@Service
public class AgentReconcileService {

    private final AgentService agentService;

    private final FolderBackupTaskService folderBackupTaskService;

    private final AgentClient agentClient;

    private final AgentSnapshotWriter agentSnapshotWriter;

    private final MattermostService mattermostService;

    @Autowired
    public AgentReconcileService(
            AgentService agentService,
            FolderBackupTaskService folderBackupTaskService,
            AgentClient agentClient,
            AgentSnapshotWriter agentSnapshotWriter,
            MattermostService mattermostService) {
        this.agentService = agentService;
        this.folderBackupTaskService = folderBackupTaskService;
        this.agentClient = agentClient;
        this.agentSnapshotWriter = agentSnapshotWriter;
        this.mattermostService = mattermostService;
    }

    @Scheduled(
            initialDelayString = "${backupcenter.server.agent.initialDelayMillis:60000}",
            fixedDelayString = "${backupcenter.server.agent.pollIntervalMillis:60000}",
            scheduler = "systemManagementTaskScheduler"
    )
    public void pollAllAgents() {
        List<AgentEntity> agents = this.agentService.getActiveAgents();
        if (CollectionUtils.isEmpty(agents)) {
            return;
        }
        log.debug("Poll {} Agents", agents.size());
        for (AgentEntity agent : agents) {
            try {
                this.pollAgent(agent);
            } catch (Exception e) {
                log.error("pollAgent failed. agent is {}", agent, new BusinessException("pollAgent failed", e));
            }
        }
    }

    /**
     * @return number of alerts sent
     */
    public int pollAgent(AgentEntity agent) {
        LocalDateTime now = LocalDateTime.now();
        // 1. ping
        AgentHttpResponse<String> pingResponse = this.agentClient.ping(agent);
        if (!pingResponse.isSuccess()) {
            log.info("agent {} is offline. {}", agent.getName(), pingResponse.getTransportException().getMessage());
            this.agentSnapshotWriter.writeOffline(agent, now);
            return 0;
        }
        // 2. telemetry 和 backups, 单个调用失败时保留旧数据
        AgentHttpResponse<AgentSystemInfo> systemResponse = this.agentClient.getSystemInfo(agent);
        AgentSystemInfo systemInfo = null;
        if (systemResponse.isSuccess()) {
            systemInfo = systemResponse.getData();
        } else {
            log.warn("getSystemInfo failed. agent is {}", agent.getName(), systemResponse.getTransportException());
        }
        AgentHttpResponse<AgentBackupsResponse> backupsResponse = this.agentClient.getBackups(agent);
        List<AgentBackupInfo> backups = null;
        if (backupsResponse.isSuccess()) {
            AgentBackupsResponse body = backupsResponse.getData();
            backups = ObjectUtils.isEmpty(body) || body.getBackups() == null ? new ArrayList<>() : body.getBackups();
        } else {
            log.warn("getBackups failed. agent is {}", agent.getName(), backupsResponse.getTransportException());
        }
        // 3. 单事务写入
        AgentSnapshot snapshot = this.agentSnapshotWriter.writeOnline(agent, systemInfo, backups, now);
        // 4. 提交后再发送告警
        return this.alertOnTransition(agent, snapshot);
    }

    private int alertOnTransition(AgentEntity agent, AgentSnapshot snapshot) {
        Set<Long> alertedTaskIds = new HashSet<>();
        int alertCount = 0;
        for (AgentBackupRecordEntity record : snapshot.insertedRecords()) {
            Long taskId = record.getFolderBackupTaskId();
            if (!AgentBackupStatusEnum.isError(record.getStatus()) || alertedTaskIds.contains(taskId)) {
                continue;
            }
            String previousStatus = snapshot.previousStatusByTaskId().get(taskId);
            if (AgentBackupStatusEnum.isError(previousStatus)) {
                continue;
            }
            alertedTaskIds.add(taskId);
            FolderBackupTaskEntity folderTask = this.folderBackupTaskService.getByFolderBackupTaskId(taskId);
            String taskName = ObjectUtils.isEmpty(folderTask) ? record.getSourcePath() : folderTask.getName();
            log.warn("folder task {} on agent {} turned to error. {}",
                    taskName, agent.getName(), record.getErrorMessage());
            this.mattermostService.sendBackupAlert(taskName, agent.getName(), record.getErrorMessage());
            alertCount++;
        }
        return alertCount;
    }
}
