package com.backupcenter.server.service.agent;

import com.backupcenter.server.enums.CommonStatus;
import com.backupcenter.server.enums.StorageTypeEnum;
import com.backupcenter.server.exception.TransportException;
import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.model.agent.AgentFilesystemInfo;
import com.backupcenter.server.model.agent.AgentHttpResponse;
import com.backupcenter.server.model.agent.AgentTaskExecuteResult;
import com.backupcenter.server.model.agent.AgentTaskPayload;
import com.backupcenter.server.model.entity.AgentEntity;
import com.backupcenter.server.model.entity.FolderBackupTaskEntity;
import com.backupcenter.server.model.entity.StorageConfigEntity;
import com.backupcenter.server.service.db.impl.AgentService;
import com.backupcenter.server.service.db.impl.FolderBackupTaskService;
import com.backupcenter.server.service.storage.StorageConfigData;
import com.backupcenter.server.service.storage.StorageConfigResolver;
import com.backupcenter.server.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Pushes folder backup tasks to the agent that runs them. The folder copy itself happens on the agent.
 */
@Slf4j
@Service
public class AgentTaskRelayService {

    private final AgentClient agentClient;

    private final AgentService agentService;

    private final FolderBackupTaskService folderBackupTaskService;

    private final StorageConfigResolver storageConfigResolver;

    @Autowired
    public AgentTaskRelayService(
            AgentClient agentClient,
            AgentService agentService,
            FolderBackupTaskService folderBackupTaskService,
            StorageConfigResolver storageConfigResolver) {
        this.agentClient = agentClient;
        this.agentService = agentService;
        this.folderBackupTaskService = folderBackupTaskService;
        this.storageConfigResolver = storageConfigResolver;
    }

    public void pushTaskConfig(long folderBackupTaskId) throws ValidationException, TransportException {
        FolderBackupTaskEntity folderTask = this.getFolderTask(folderBackupTaskId);
        AgentEntity agent = this.getAgent(folderTask.getAgentId());
        AgentTaskPayload payload = this.buildPayload(folderTask, true);
        AgentHttpResponse<String> response = this.agentClient.sendTaskConfig(agent, payload);
        if (!response.isSuccess()) {
            throw new TransportException("pushTaskConfig failed. folder task is %s, agent is %s"
                    .formatted(folderTask.getName(), agent.getName()), response.getTransportException());
        }
        log.info("folder task {} pushed to agent {}", folderTask.getName(), agent.getName());
    }

    public AgentTaskExecuteResult triggerTask(long folderBackupTaskId) throws ValidationException {
        FolderBackupTaskEntity folderTask = this.getFolderTask(folderBackupTaskId);
        AgentEntity agent = this.getAgent(folderTask.getAgentId());
        AgentTaskPayload payload = this.buildPayload(folderTask, false);
        AgentHttpResponse<AgentTaskExecuteResult> response = this.agentClient.executeTask(agent, payload);
        AgentTaskExecuteResult result;
        if (response.isSuccess() && ObjectUtils.isNotEmpty(response.getData())) {
            result = response.getData();
        } else {
            result = new AgentTaskExecuteResult();
            result.setSuccess(false);
            result.setError(response.isSuccess()
                    ? "agent returned empty body"
                    : response.getTransportException().getBackupCenterMessage());
        }
        boolean success = Boolean.TRUE.equals(result.getSuccess());
        this.folderBackupTaskService.updateRunState(
                folderBackupTaskId,
                success ? CommonStatus.SUCCESS.getName() : CommonStatus.ERROR.getName(),
                LocalDateTime.now(),
                success ? null : StringUtils.defaultIfBlank(result.getError(), "unknown error"));
        log.info("folder task {} triggered on agent {}. success is {}", folderTask.getName(), agent.getName(), success);
        return result;
    }

    public AgentFilesystemInfo probeFilesystem(long agentId, String path) throws ValidationException, TransportException {
        if (StringUtils.isBlank(path)) {
            throw new ValidationException("probeFilesystem failed. path is blank");
        }
        AgentEntity agent = this.getAgent(agentId);
        AgentHttpResponse<AgentFilesystemInfo> response = this.agentClient.getFilesystemInfo(agent, path);
        if (!response.isSuccess()) {
            throw new TransportException("probeFilesystem failed. agent is %s, path is %s"
                    .formatted(agent.getName(), path), response.getTransportException());
        }
        return response.getData();
    }

    AgentTaskPayload buildPayload(FolderBackupTaskEntity folderTask, boolean withSchedule) throws ValidationException {
        StorageConfigEntity storageConfig =
                this.storageConfigResolver.resolve(folderTask.getStorageConfigId(), folderTask.getS3ConfigId());
        StorageTypeEnum storageType = StorageTypeEnum.fromName(storageConfig.getStorageType());
        AgentTaskPayload payload = new AgentTaskPayload();
        payload.setTaskId(folderTask.getFolderBackupTaskId());
        payload.setSourcePath(folderTask.getSourcePath());
        payload.setCreateArchive(ObjectUtils.defaultIfNull(folderTask.getCreateArchive(), true));
        payload.setArchiveFormat(StringUtils.defaultIfBlank(folderTask.getArchiveFormat(), "tar.gz"));
        payload.setStorageType(storageType.getAgentName());
        payload.setStorageConfig(JsonUtil.toJson(storageConfig.getConfigData()));
        // 旧版 agent 只认 s3 字段
        if (storageType == StorageTypeEnum.OBJECT) {
            StorageConfigData data = new StorageConfigData(storageConfig.getConfigData());
            payload.setS3Endpoint(data.getString("endpoint"));
            payload.setS3AccessKey(data.getString("accessKey"));
            payload.setS3SecretKey(data.getString("secretKey"));
            payload.setS3Bucket(data.getString("bucket"));
            payload.setS3Region(data.getString("region", StorageConfigResolver.DEFAULT_REGION));
        }
        payload.setCleanupEnabled(Boolean.TRUE.equals(folderTask.getCleanupEnabled()));
        payload.setCleanupDays(folderTask.getCleanupDays());
        payload.setIsDockerCompose(Boolean.TRUE.equals(folderTask.getIsDockerCompose()));
        payload.setDockerComposePath(folderTask.getDockerComposePath());
        if (withSchedule) {
            payload.setScheduleCron(folderTask.getScheduleCron());
        }
        return payload;
    }

    private FolderBackupTaskEntity getFolderTask(long folderBackupTaskId) throws ValidationException {
        FolderBackupTaskEntity folderTask = this.folderBackupTaskService.getByFolderBackupTaskId(folderBackupTaskId);
        if (ObjectUtils.isEmpty(folderTask)) {
            throw new ValidationException("folder task %s not found".formatted(folderBackupTaskId));
        }
        return folderTask;
    }

    private AgentEntity getAgent(Long agentId) throws ValidationException {
        AgentEntity agent = this.agentService.getByAgentId(agentId);
        if (ObjectUtils.isEmpty(agent)) {
            throw new ValidationException("agent %s not found".formatted(agentId));
        }
        return agent;
    }
}
