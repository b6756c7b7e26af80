package com.backupcenter.server.service.agent;

import com.backupcenter.server.model.agent.AgentBackupsResponse;
import com.backupcenter.server.model.agent.AgentFilesystemInfo;
import com.backupcenter.server.model.agent.AgentFilesystemRequest;
import com.backupcenter.server.model.agent.AgentHttpResponse;
import com.backupcenter.server.model.agent.AgentSystemInfo;
import com.backupcenter.server.model.agent.AgentTaskExecuteResult;
import com.backupcenter.server.model.agent.AgentTaskPayload;
import com.backupcenter.server.model.entity.AgentEntity;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

/**
 * HTTP client for the remote agent. Every call returns an {@link AgentHttpResponse}; nothing is thrown.
 */
@Slf4j
@Service
public class AgentClient {

    public static final int DEFAULT_AGENT_PORT = 11540;

    private final RestClient restClient;

    @Autowired
    public AgentClient(@Qualifier("agentRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    public AgentHttpResponse<String> ping(AgentEntity agent) {
        return this.handleClientResponse(
                this.restClient.get().uri(getBaseUrl(agent) + "/ping"),
                String.class);
    }

    public AgentHttpResponse<AgentSystemInfo> getSystemInfo(AgentEntity agent) {
        return this.handleClientResponse(
                this.restClient.get().uri(getBaseUrl(agent) + "/api/system"),
                AgentSystemInfo.class);
    }

    public AgentHttpResponse<AgentFilesystemInfo> getFilesystemInfo(AgentEntity agent, String path) {
        return this.handleClientResponse(
                this.restClient.post().uri(getBaseUrl(agent) + "/api/filesystem")
                        .body(new AgentFilesystemRequest(path)),
                AgentFilesystemInfo.class);
    }

    public AgentHttpResponse<String> sendTaskConfig(AgentEntity agent, AgentTaskPayload payload) {
        return this.handleClientResponse(
                this.restClient.post().uri(getBaseUrl(agent) + "/api/task/config").body(payload),
                String.class);
    }

    public AgentHttpResponse<AgentTaskExecuteResult> executeTask(AgentEntity agent, AgentTaskPayload payload) {
        return this.handleClientResponse(
                this.restClient.post().uri(getBaseUrl(agent) + "/api/task/execute").body(payload),
                AgentTaskExecuteResult.class);
    }

    public AgentHttpResponse<AgentBackupsResponse> getBackups(AgentEntity agent) {
        return this.handleClientResponse(
                this.restClient.get().uri(getBaseUrl(agent) + "/api/backups"),
                AgentBackupsResponse.class);
    }

    public static String getBaseUrl(AgentEntity agent) {
        int port = ObjectUtils.defaultIfNull(agent.getPort(), DEFAULT_AGENT_PORT);
        return "http://%s:%d".formatted(agent.getIpAddress(), port);
    }

    private <T> AgentHttpResponse<T> handleClientResponse(
            RestClient.RequestHeadersSpec<?> requestSpec,
            Class<T> dataType) {
        try {
            return requestSpec.exchange((httpRequest, httpResponse) -> {
                HttpStatusCode statusCode = httpResponse.getStatusCode();
                if (statusCode.is2xxSuccessful()) {
                    return AgentHttpResponse.success(statusCode.value(), httpResponse.bodyTo(dataType));
                } else {
                    // 非 2xx
                    return AgentHttpResponse.error(statusCode.value(), httpResponse.bodyTo(String.class));
                }
            });
        } catch (Exception e) {
            // 连接失败, 超时, 反序列化失败
            log.debug("agent request failed", e);
            return AgentHttpResponse.error(e);
        }
    }
}
