package com.backupcenter.server.service.notification;

import com.backupcenter.server.util.TimeUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mattermost incoming webhook. A message is posted once; failures are logged and reported as false.
 */
@Slf4j
@Service
public class MattermostService {

    private final RestClient restClient;

    @Value("${backupcenter.server.notification.enabled:false}")
    private boolean enabled;

    @Value("${backupcenter.server.notification.webhookUrl:}")
    private String webhookUrl;

    @Value("${backupcenter.server.notification.username:Backup Server}")
    private String username;

    @Value("${backupcenter.server.notification.iconUrl:https://mattermost.com/wp-content/uploads/2022/02/icon.png}")
    private String iconUrl;

    @Autowired
    public MattermostService(@Qualifier("webhookRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    public boolean sendMessage(String text) {
        if (!this.enabled || StringUtils.isBlank(this.webhookUrl)) {
            log.debug("sendMessage skipped. notification is disabled");
            return false;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", text);
        payload.put("username", this.username);
        payload.put("icon_url", this.iconUrl);
        try {
            HttpStatusCode statusCode = this.restClient.post()
                    .uri(this.webhookUrl)
                    .body(payload)
                    .exchange((httpRequest, httpResponse) -> httpResponse.getStatusCode());
            if (statusCode.value() == 200) {
                return true;
            }
            log.error("sendMessage failed. webhook returned status {}", statusCode.value());
            return false;
        } catch (Exception e) {
            log.error("sendMessage failed. webhook is not reachable", e);
            return false;
        }
    }

    public boolean sendBackupAlert(String taskName, String agentName, String errorMessage) {
        String text = "#### :warning: Backup failed\n\n" +
                "**Task:** %s\n".formatted(taskName) +
                "**Agent:** %s\n".formatted(StringUtils.defaultIfBlank(agentName, "-")) +
                "**Error:** %s\n".formatted(StringUtils.defaultIfBlank(errorMessage, "Unknown error")) +
                "**Time:** %s".formatted(TimeUtil.format(LocalDateTime.now()));
        return this.sendMessage(text);
    }

    public boolean sendReport(String reportText) {
        return this.sendMessage(reportText);
    }
}
