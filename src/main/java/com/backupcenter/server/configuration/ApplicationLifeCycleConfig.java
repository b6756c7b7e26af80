package com.backupcenter.server.configuration;

import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.service.schedule.TaskSchedulerService;
import com.backupcenter.server.service.secret.CredentialCipherService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

@Configuration
@Slf4j
public class ApplicationLifeCycleConfig {

    @Value("${spring.profiles.active:prod}")
    private String activeProfile;

    private final CredentialCipherService credentialCipherService;

    private final TaskSchedulerService taskSchedulerService;

    @Autowired
    public ApplicationLifeCycleConfig(
            CredentialCipherService credentialCipherService,
            TaskSchedulerService taskSchedulerService) {
        this.credentialCipherService = credentialCipherService;
        this.taskSchedulerService = taskSchedulerService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startUp() {
        log.info("Starting up {} environment", this.activeProfile);
        // key 无效时各任务在解密时单独失败, 这里只提示
        try {
            this.credentialCipherService.validateKey();
        } catch (ValidationException e) {
            log.error("encryption key is missing or invalid. database backups will fail until it is configured.", e);
        }
        // 启动调度, 包含一次初始 resync
        this.taskSchedulerService.start();
    }

    @PreDestroy
    public void shutDown() {
        log.info("Shutting down, cancel all backup jobs");
        this.taskSchedulerService.stop();
    }
}
