package com.backupcenter.server.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@Slf4j
public class ThreadPoolConfig {

    // @Async 的手动执行和恢复请求
    @Bean(name = "generalTaskScheduler")
    public ThreadPoolTaskScheduler generalTaskScheduler() {
        return this.buildScheduler(10, "General-Task-Thread-");
    }

    // 注解启动的定时任务, 使用这个
    @Bean(name = "systemManagementTaskScheduler")
    public ThreadPoolTaskScheduler systemManagementTaskScheduler() {
        return this.buildScheduler(4, "System-Management-Thread-");
    }

    // cron 触发的数据库备份任务, 和 resync 分开
    @Bean(name = "backupJobScheduler")
    public ThreadPoolTaskScheduler backupJobScheduler() {
        return this.buildScheduler(8, "Backup-Job-Thread-");
    }

    private ThreadPoolTaskScheduler buildScheduler(int poolSize, String threadNamePrefix) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix(threadNamePrefix);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.setErrorHandler(t -> log.error("{} task failed", threadNamePrefix, t));
        scheduler.initialize();
        return scheduler;
    }
}
