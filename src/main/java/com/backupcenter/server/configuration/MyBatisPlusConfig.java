package com.backupcenter.server.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MyBatisPlusConfig {

    @Bean
    public BackupCenterMetaObjectHandler metaObjectHandler() {
        return new BackupCenterMetaObjectHandler();
    }
}
