package com.backupcenter.server.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDateTime;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName("database_backup_task")
public class DatabaseBackupTaskEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long databaseBackupTaskId;

    private String name;

    // 优先使用 storageConfigId, 为空时回退到 s3ConfigId
    private Long storageConfigId;

    private Long s3ConfigId;

    // connection
    private String host;

    private Integer port;

    private String username;

    @ToString.Exclude
    private String encryptedPassword;

    private String databaseName;

    // dump options
    private String dumpFormat;

    private Integer compressionLevel;

    private Boolean includeSchema;

    private Boolean includeData;

    private Boolean includeRoles;

    private Boolean includeTablespaces;

    // schedule
    private String scheduleCron;

    private Boolean scheduleEnabled;

    private Boolean enabled;

    // retention
    private Boolean cleanupEnabled;

    private Integer cleanupDays;

    // run state
    private LocalDateTime lastRun;

    private LocalDateTime nextRun;

    private String lastStatus;

    private String lastError;
}
