package com.backupcenter.server.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.LocalDateTime;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName("database_backup_history")
public class DatabaseBackupHistoryEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long databaseBackupHistoryId;

    private Long databaseBackupTaskId;

    private String status;

    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    private Integer durationSeconds;

    private Double artifactSizeMb;

    private String storagePath;

    private String artifactFilename;

    private String errorMessage;
}
