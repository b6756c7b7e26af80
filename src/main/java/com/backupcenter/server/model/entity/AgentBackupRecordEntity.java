package com.backupcenter.server.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.LocalDateTime;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName("agent_backup_record")
public class AgentBackupRecordEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long agentBackupRecordId;

    private Long agentId;

    private Long folderBackupTaskId;

    private String sourcePath;

    private String archiveName;

    private LocalDateTime backupDate;

    private LocalDateTime uploadDate;

    private Double artifactSizeMb;

    private String storagePath;

    // success, error, uploading
    private String status;

    private String errorMessage;
}
