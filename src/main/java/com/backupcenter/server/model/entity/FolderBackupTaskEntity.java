package com.backupcenter.server.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.LocalDateTime;

/**
 * Folder backup executed by the agent itself. The server only relays its config and reads back the result.
 */
@EqualsAndHashCode(callSuper = true)
@Data
@TableName("folder_backup_task")
public class FolderBackupTaskEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long folderBackupTaskId;

    private String name;

    private Long agentId;

    private Long storageConfigId;

    private Long s3ConfigId;

    private String sourcePath;

    private String filesystem;

    private String scheduleCron;

    private Boolean scheduleEnabled;

    private Boolean createArchive;

    private String archiveFormat;

    private Boolean isDockerCompose;

    private String dockerComposePath;

    private Boolean cleanupEnabled;

    private Integer cleanupDays;

    private Boolean isActive;

    private LocalDateTime lastRun;

    private LocalDateTime nextRun;

    private String lastStatus;

    private String lastError;
}
