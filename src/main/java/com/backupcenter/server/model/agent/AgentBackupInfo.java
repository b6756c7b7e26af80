package com.backupcenter.server.model.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * One entry of {@code GET /api/backups}. Dates stay raw strings here, the reconciler parses them
 * and turns anything unparseable into null.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentBackupInfo {

    private String sourcePath;

    private String archiveName;

    private String backupDate;

    private String s3UploadDate;

    private Double archiveSizeMb;

    private String s3Path;

    // success, error, uploading
    private String status;

    private String errorMessage;
}
