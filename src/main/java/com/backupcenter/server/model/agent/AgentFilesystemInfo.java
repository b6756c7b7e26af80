package com.backupcenter.server.model.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

// POST /api/filesystem
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentFilesystemInfo {

    private String device;

    private String mountPoint;

    private String filesystem;

    private Double totalGb;

    private Double usedGb;

    private Double availableGb;

    private Double usedPercent;
}
