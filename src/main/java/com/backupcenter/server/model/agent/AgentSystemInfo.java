package com.backupcenter.server.model.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

// GET /api/system
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentSystemInfo {

    private Double diskFreeGb;

    private Double diskTotalGb;

    private Double memoryFreeMb;

    private Double memoryTotalMb;

    private Double cpuLoadPercent;

    private Double networkRxMb;

    private Double networkTxMb;
}
