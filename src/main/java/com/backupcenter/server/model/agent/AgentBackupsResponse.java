package com.backupcenter.server.model.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentBackupsResponse {

    private List<AgentBackupInfo> backups = new ArrayList<>();
}
