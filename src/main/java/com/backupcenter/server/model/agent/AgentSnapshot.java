package com.backupcenter.server.model.agent;

import com.backupcenter.server.model.entity.AgentBackupRecordEntity;

import java.util.List;
import java.util.Map;

/**
 * Result of replacing one agent's backup records.
 *
 * @param insertedRecords        rows written in this poll
 * @param previousStatusByTaskId status of each folder task before the old rows were deleted
 */
public record AgentSnapshot(
        List<AgentBackupRecordEntity> insertedRecords,
        Map<Long, String> previousStatusByTaskId) {

    public static AgentSnapshot empty() {
        return new AgentSnapshot(List.of(), Map.of());
    }
}
