package com.backupcenter.server.service.db.impl;

import com.backupcenter.server.exception.DbException;
import com.backupcenter.server.mapper.AgentStatusMapper;
import com.backupcenter.server.model.agent.AgentSystemInfo;
import com.backupcenter.server.model.entity.AgentStatusEntity;
import com.backupcenter.server.service.db.IAgentStatusService;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

@Service
public class AgentStatusService
        extends ServiceImpl<AgentStatusMapper, AgentStatusEntity>
        implements IAgentStatusService {

    public AgentStatusEntity getByAgentId(long agentId) {
        LambdaQueryWrapper<AgentStatusEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(AgentStatusEntity::getAgentId, agentId);
        return this.getOne(queryWrapper);
    }

    // 整行覆盖 agent 上报的 telemetry
    public AgentStatusEntity markOnline(
            long agentId, AgentSystemInfo systemInfo, LocalDateTime now) throws DbException {
        AgentStatusEntity agentStatusEntity = this.getOrCreate(agentId);
        if (ObjectUtils.isNotEmpty(systemInfo)) {
            agentStatusEntity.setDiskFreeGb(systemInfo.getDiskFreeGb());
            agentStatusEntity.setDiskTotalGb(systemInfo.getDiskTotalGb());
            agentStatusEntity.setMemoryFreeMb(systemInfo.getMemoryFreeMb());
            agentStatusEntity.setMemoryTotalMb(systemInfo.getMemoryTotalMb());
            agentStatusEntity.setCpuLoadPercent(systemInfo.getCpuLoadPercent());
            agentStatusEntity.setNetworkRxMb(systemInfo.getNetworkRxMb());
            agentStatusEntity.setNetworkTxMb(systemInfo.getNetworkTxMb());
        }
        agentStatusEntity.setIsOnline(true);
        agentStatusEntity.setLastUpdate(now);
        this.saveStatus(agentStatusEntity);
        return agentStatusEntity;
    }

    public AgentStatusEntity markOffline(long agentId, LocalDateTime now) throws DbException {
        AgentStatusEntity agentStatusEntity = this.getOrCreate(agentId);
        agentStatusEntity.setIsOnline(false);
        agentStatusEntity.setLastUpdate(now);
        this.saveStatus(agentStatusEntity);
        return agentStatusEntity;
    }

    private AgentStatusEntity getOrCreate(long agentId) {
        AgentStatusEntity agentStatusEntity = this.getByAgentId(agentId);
        if (ObjectUtils.isEmpty(agentStatusEntity)) {
            agentStatusEntity = new AgentStatusEntity();
            agentStatusEntity.setAgentId(agentId);
        }
        return agentStatusEntity;
    }

    private void saveStatus(AgentStatusEntity agentStatusEntity) throws DbException {
        boolean saved = this.saveOrUpdate(agentStatusEntity);
        if (!saved) {
            throw new DbException("saveStatus failed. can't write to database. agentId is %s"
                    .formatted(agentStatusEntity.getAgentId()));
        }
    }
}
