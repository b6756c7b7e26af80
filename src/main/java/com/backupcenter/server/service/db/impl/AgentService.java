package com.backupcenter.server.service.db.impl;

import com.backupcenter.server.exception.DbException;
import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.mapper.AgentMapper;
import com.backupcenter.server.model.entity.AgentEntity;
import com.backupcenter.server.service.db.IAgentService;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

@Service
public class AgentService extends ServiceImpl<AgentMapper, AgentEntity> implements IAgentService {

    public AgentEntity getByAgentId(Long agentId) throws ValidationException {
        if (ObjectUtils.isEmpty(agentId)) {
            throw new ValidationException("getByAgentId failed. agentId is null");
        }
        LambdaQueryWrapper<AgentEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(AgentEntity::getAgentId, agentId);
        return this.getOne(queryWrapper);
    }

    public List<AgentEntity> getActiveAgents() {
        LambdaQueryWrapper<AgentEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(AgentEntity::getIsActive, true);
        queryWrapper.orderByAsc(AgentEntity::getAgentId);
        return this.list(queryWrapper);
    }

    public List<AgentEntity> getByAgentIds(Collection<Long> agentIds) {
        if (CollectionUtils.isEmpty(agentIds)) {
            return Collections.emptyList();
        }
        LambdaQueryWrapper<AgentEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.in(AgentEntity::getAgentId, agentIds);
        return this.list(queryWrapper);
    }

    public void updateLastSeen(long agentId, LocalDateTime lastSeen) throws DbException {
        LambdaUpdateWrapper<AgentEntity> updateWrapper = new LambdaUpdateWrapper<>();
        updateWrapper.eq(AgentEntity::getAgentId, agentId);
        updateWrapper.set(AgentEntity::getLastSeen, lastSeen);
        boolean updated = this.update(updateWrapper);
        if (!updated) {
            throw new DbException("updateLastSeen failed. can't write to database. agentId is %s".formatted(agentId));
        }
    }
}
