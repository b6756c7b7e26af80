package com.backupcenter.server.service.db.impl;

import com.backupcenter.server.exception.DbException;
import com.backupcenter.server.mapper.AgentBackupRecordMapper;
import com.backupcenter.server.model.entity.AgentBackupRecordEntity;
import com.backupcenter.server.service.db.IAgentBackupRecordService;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import org.apache.commons.collections4.CollectionUtils;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class AgentBackupRecordService
        extends ServiceImpl<AgentBackupRecordMapper, AgentBackupRecordEntity>
        implements IAgentBackupRecordService {

    public List<AgentBackupRecordEntity> getByAgentId(long agentId) {
        LambdaQueryWrapper<AgentBackupRecordEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(AgentBackupRecordEntity::getAgentId, agentId);
        return this.list(queryWrapper);
    }

    public void deleteByAgentId(long agentId) {
        LambdaQueryWrapper<AgentBackupRecordEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(AgentBackupRecordEntity::getAgentId, agentId);
        this.remove(queryWrapper);
    }

    public void addRecords(List<AgentBackupRecordEntity> records) throws DbException {
        if (CollectionUtils.isEmpty(records)) {
            return;
        }
        for (AgentBackupRecordEntity record : records) {
            boolean saved = this.save(record);
            if (!saved) {
                throw new DbException("addRecords failed. can't write to database. record is %s"
                        .formatted(record));
            }
        }
    }
}
