package com.backupcenter.server.mapper;

import com.backupcenter.server.model.entity.AgentBackupRecordEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface AgentBackupRecordMapper extends BaseMapper<AgentBackupRecordEntity> {
}
