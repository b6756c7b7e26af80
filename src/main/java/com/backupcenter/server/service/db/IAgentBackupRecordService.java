package com.backupcenter.server.service.db;

import com.backupcenter.server.model.entity.AgentBackupRecordEntity;
import com.baomidou.mybatisplus.extension.service.IService;

public interface IAgentBackupRecordService extends IService<AgentBackupRecordEntity> {
}
