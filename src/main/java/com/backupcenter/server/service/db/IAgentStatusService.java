package com.backupcenter.server.service.db;

import com.backupcenter.server.model.entity.AgentStatusEntity;
import com.baomidou.mybatisplus.extension.service.IService;

public interface IAgentStatusService extends IService<AgentStatusEntity> {
}
