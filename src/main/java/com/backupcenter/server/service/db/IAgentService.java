package com.backupcenter.server.service.db;

import com.backupcenter.server.model.entity.AgentEntity;
import com.baomidou.mybatisplus.extension.service.IService;

public interface IAgentService extends IService<AgentEntity> {
}
