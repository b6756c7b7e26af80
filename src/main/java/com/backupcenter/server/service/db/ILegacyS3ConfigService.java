package com.backupcenter.server.service.db;

import com.backupcenter.server.model.entity.LegacyS3ConfigEntity;
import com.baomidou.mybatisplus.extension.service.IService;

public interface ILegacyS3ConfigService extends IService<LegacyS3ConfigEntity> {
}
