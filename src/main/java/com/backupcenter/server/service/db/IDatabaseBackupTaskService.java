package com.backupcenter.server.service.db;

import com.backupcenter.server.model.entity.DatabaseBackupTaskEntity;
import com.baomidou.mybatisplus.extension.service.IService;

public interface IDatabaseBackupTaskService extends IService<DatabaseBackupTaskEntity> {
}
