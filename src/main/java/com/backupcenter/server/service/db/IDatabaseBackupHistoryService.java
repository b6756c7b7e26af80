package com.backupcenter.server.service.db;

import com.backupcenter.server.model.entity.DatabaseBackupHistoryEntity;
import com.baomidou.mybatisplus.extension.service.IService;

public interface IDatabaseBackupHistoryService extends IService<DatabaseBackupHistoryEntity> {
}
