package com.backupcenter.server.service.db;

import com.backupcenter.server.model.entity.FolderBackupTaskEntity;
import com.baomidou.mybatisplus.extension.service.IService;

public interface IFolderBackupTaskService extends IService<FolderBackupTaskEntity> {
}
