package com.backupcenter.server.service.db;

import com.backupcenter.server.model.entity.StorageConfigEntity;
import com.baomidou.mybatisplus.extension.service.IService;

public interface IStorageConfigService extends IService<StorageConfigEntity> {
}
