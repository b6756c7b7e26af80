package com.backupcenter.server.mapper;

import com.backupcenter.server.model.entity.DatabaseBackupHistoryEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface DatabaseBackupHistoryMapper extends BaseMapper<DatabaseBackupHistoryEntity> {
}
