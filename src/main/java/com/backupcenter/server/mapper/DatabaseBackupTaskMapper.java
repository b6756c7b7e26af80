package com.backupcenter.server.mapper;

import com.backupcenter.server.model.entity.DatabaseBackupTaskEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface DatabaseBackupTaskMapper extends BaseMapper<DatabaseBackupTaskEntity> {
}
