package com.backupcenter.server.mapper;

import com.backupcenter.server.model.entity.LegacyS3ConfigEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface LegacyS3ConfigMapper extends BaseMapper<LegacyS3ConfigEntity> {
}
