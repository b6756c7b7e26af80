package com.backupcenter.server.service.db.impl;

import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.mapper.LegacyS3ConfigMapper;
import com.backupcenter.server.model.entity.LegacyS3ConfigEntity;
import com.backupcenter.server.service.db.ILegacyS3ConfigService;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.stereotype.Service;

@Service
public class LegacyS3ConfigService
        extends ServiceImpl<LegacyS3ConfigMapper, LegacyS3ConfigEntity>
        implements ILegacyS3ConfigService {

    public LegacyS3ConfigEntity getByLegacyS3ConfigId(Long legacyS3ConfigId) throws ValidationException {
        if (ObjectUtils.isEmpty(legacyS3ConfigId)) {
            throw new ValidationException("getByLegacyS3ConfigId failed. legacyS3ConfigId is null");
        }
        LambdaQueryWrapper<LegacyS3ConfigEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(LegacyS3ConfigEntity::getLegacyS3ConfigId, legacyS3ConfigId);
        return this.getOne(queryWrapper);
    }
}
