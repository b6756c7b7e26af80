package com.backupcenter.server.service.db.impl;

import com.backupcenter.server.exception.DbException;
import com.backupcenter.server.mapper.ReportDefinitionMapper;
import com.backupcenter.server.model.entity.ReportDefinitionEntity;
import com.backupcenter.server.service.db.IReportDefinitionService;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

@Service
public class ReportDefinitionService
        extends ServiceImpl<ReportDefinitionMapper, ReportDefinitionEntity>
        implements IReportDefinitionService {

    public List<ReportDefinitionEntity> getSendableReports() {
        LambdaQueryWrapper<ReportDefinitionEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(ReportDefinitionEntity::getEnabled, true);
        queryWrapper.eq(ReportDefinitionEntity::getSendEnabled, true);
        return this.list(queryWrapper);
    }

    public void updateSent(long reportDefinitionId, LocalDateTime lastSent, LocalDateTime nextSend)
            throws DbException {
        LambdaUpdateWrapper<ReportDefinitionEntity> updateWrapper = new LambdaUpdateWrapper<>();
        updateWrapper.eq(ReportDefinitionEntity::getReportDefinitionId, reportDefinitionId);
        updateWrapper.set(ReportDefinitionEntity::getLastSent, lastSent);
        updateWrapper.set(ReportDefinitionEntity::getNextSend, nextSend);
        boolean updated = this.update(updateWrapper);
        if (!updated) {
            throw new DbException("updateSent failed. can't write to database. reportDefinitionId is %s"
                    .formatted(reportDefinitionId));
        }
    }
}
