package com.backupcenter.server.service.db.impl;

import com.backupcenter.server.enums.CommonStatus;
import com.backupcenter.server.exception.DbException;
import com.backupcenter.server.mapper.ReportHistoryMapper;
import com.backupcenter.server.model.entity.ReportHistoryEntity;
import com.backupcenter.server.service.db.IReportHistoryService;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

@Service
public class ReportHistoryService
        extends ServiceImpl<ReportHistoryMapper, ReportHistoryEntity>
        implements IReportHistoryService {

    public ReportHistoryEntity addReportHistory(
            long reportDefinitionId,
            LocalDateTime sentAt,
            CommonStatus status,
            String errorMessage) throws DbException {
        ReportHistoryEntity reportHistoryEntity = new ReportHistoryEntity();
        reportHistoryEntity.setReportDefinitionId(reportDefinitionId);
        reportHistoryEntity.setSentAt(sentAt);
        reportHistoryEntity.setStatus(status.getName());
        reportHistoryEntity.setErrorMessage(errorMessage);
        boolean saved = this.save(reportHistoryEntity);
        if (!saved) {
            throw new DbException("addReportHistory failed. can't write to database.");
        }
        return reportHistoryEntity;
    }

    public List<ReportHistoryEntity> getByReportDefinitionId(long reportDefinitionId) {
        LambdaQueryWrapper<ReportHistoryEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(ReportHistoryEntity::getReportDefinitionId, reportDefinitionId);
        queryWrapper.orderByAsc(ReportHistoryEntity::getReportHistoryId);
        return this.list(queryWrapper);
    }
}
