package com.backupcenter.server.service.db;

import com.backupcenter.server.model.entity.ReportHistoryEntity;
import com.baomidou.mybatisplus.extension.service.IService;

public interface IReportHistoryService extends IService<ReportHistoryEntity> {
}
