package com.backupcenter.server.service.db;

import com.backupcenter.server.model.entity.ReportDefinitionEntity;
import com.baomidou.mybatisplus.extension.service.IService;

public interface IReportDefinitionService extends IService<ReportDefinitionEntity> {
}
