package com.backupcenter.server.service.report;

import com.backupcenter.server.enums.CommonStatus;
import com.backupcenter.server.exception.BusinessException;
import com.backupcenter.server.model.entity.ReportDefinitionEntity;
import com.backupcenter.server.service.db.impl.ReportDefinitionService;
import com.backupcenter.server.service.db.impl.ReportHistoryService;
import com.backupcenter.server.service.notification.MattermostService;
import com.backupcenter.server.util.ReportCadenceUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Slf4j
@Service
public class ReportScheduleService {

    private final ReportDefinitionService reportDefinitionService;

    private final ReportHistoryService reportHistoryService;

    private final ReportGenerator reportGenerator;

    private final MattermostService mattermostService;

    @Value("${backupcenter.server.report.zone:}")
    private String zone;

    @Autowired
    public ReportScheduleService(
            ReportDefinitionService reportDefinitionService,
            ReportHistoryService reportHistoryService,
            ReportGenerator reportGenerator,
            MattermostService mattermostService) {
        this.reportDefinitionService = reportDefinitionService;
        this.reportHistoryService = reportHistoryService;
        this.reportGenerator = reportGenerator;
        this.mattermostService = mattermostService;
    }

    @Scheduled(
            initialDelayString = "${backupcenter.server.report.initialDelayMillis:60000}",
            fixedDelayString = "${backupcenter.server.report.checkIntervalMillis:60000}",
            scheduler = "systemManagementTaskScheduler"
    )
    public void checkReports() {
        this.checkReports(LocalDateTime.now(this.getZoneId()).truncatedTo(ChronoUnit.MINUTES));
    }

    /**
     * @return number of reports that fired
     */
    public int checkReports(LocalDateTime now) {
        List<ReportDefinitionEntity> reports = this.reportDefinitionService.getSendableReports();
        if (CollectionUtils.isEmpty(reports)) {
            return 0;
        }
        int fired = 0;
        for (ReportDefinitionEntity report : reports) {
            try {
                if (ReportCadenceUtil.shouldFire(report, now)) {
                    this.sendReport(report, now);
                    fired++;
                }
            } catch (Exception e) {
                log.error("checkReports failed. report is {}", report, new BusinessException("sendReport failed", e));
            }
        }
        return fired;
    }

    public boolean sendReport(ReportDefinitionEntity report, LocalDateTime now) {
        String errorMessage = null;
        boolean sent = false;
        try {
            String text = this.reportGenerator.generate(report, now);
            sent = this.mattermostService.sendReport(text);
            if (!sent) {
                errorMessage = "webhook did not accept the report";
            }
        } catch (Exception e) {
            log.error("generate report {} failed", report.getName(), e);
            errorMessage = StringUtils.abbreviate(e.toString(), 2000);
        }
        // 发送失败也推进 lastSent, 同一周期内不再重复触发
        this.reportHistoryService.addReportHistory(
                report.getReportDefinitionId(),
                now,
                sent ? CommonStatus.SUCCESS : CommonStatus.ERROR,
                errorMessage);
        report.setLastSent(now);
        LocalDateTime nextSend = ReportCadenceUtil.nextFire(report, now);
        this.reportDefinitionService.updateSent(report.getReportDefinitionId(), now, nextSend);
        report.setNextSend(nextSend);
        log.info("report {} sent is {}. next send at {}", report.getName(), sent, nextSend);
        return sent;
    }

    private ZoneId getZoneId() {
        return StringUtils.isBlank(this.zone) ? ZoneId.systemDefault() : ZoneId.of(this.zone);
    }
}
