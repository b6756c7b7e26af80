package com.backupcenter.server.service.report;

import com.backupcenter.server.enums.CommonStatus;
import com.backupcenter.server.model.entity.AgentEntity;
import com.backupcenter.server.model.entity.AgentStatusEntity;
import com.backupcenter.server.model.entity.DatabaseBackupTaskEntity;
import com.backupcenter.server.model.entity.FolderBackupTaskEntity;
import com.backupcenter.server.model.entity.ReportDefinitionEntity;
import com.backupcenter.server.service.db.impl.AgentService;
import com.backupcenter.server.service.db.impl.AgentStatusService;
import com.backupcenter.server.service.db.impl.DatabaseBackupHistoryService;
import com.backupcenter.server.service.db.impl.DatabaseBackupTaskService;
import com.backupcenter.server.service.db.impl.FolderBackupTaskService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ReportGeneratorTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 9, 0);

    private AgentService agentService;

    private AgentStatusService agentStatusService;

    private FolderBackupTaskService folderTaskService;

    private DatabaseBackupTaskService databaseTaskService;

    private DatabaseBackupHistoryService historyService;

    private ReportGenerator reportGenerator;

    @BeforeEach
    void setUp() {
        this.agentService = mock(AgentService.class);
        this.agentStatusService = mock(AgentStatusService.class);
        this.folderTaskService = mock(FolderBackupTaskService.class);
        this.databaseTaskService = mock(DatabaseBackupTaskService.class);
        this.historyService = mock(DatabaseBackupHistoryService.class);
        this.reportGenerator = new ReportGenerator(
                this.agentService,
                this.agentStatusService,
                this.folderTaskService,
                this.databaseTaskService,
                this.historyService);
    }

    @Test
    void ShouldRenderSelectedRecordsWhenReportGenerated() {
        AgentEntity agent = new AgentEntity();
        agent.setAgentId(1L);
        agent.setName("web-01");
        agent.setIpAddress("10.0.0.5");
        when(this.agentService.getByAgentIds(List.of(1L))).thenReturn(List.of(agent));

        AgentStatusEntity status = new AgentStatusEntity();
        status.setAgentId(1L);
        status.setIsOnline(true);
        status.setDiskTotalGb(100d);
        status.setDiskFreeGb(25d);
        status.setCpuLoadPercent(12.5);
        when(this.agentStatusService.getByAgentId(1L)).thenReturn(status);

        FolderBackupTaskEntity folderTask = new FolderBackupTaskEntity();
        folderTask.setName("www data");
        folderTask.setSourcePath("/var/www");
        folderTask.setIsActive(true);
        folderTask.setLastStatus("error");
        when(this.folderTaskService.getByAgentId(1L)).thenReturn(List.of(folderTask));

        DatabaseBackupTaskEntity databaseTask = new DatabaseBackupTaskEntity();
        databaseTask.setName("orders nightly");
        databaseTask.setDatabaseName("orders");
        databaseTask.setHost("db.internal");
        databaseTask.setPort(5432);
        databaseTask.setEnabled(true);
        databaseTask.setLastStatus("success");
        databaseTask.setLastRun(NOW.minusHours(7));
        when(this.databaseTaskService.getByDatabaseBackupTaskIds(List.of(3L))).thenReturn(List.of(databaseTask));
        when(this.historyService.countByStatusSince(eq(List.of(3L)), eq(CommonStatus.SUCCESS), eq(NOW.minusHours(24))))
                .thenReturn(4L);
        when(this.historyService.countByStatusSince(eq(List.of(3L)), eq(CommonStatus.ERROR), any()))
                .thenReturn(1L);

        ReportDefinitionEntity report = new ReportDefinitionEntity();
        report.setName("morning");
        report.setSelectedAgentIds(List.of(1L));
        report.setSelectedDatabaseTaskIds(List.of(3L));

        String text = this.reportGenerator.generate(report, NOW);

        assertTrue(text.contains("Backup report - morning"));
        assertTrue(text.contains("**web-01** (10.0.0.5)"));
        assertTrue(text.contains("online"));
        assertTrue(text.contains("- Disk: 75.00 / 100.00 GB (75.0%)"));
        assertTrue(text.contains("- CPU: 12.5%"));
        assertTrue(text.contains("**www data** on web-01"));
        assertTrue(text.contains(":x: error"));
        assertTrue(text.contains("`orders` on db.internal:5432"));
        assertTrue(text.contains("4 succeeded, :x: 1 failed"));
    }

    @Test
    void ShouldRenderCountsOnlyWhenNothingSelected() {
        ReportDefinitionEntity report = new ReportDefinitionEntity();
        report.setName("empty");

        String text = this.reportGenerator.generate(report, NOW);

        assertFalse(text.contains("### Agents"));
        assertTrue(text.contains("0 succeeded, :x: 0 failed"));
        verifyNoInteractions(this.agentService);
    }
}
