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
import com.backupcenter.server.util.TimeUtil;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Markdown report text for a report definition's selected agents and database tasks.
 */
@Component
public class ReportGenerator {

    private final AgentService agentService;

    private final AgentStatusService agentStatusService;

    private final FolderBackupTaskService folderBackupTaskService;

    private final DatabaseBackupTaskService databaseBackupTaskService;

    private final DatabaseBackupHistoryService databaseBackupHistoryService;

    @Autowired
    public ReportGenerator(
            AgentService agentService,
            AgentStatusService agentStatusService,
            FolderBackupTaskService folderBackupTaskService,
            DatabaseBackupTaskService databaseBackupTaskService,
            DatabaseBackupHistoryService databaseBackupHistoryService) {
        this.agentService = agentService;
        this.agentStatusService = agentStatusService;
        this.folderBackupTaskService = folderBackupTaskService;
        this.databaseBackupTaskService = databaseBackupTaskService;
        this.databaseBackupHistoryService = databaseBackupHistoryService;
    }

    public String generate(ReportDefinitionEntity report, LocalDateTime now) {
        StringBuilder sb = new StringBuilder();
        sb.append("## :bar_chart: Backup report");
        if (StringUtils.isNotBlank(report.getName())) {
            sb.append(" - ").append(report.getName());
        }
        sb.append("\n\n**Generated at:** ").append(TimeUtil.format(now)).append("\n\n");
        List<AgentEntity> agents = CollectionUtils.isEmpty(report.getSelectedAgentIds())
                ? List.of()
                : this.agentService.getByAgentIds(report.getSelectedAgentIds());
        if (!agents.isEmpty()) {
            this.appendAgents(sb, agents);
            this.appendFolderTasks(sb, agents);
        }
        List<Long> databaseTaskIds = report.getSelectedDatabaseTaskIds();
        if (CollectionUtils.isNotEmpty(databaseTaskIds)) {
            this.appendDatabaseTasks(sb, this.databaseBackupTaskService.getByDatabaseBackupTaskIds(databaseTaskIds));
        }
        // 最近 24 小时统计
        sb.append("### Last 24 hours\n\n");
        LocalDateTime since = now.minusHours(24);
        long successCount = this.databaseBackupHistoryService.countByStatusSince(
                databaseTaskIds, CommonStatus.SUCCESS, since);
        long errorCount = this.databaseBackupHistoryService.countByStatusSince(
                databaseTaskIds, CommonStatus.ERROR, since);
        sb.append("- Database backups: :white_check_mark: %d succeeded, :x: %d failed\n"
                .formatted(successCount, errorCount));
        sb.append("\n---\n*Generated by backup center*");
        return sb.toString();
    }

    private void appendAgents(StringBuilder sb, List<AgentEntity> agents) {
        sb.append("### Agents\n\n");
        for (AgentEntity agent : agents) {
            sb.append("**%s** (%s)\n".formatted(agent.getName(), agent.getIpAddress()));
            AgentStatusEntity status = this.agentStatusService.getByAgentId(agent.getAgentId());
            if (ObjectUtils.isEmpty(status)) {
                sb.append("- Status: :warning: unknown\n\n");
                continue;
            }
            sb.append("- Status: %s\n".formatted(
                    Boolean.TRUE.equals(status.getIsOnline()) ? ":large_green_circle: online" : ":red_circle: offline"));
            if (isPositive(status.getDiskTotalGb()) && status.getDiskFreeGb() != null) {
                double used = status.getDiskTotalGb() - status.getDiskFreeGb();
                sb.append(String.format(Locale.ROOT, "- Disk: %.2f / %.2f GB (%.1f%%)\n",
                        used, status.getDiskTotalGb(), used / status.getDiskTotalGb() * 100));
            }
            if (isPositive(status.getMemoryTotalMb()) && status.getMemoryFreeMb() != null) {
                double used = status.getMemoryTotalMb() - status.getMemoryFreeMb();
                sb.append(String.format(Locale.ROOT, "- Memory: %.2f / %.2f MB (%.1f%%)\n",
                        used, status.getMemoryTotalMb(), used / status.getMemoryTotalMb() * 100));
            }
            if (status.getCpuLoadPercent() != null) {
                sb.append(String.format(Locale.ROOT, "- CPU: %.1f%%\n", status.getCpuLoadPercent()));
            }
            sb.append('\n');
        }
    }

    private void appendFolderTasks(StringBuilder sb, List<AgentEntity> agents) {
        sb.append("### Folder backup tasks\n\n");
        boolean any = false;
        for (AgentEntity agent : agents) {
            for (FolderBackupTaskEntity folderTask : this.folderBackupTaskService.getByAgentId(agent.getAgentId())) {
                any = true;
                sb.append("**%s** on %s\n".formatted(folderTask.getName(), agent.getName()));
                sb.append("- Path: `%s`\n".formatted(folderTask.getSourcePath()));
                sb.append("- Active: %s\n".formatted(Boolean.TRUE.equals(folderTask.getIsActive()) ? "yes" : "no"));
                appendRunState(sb, folderTask.getLastStatus(), folderTask.getLastRun());
                sb.append('\n');
            }
        }
        if (!any) {
            sb.append("No folder tasks for the selected agents\n\n");
        }
    }

    private void appendDatabaseTasks(StringBuilder sb, List<DatabaseBackupTaskEntity> databaseTasks) {
        sb.append("### Database backup tasks\n\n");
        if (databaseTasks.isEmpty()) {
            sb.append("No database tasks selected\n\n");
            return;
        }
        for (DatabaseBackupTaskEntity task : databaseTasks) {
            sb.append("**%s**\n".formatted(task.getName()));
            sb.append("- Database: `%s` on %s:%s\n".formatted(task.getDatabaseName(), task.getHost(), task.getPort()));
            sb.append("- Enabled: %s\n".formatted(Boolean.TRUE.equals(task.getEnabled()) ? "yes" : "no"));
            appendRunState(sb, task.getLastStatus(), task.getLastRun());
            sb.append('\n');
        }
    }

    private static void appendRunState(StringBuilder sb, String lastStatus, LocalDateTime lastRun) {
        if (StringUtils.isNotBlank(lastStatus)) {
            sb.append("- Last status: %s %s\n".formatted(statusIcon(lastStatus), lastStatus));
        }
        if (lastRun != null) {
            sb.append("- Last run: %s\n".formatted(TimeUtil.format(lastRun)));
        }
    }

    private static String statusIcon(String status) {
        return switch (CommonStatus.fromName(status)) {
            case SUCCESS -> ":white_check_mark:";
            case ERROR -> ":x:";
            default -> ":hourglass:";
        };
    }

    private static boolean isPositive(Double value) {
        return value != null && value > 0;
    }
}
