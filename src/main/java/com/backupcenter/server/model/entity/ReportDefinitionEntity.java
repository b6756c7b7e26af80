package com.backupcenter.server.model.entity;

import com.backupcenter.server.typehandler.LongListTypeHandler;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.LocalDateTime;
import java.util.List;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName(value = "report_definition", autoResultMap = true)
public class ReportDefinitionEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long reportDefinitionId;

    private String name;

    private String description;

    @TableField(typeHandler = LongListTypeHandler.class)
    private List<Long> selectedAgentIds;

    @TableField(typeHandler = LongListTypeHandler.class)
    private List<Long> selectedDatabaseTaskIds;

    // daily, weekly, hourly, custom_hours
    private String cadence;

    private Integer cadenceHour;

    private Integer cadenceMinute;

    // 0 = Monday ... 6 = Sunday, 和 cron 的约定不同
    private Integer cadenceDayOfWeek;

    private Integer cadenceHoursInterval;

    private Boolean enabled;

    private Boolean sendEnabled;

    private LocalDateTime lastSent;

    // 仅用于展示, 是否发送由 lastSent 和当前时间重新计算
    private LocalDateTime nextSend;
}
