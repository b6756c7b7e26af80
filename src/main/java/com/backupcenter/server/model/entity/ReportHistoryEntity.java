package com.backupcenter.server.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.LocalDateTime;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName("report_history")
public class ReportHistoryEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long reportHistoryId;

    private Long reportDefinitionId;

    private LocalDateTime sentAt;

    private String status;

    private String errorMessage;
}
