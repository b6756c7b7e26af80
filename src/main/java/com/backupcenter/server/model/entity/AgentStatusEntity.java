package com.backupcenter.server.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.LocalDateTime;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName("agent_status")
public class AgentStatusEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long agentStatusId;

    // one-to-one with agent
    private Long agentId;

    private Double diskFreeGb;

    private Double diskTotalGb;

    private Double memoryFreeMb;

    private Double memoryTotalMb;

    private Double cpuLoadPercent;

    private Double networkRxMb;

    private Double networkTxMb;

    private Boolean isOnline;

    private LocalDateTime lastUpdate;
}
