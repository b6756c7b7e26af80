package com.backupcenter.server.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.LocalDateTime;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName("agent")
public class AgentEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long agentId;

    private String name;

    private String ipAddress;

    private Integer port;

    private String hostname;

    private Boolean isActive;

    private LocalDateTime lastSeen;

    // agent 的默认存储
    private Long storageConfigId;
}
