package com.backupcenter.server.model.entity;

import com.backupcenter.server.typehandler.JsonMapTypeHandler;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Map;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName(value = "storage_config", autoResultMap = true)
public class StorageConfigEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long storageConfigId;

    private String name;

    // object, sftp, nfs, local
    private String storageType;

    // 按 storageType 区分的参数, 含密钥, 不打印
    @ToString.Exclude
    @TableField(typeHandler = JsonMapTypeHandler.class)
    private Map<String, Object> configData;

    private LocalDateTime lastCheck;

    private Double freeSpaceGb;

    private Double totalSpaceGb;

    private Double usedSpaceGb;

    // null 表示健康
    private String connectionError;
}
