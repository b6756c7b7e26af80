package com.backupcenter.server.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Flat object-storage record kept for tasks created before generic storage configs existed.
 */
@EqualsAndHashCode(callSuper = true)
@Data
@TableName("legacy_s3_config")
public class LegacyS3ConfigEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long legacyS3ConfigId;

    private String name;

    private String endpoint;

    private String accessKey;

    @ToString.Exclude
    private String secretKey;

    private String bucketName;

    private String region;

    private Boolean useSsl;
}
