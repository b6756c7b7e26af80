package com.backupcenter.server.model.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.ToString;

/**
 * Body of {@code POST /api/task/config} and {@code POST /api/task/execute}.
 * The execute call leaves {@code scheduleCron} null so it is not serialized.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentTaskPayload {

    private Long taskId;

    private String sourcePath;

    private Boolean createArchive;

    private String archiveFormat;

    // agent 旧协议的 s3 字段, object storage 时填充
    private String s3Endpoint;

    private String s3AccessKey;

    @ToString.Exclude
    private String s3SecretKey;

    private String s3Bucket;

    private String s3Region;

    // s3, sftp, nfs, local
    private String storageType;

    // JSON 字符串, 含密钥
    @ToString.Exclude
    private String storageConfig;

    private Boolean cleanupEnabled;

    private Integer cleanupDays;

    private Boolean isDockerCompose;

    private String dockerComposePath;

    private String scheduleCron;
}
