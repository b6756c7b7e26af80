package com.backupcenter.server.enums;

import lombok.Getter;

import java.util.List;

@Getter
public enum StorageTypeEnum {

    OBJECT("object", "s3", List.of("endpoint", "accessKey", "secretKey", "bucket", "region")),

    // password 或 privateKeyPath 二选一, 在 factory 中单独校验
    SFTP("sftp", "sftp", List.of("host", "username", "basePath")),

    NFS("nfs", "nfs", List.of("server", "exportPath", "mountPoint")),

    LOCAL("local", "local", List.of("basePath")),

    UNKNOWN("unknown", "unknown", List.of())
    ;

    private final String name;

    // 远程 agent 使用的名字, object storage 在 agent 侧叫 s3
    private final String agentName;

    private final List<String> requiredKeys;

    StorageTypeEnum(String name, String agentName, List<String> requiredKeys) {
        this.name = name;
        this.agentName = agentName;
        this.requiredKeys = requiredKeys;
    }

    public static StorageTypeEnum fromName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        // 兼容旧数据中的 s3
        if ("s3".equalsIgnoreCase(name)) {
            return OBJECT;
        }
        for (StorageTypeEnum value : values()) {
            if (value.name.equalsIgnoreCase(name)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
