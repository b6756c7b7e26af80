package com.backupcenter.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum AgentBackupStatusEnum {

    SUCCESS("success"),

    ERROR("error"),

    UPLOADING("uploading"),

    UNKNOWN("unknown")
    ;

    private final String name;

    public static AgentBackupStatusEnum fromName(String name) {
        for (AgentBackupStatusEnum value : values()) {
            if (value.name.equalsIgnoreCase(name)) {
                return value;
            }
        }
        return UNKNOWN;
    }

    public static boolean isError(String name) {
        return fromName(name) == ERROR;
    }
}
