package com.backupcenter.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

// 数据库任务, 历史记录, 报表记录共用的状态
@AllArgsConstructor
@Getter
public enum CommonStatus {

    RUNNING("running"),

    SUCCESS("success"),

    ERROR("error"),

    UNKNOWN("unknown")
    ;

    private final String name;

    public static CommonStatus fromName(String name) {
        for (CommonStatus value : values()) {
            if (value.name.equalsIgnoreCase(name)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
