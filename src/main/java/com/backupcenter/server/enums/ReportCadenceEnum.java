package com.backupcenter.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum ReportCadenceEnum {

    DAILY("daily"),

    WEEKLY("weekly"),

    HOURLY("hourly"),

    CUSTOM_HOURS("custom_hours"),

    UNKNOWN("unknown")
    ;

    private final String name;

    public static ReportCadenceEnum fromName(String name) {
        if ("customHours".equalsIgnoreCase(name)) {
            return CUSTOM_HOURS;
        }
        for (ReportCadenceEnum value : values()) {
            if (value.name.equalsIgnoreCase(name)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
