package com.backupcenter.server.enums;

import com.backupcenter.server.exception.ValidationException;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum CronScheduleTypeEnum {

    MINUTELY("minutely"),

    HOURLY("hourly"),

    DAILY("daily"),

    WEEKLY("weekly")
    ;

    private final String name;

    public static CronScheduleTypeEnum fromName(String name) throws ValidationException {
        for (CronScheduleTypeEnum value : values()) {
            if (value.name.equalsIgnoreCase(name)) {
                return value;
            }
        }
        throw new ValidationException("unsupported schedule type %s".formatted(name));
    }
}
