package com.backupcenter.server.model.schedule;

import com.backupcenter.server.enums.CronScheduleTypeEnum;

/**
 * Human schedule intent behind a 5-field cron string. Fields that the type does not use are null.
 * dayOfWeek follows cron: 0 = Sunday ... 6 = Saturday.
 */
public record CronSchedule(CronScheduleTypeEnum type, Integer hour, Integer minute, Integer dayOfWeek) {
}
