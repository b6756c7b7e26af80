package com.backupcenter.server.util;

import com.backupcenter.server.enums.CronScheduleTypeEnum;
import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.model.schedule.CronSchedule;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.scheduling.support.CronExpression;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Translation between schedule intents and 5-field cron strings ("minute hour day month dayOfWeek"),
 * plus conversion to the 6-field form Spring's scheduler expects.
 */
@Slf4j
public class CronUtil {

    private static final String WILDCARD = "*";

    public static String toCron(
            String scheduleType,
            Integer hour,
            Integer minute,
            Integer dayOfWeek) throws ValidationException {
        return toCron(CronScheduleTypeEnum.fromName(scheduleType), hour, minute, dayOfWeek);
    }

    public static String toCron(
            CronScheduleTypeEnum scheduleType,
            Integer hour,
            Integer minute,
            Integer dayOfWeek) throws ValidationException {
        if (ObjectUtils.isEmpty(scheduleType)) {
            throw new ValidationException("toCron failed. scheduleType is null");
        }
        int m = checkRange("minute", ObjectUtils.defaultIfNull(minute, 0), 0, 59);
        int h = checkRange("hour", ObjectUtils.defaultIfNull(hour, 0), 0, 23);
        int d = checkRange("dayOfWeek", ObjectUtils.defaultIfNull(dayOfWeek, 0), 0, 6);
        return switch (scheduleType) {
            case MINUTELY -> "* * * * *";
            case HOURLY -> "%d * * * *".formatted(m);
            case DAILY -> "%d %d * * *".formatted(m, h);
            case WEEKLY -> "%d %d * * %d".formatted(m, h, d);
        };
    }

    /**
     * Classifies a 5-field cron string. The shapes are tried in order: all wildcards, minute only,
     * minute and hour, minute hour and day-of-week. Anything else, including 6-field expressions,
     * a fixed day-of-month or month, and non-numeric fields such as {@code *}{@code /5}, is empty.
     */
    public static Optional<CronSchedule> fromCron(String cron) {
        if (StringUtils.isBlank(cron)) {
            return Optional.empty();
        }
        String[] parts = StringUtils.split(cron.trim());
        if (parts.length != 5) {
            return Optional.empty();
        }
        String minute = parts[0];
        String hour = parts[1];
        String day = parts[2];
        String month = parts[3];
        String dayOfWeek = parts[4];
        if (!WILDCARD.equals(day) || !WILDCARD.equals(month)) {
            return Optional.empty();
        }
        boolean minuteFixed = !WILDCARD.equals(minute);
        boolean hourFixed = !WILDCARD.equals(hour);
        boolean dayOfWeekFixed = !WILDCARD.equals(dayOfWeek);
        // 1. 每分钟
        if (!minuteFixed && !hourFixed && !dayOfWeekFixed) {
            return Optional.of(new CronSchedule(CronScheduleTypeEnum.MINUTELY, null, null, null));
        }
        Integer m = parseField(minute, 0, 59);
        // 2. 每小时
        if (minuteFixed && !hourFixed && !dayOfWeekFixed) {
            return m == null ?
                    Optional.empty() :
                    Optional.of(new CronSchedule(CronScheduleTypeEnum.HOURLY, null, m, null));
        }
        Integer h = parseField(hour, 0, 23);
        // 3. 每天
        if (minuteFixed && hourFixed && !dayOfWeekFixed) {
            return ObjectUtils.anyNull(m, h) ?
                    Optional.empty() :
                    Optional.of(new CronSchedule(CronScheduleTypeEnum.DAILY, h, m, null));
        }
        // 4. 每周
        if (minuteFixed && hourFixed) {
            Integer d = parseField(dayOfWeek, 0, 6);
            return ObjectUtils.anyNull(m, h, d) ?
                    Optional.empty() :
                    Optional.of(new CronSchedule(CronScheduleTypeEnum.WEEKLY, h, m, d));
        }
        return Optional.empty();
    }

    /**
     * Converts a stored cron string to Spring's 6-field form. A 5-field string gets a zero seconds
     * field; a 6-field string has its seconds field replaced with zero.
     */
    public static String toSpringCron(String cron) throws ValidationException {
        if (StringUtils.isBlank(cron)) {
            throw new ValidationException("toSpringCron failed. cron is blank");
        }
        String[] parts = StringUtils.split(cron.trim());
        String result;
        if (parts.length == 5) {
            result = "0 " + String.join(" ", parts);
        } else if (parts.length == 6) {
            log.debug("cron {} has a seconds field. it is dropped", cron);
            parts[0] = "0";
            result = String.join(" ", parts);
        } else {
            throw new ValidationException("toSpringCron failed. cron must have 5 or 6 fields. cron is %s"
                    .formatted(cron));
        }
        if (!CronExpression.isValidExpression(result)) {
            throw new ValidationException("toSpringCron failed. cron can't be parsed. cron is %s".formatted(cron));
        }
        return result;
    }

    public static LocalDateTime nextFire(String cron, LocalDateTime after) throws ValidationException {
        CronExpression cronExpression = CronExpression.parse(toSpringCron(cron));
        return cronExpression.next(after);
    }

    private static int checkRange(String name, int value, int min, int max) throws ValidationException {
        if (value < min || value > max) {
            throw new ValidationException("toCron failed. %s must be in [%d, %d]. value is %d"
                    .formatted(name, min, max, value));
        }
        return value;
    }

    private static Integer parseField(String field, int min, int max) {
        try {
            int value = Integer.parseInt(field);
            return value < min || value > max ? null : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
