package com.backupcenter.server.util;

import com.backupcenter.server.enums.ReportCadenceEnum;
import com.backupcenter.server.model.entity.ReportDefinitionEntity;
import org.apache.commons.lang3.ObjectUtils;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Cadence rules for report definitions.
 * <p>
 * {@link #shouldFire} is the source of truth and is re-derived from {@code lastSent} and the current
 * minute on every pass. {@link #nextFire} only feeds the displayed {@code nextSend}.
 * <p>
 * Report weekdays use 0 = Monday ... 6 = Sunday, which differs from cron.
 */
public class ReportCadenceUtil {

    private static final long SECONDS_PER_HOUR = 3600L;

    public static boolean shouldFire(ReportDefinitionEntity report, LocalDateTime now) {
        if (ObjectUtils.anyNull(report, now)) {
            return false;
        }
        Integer hour = report.getCadenceHour();
        Integer minute = report.getCadenceMinute();
        LocalDateTime lastSent = report.getLastSent();
        ReportCadenceEnum cadence = ReportCadenceEnum.fromName(report.getCadence());
        switch (cadence) {
            case DAILY -> {
                if (ObjectUtils.anyNull(hour, minute) || !matchHourMinute(now, hour, minute)) {
                    return false;
                }
                // 今天还没发过
                return lastSent == null || lastSent.toLocalDate().isBefore(now.toLocalDate());
            }
            case WEEKLY -> {
                Integer dayOfWeek = report.getCadenceDayOfWeek();
                if (ObjectUtils.anyNull(dayOfWeek, hour, minute)
                        || weekdayIndex(now) != dayOfWeek
                        || !matchHourMinute(now, hour, minute)) {
                    return false;
                }
                return lastSent == null
                        || ChronoUnit.DAYS.between(lastSent.toLocalDate(), now.toLocalDate()) >= 7;
            }
            case HOURLY -> {
                if (minute == null || now.getMinute() != minute) {
                    return false;
                }
                return lastSent == null || elapsedSeconds(lastSent, now) >= SECONDS_PER_HOUR;
            }
            case CUSTOM_HOURS -> {
                Integer interval = report.getCadenceHoursInterval();
                if (ObjectUtils.anyNull(interval, minute) || interval <= 0 || now.getMinute() != minute) {
                    return false;
                }
                return lastSent == null || elapsedSeconds(lastSent, now) >= interval * SECONDS_PER_HOUR;
            }
            default -> {
                return false;
            }
        }
    }

    /**
     * Next instant at which {@link #shouldFire} would return true, assuming the report is not sent
     * before then. Null when the definition is incomplete.
     */
    public static LocalDateTime nextFire(ReportDefinitionEntity report, LocalDateTime now) {
        if (ObjectUtils.anyNull(report, now)) {
            return null;
        }
        Integer hour = report.getCadenceHour();
        Integer minute = report.getCadenceMinute();
        LocalDateTime lastSent = report.getLastSent();
        LocalDateTime base = now.truncatedTo(ChronoUnit.MINUTES);
        ReportCadenceEnum cadence = ReportCadenceEnum.fromName(report.getCadence());
        switch (cadence) {
            case DAILY -> {
                if (ObjectUtils.anyNull(hour, minute)) {
                    return null;
                }
                LocalDateTime candidate = base.withHour(hour).withMinute(minute);
                if (candidate.isBefore(base)) {
                    candidate = candidate.plusDays(1);
                }
                // 当天已经发过则从下一天开始
                if (lastSent != null && !lastSent.toLocalDate().isBefore(candidate.toLocalDate())) {
                    candidate = lastSent.toLocalDate().plusDays(1).atTime(hour, minute);
                }
                return candidate;
            }
            case WEEKLY -> {
                Integer dayOfWeek = report.getCadenceDayOfWeek();
                if (ObjectUtils.anyNull(dayOfWeek, hour, minute)) {
                    return null;
                }
                LocalDateTime candidate = base
                        .plusDays(dayOfWeek - weekdayIndex(base))
                        .withHour(hour)
                        .withMinute(minute);
                if (candidate.isBefore(base)) {
                    candidate = candidate.plusDays(7);
                }
                // 距离上次发送不足 7 天则顺延一周
                while (lastSent != null
                        && ChronoUnit.DAYS.between(lastSent.toLocalDate(), candidate.toLocalDate()) < 7) {
                    candidate = candidate.plusDays(7);
                }
                return candidate;
            }
            case HOURLY -> {
                if (minute == null) {
                    return null;
                }
                return nextSlot(base, minute, lastSent, 1);
            }
            case CUSTOM_HOURS -> {
                Integer interval = report.getCadenceHoursInterval();
                if (ObjectUtils.anyNull(interval, minute) || interval <= 0) {
                    return null;
                }
                return nextSlot(base, minute, lastSent, interval);
            }
            default -> {
                return null;
            }
        }
    }

    // 0 = Monday ... 6 = Sunday
    public static int weekdayIndex(LocalDateTime dateTime) {
        return dateTime.getDayOfWeek().getValue() - 1;
    }

    // first hh:minute slot at or after base that is at least intervalHours after lastSent
    private static LocalDateTime nextSlot(
            LocalDateTime base, int minute, LocalDateTime lastSent, int intervalHours) {
        LocalDateTime candidate = base.withMinute(minute);
        if (candidate.isBefore(base)) {
            candidate = candidate.plusHours(1);
        }
        if (lastSent == null) {
            return candidate;
        }
        LocalDateTime earliest = lastSent.truncatedTo(ChronoUnit.MINUTES).plusHours(intervalHours);
        if (candidate.isBefore(earliest)) {
            candidate = earliest.withMinute(minute);
            if (candidate.isBefore(earliest)) {
                candidate = candidate.plusHours(1);
            }
        }
        return candidate;
    }

    // 按分钟截断后比较, 避免每分钟轮询的秒级漂移导致漏发
    private static long elapsedSeconds(LocalDateTime from, LocalDateTime to) {
        return Duration.between(
                from.truncatedTo(ChronoUnit.MINUTES),
                to.truncatedTo(ChronoUnit.MINUTES)).getSeconds();
    }

    private static boolean matchHourMinute(LocalDateTime now, int hour, int minute) {
        return now.getHour() == hour && now.getMinute() == minute;
    }
}
