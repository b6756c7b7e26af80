package com.backupcenter.server.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

@Slf4j
public class TimeUtil {

    // 14 位时间戳, 用于 dump 文件名
    public static final DateTimeFormatter ARTIFACT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    public static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * Parses an ISO-8601 date reported by an agent. Offset forms are converted to the system zone,
     * local forms are taken as is. Anything else yields null.
     */
    public static LocalDateTime parseIsoDateTime(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                    value.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.atZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime();
            }
            return (LocalDateTime) parsed;
        } catch (DateTimeParseException e) {
            log.debug("parseIsoDateTime failed. value is {}", value);
            return null;
        }
    }

    public static Instant toInstant(LocalDateTime localDateTime) {
        return localDateTime == null ? null : localDateTime.atZone(ZoneId.systemDefault()).toInstant();
    }

    public static String format(LocalDateTime localDateTime) {
        return localDateTime == null ? "-" : DISPLAY.format(localDateTime);
    }
}
