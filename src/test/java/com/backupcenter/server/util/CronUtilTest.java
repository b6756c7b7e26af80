package com.backupcenter.server.util;

import com.backupcenter.server.enums.CronScheduleTypeEnum;
import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.model.schedule.CronSchedule;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CronUtilTest {

    @Test
    void ShouldBuildCronWhenScheduleTypeGiven() {
        assertEquals("* * * * *", CronUtil.toCron(CronScheduleTypeEnum.MINUTELY, null, null, null));
        assertEquals("15 * * * *", CronUtil.toCron(CronScheduleTypeEnum.HOURLY, null, 15, null));
        assertEquals("30 2 * * *", CronUtil.toCron("daily", 2, 30, null));
        assertEquals("0 9 * * 1", CronUtil.toCron("weekly", 9, 0, 1));
    }

    @Test
    void ShouldThrowWhenFieldOutOfRange() {
        assertThrows(ValidationException.class,
                () -> CronUtil.toCron(CronScheduleTypeEnum.DAILY, 24, 0, null));
        assertThrows(ValidationException.class,
                () -> CronUtil.toCron(CronScheduleTypeEnum.HOURLY, null, 60, null));
        assertThrows(ValidationException.class,
                () -> CronUtil.toCron(CronScheduleTypeEnum.WEEKLY, 1, 0, 7));
        assertThrows(ValidationException.class, () -> CronUtil.toCron("yearly", 1, 0, 0));
    }

    @Test
    void ShouldClassifyCronWhenShapeKnown() {
        assertEquals(Optional.of(new CronSchedule(CronScheduleTypeEnum.MINUTELY, null, null, null)),
                CronUtil.fromCron("* * * * *"));
        assertEquals(Optional.of(new CronSchedule(CronScheduleTypeEnum.HOURLY, null, 5, null)),
                CronUtil.fromCron("5 * * * *"));
        assertEquals(Optional.of(new CronSchedule(CronScheduleTypeEnum.DAILY, 2, 30, null)),
                CronUtil.fromCron(" 30 2 * * * "));
        assertEquals(Optional.of(new CronSchedule(CronScheduleTypeEnum.WEEKLY, 9, 0, 0)),
                CronUtil.fromCron("0 9 * * 0"));
    }

    @Test
    void ShouldReturnEmptyWhenCronNotRepresentable() {
        assertTrue(CronUtil.fromCron(null).isEmpty());
        assertTrue(CronUtil.fromCron("").isEmpty());
        assertTrue(CronUtil.fromCron("*/5 * * * *").isEmpty());
        assertTrue(CronUtil.fromCron("0 2 1 * *").isEmpty());
        assertTrue(CronUtil.fromCron("0 0 2 * * *").isEmpty());
        assertTrue(CronUtil.fromCron("0 * * * 1").isEmpty());
    }

    @Test
    void ShouldRoundTripWhenCronBuiltFromIntent() {
        assertRoundTrip(new CronSchedule(CronScheduleTypeEnum.MINUTELY, null, null, null));
        for (int minute = 0; minute <= 59; minute++) {
            assertRoundTrip(new CronSchedule(CronScheduleTypeEnum.HOURLY, null, minute, null));
            for (int hour = 0; hour <= 23; hour++) {
                assertRoundTrip(new CronSchedule(CronScheduleTypeEnum.DAILY, hour, minute, null));
                for (int dayOfWeek = 0; dayOfWeek <= 6; dayOfWeek++) {
                    assertRoundTrip(new CronSchedule(CronScheduleTypeEnum.WEEKLY, hour, minute, dayOfWeek));
                }
            }
        }
    }

    private static void assertRoundTrip(CronSchedule expected) {
        String cron = CronUtil.toCron(expected.type(), expected.hour(), expected.minute(), expected.dayOfWeek());
        assertEquals(Optional.of(expected), CronUtil.fromCron(cron), cron);
    }

    @Test
    void ShouldConvertToSpringCronWhenFiveOrSixFields() {
        assertEquals("0 30 2 * * *", CronUtil.toSpringCron("30 2 * * *"));
        assertEquals("0 30 2 * * *", CronUtil.toSpringCron("15 30 2 * * *"));
        assertThrows(ValidationException.class, () -> CronUtil.toSpringCron("30 2 * *"));
        assertThrows(ValidationException.class, () -> CronUtil.toSpringCron("61 2 * * *"));
        assertThrows(ValidationException.class, () -> CronUtil.toSpringCron(" "));
    }

    @Test
    void ShouldComputeNextFireWhenCronDaily() {
        LocalDateTime after = LocalDateTime.of(2024, 1, 1, 3, 0);
        assertEquals(LocalDateTime.of(2024, 1, 2, 2, 30), CronUtil.nextFire("30 2 * * *", after));
        // cron 的 0 是周日
        assertEquals(LocalDateTime.of(2024, 1, 7, 9, 0), CronUtil.nextFire("0 9 * * 0", after));
    }
}
