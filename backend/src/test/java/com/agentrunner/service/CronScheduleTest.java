package com.agentrunner.service;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronScheduleTest {

    // Tuesday
    private static final LocalDateTime TUESDAY_OCT_27 = LocalDateTime.of(2026, 10, 27, 0, 0);

    @Test
    void parse_everyMinute_firesOnNextMinute() {
        CronSchedule cron = CronSchedule.parse("* * * * *");

        assertThat(cron.next(LocalDateTime.of(2026, 10, 19, 10, 15, 30)))
                .isEqualTo(LocalDateTime.of(2026, 10, 19, 10, 16));
    }

    @Test
    void parse_topOfHour_skipsToNextHour() {
        CronSchedule cron = CronSchedule.parse("0 * * * *");

        assertThat(cron.next(LocalDateTime.of(2026, 10, 19, 10, 15)))
                .isEqualTo(LocalDateTime.of(2026, 10, 19, 11, 0));
    }

    @Test
    void parse_surroundingWhitespace_isTrimmed() {
        CronSchedule cron = CronSchedule.parse("  */15 * * * *  ");

        assertThat(cron.getExpression()).isEqualTo("*/15 * * * *");
        assertThat(cron.next(LocalDateTime.of(2026, 10, 19, 10, 1)))
                .isEqualTo(LocalDateTime.of(2026, 10, 19, 10, 15));
    }

    @Test
    void parse_weekdayRange_skipsWeekend() {
        CronSchedule cron = CronSchedule.parse("0 9 * * 1-5");

        // Saturday 2026-10-24 -> Monday 2026-10-26
        assertThat(cron.next(LocalDateTime.of(2026, 10, 24, 12, 0)))
                .isEqualTo(LocalDateTime.of(2026, 10, 26, 9, 0));
    }

    @Test
    void parse_dayOfMonthAndDayOfWeekRestricted_matchesEither() {
        CronSchedule cron = CronSchedule.parse("0 0 1 * 1");

        LocalDateTime first = cron.next(TUESDAY_OCT_27);
        LocalDateTime second = cron.next(first);

        // Sunday the 1st, then Monday the 2nd
        assertThat(first).isEqualTo(LocalDateTime.of(2026, 11, 1, 0, 0));
        assertThat(second).isEqualTo(LocalDateTime.of(2026, 11, 2, 0, 0));
    }

    @Test
    void parse_onlyDayOfMonthRestricted_ignoresWeekday() {
        CronSchedule cron = CronSchedule.parse("0 0 1 * *");

        assertThat(cron.next(TUESDAY_OCT_27)).isEqualTo(LocalDateTime.of(2026, 11, 1, 0, 0));
        assertThat(cron.next(LocalDateTime.of(2026, 11, 1, 0, 0))).isEqualTo(LocalDateTime.of(2026, 12, 1, 0, 0));
    }

    @Test
    void parse_onlyDayOfWeekRestricted_ignoresDayOfMonth() {
        CronSchedule cron = CronSchedule.parse("30 8 * * 1");

        assertThat(cron.next(TUESDAY_OCT_27)).isEqualTo(LocalDateTime.of(2026, 11, 2, 8, 30));
    }

    @Test
    void parse_sixFields_rejected() {
        assertThatThrownBy(() -> CronSchedule.parse("*/10 * * * * *"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("5 fields");
    }

    @Test
    void parse_outOfRangeField_rejected() {
        assertThatThrownBy(() -> CronSchedule.parse("61 * * * *"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parse_blank_rejected() {
        assertThatThrownBy(() -> CronSchedule.parse("   "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CronSchedule.parse(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isValid_reportsWithoutThrowing() {
        assertThat(CronSchedule.isValid("0 0 * * *")).isTrue();
        assertThat(CronSchedule.isValid("not a cron")).isFalse();
        assertThat(CronSchedule.isValid("0 25 * * *")).isFalse();
    }
}
