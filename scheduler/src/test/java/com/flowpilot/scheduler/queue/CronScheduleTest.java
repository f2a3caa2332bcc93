package com.flowpilot.scheduler.queue;

import com.flowpilot.scheduler.error.ErrorCode;
import com.flowpilot.scheduler.error.FlowPilotException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronScheduleTest {

    @Test
    void fiveFieldExpression_firesOnMinuteBoundaries() {
        CronSchedule schedule = CronSchedule.of(ScheduleOptions.everyMinutes(5));

        assertThat(schedule.nextAfter(Instant.parse("2024-01-01T00:00:30Z")))
                .isEqualTo(Instant.parse("2024-01-01T00:05:00Z"));
        assertThat(schedule.nextAfter(Instant.parse("2024-01-01T00:05:00Z")))
                .isEqualTo(Instant.parse("2024-01-01T00:10:00Z"));
    }

    @Test
    void sixFieldExpression_keepsSecondsField() {
        CronSchedule schedule = CronSchedule.parse("30 0 * * * *", "UTC");

        assertThat(schedule.nextAfter(Instant.parse("2024-01-01T00:00:00Z")))
                .isEqualTo(Instant.parse("2024-01-01T00:00:30Z"));
    }

    @Test
    void timezone_isHonoured() {
        // 09:00 in Paris during winter is 08:00 UTC
        CronSchedule schedule = CronSchedule.parse("0 9 * * *", "Europe/Paris");

        assertThat(schedule.nextAfter(Instant.parse("2024-01-15T00:00:00Z")))
                .isEqualTo(Instant.parse("2024-01-15T08:00:00Z"));
    }

    @Test
    void invalidExpression_isQueueFailure() {
        assertThatThrownBy(() -> CronSchedule.parse("every five minutes", "UTC"))
                .isInstanceOf(FlowPilotException.class)
                .extracting(e -> ((FlowPilotException) e).getCode())
                .isEqualTo(ErrorCode.JOB_QUEUE_FAILURE);
    }

    @Test
    void invalidTimezone_isQueueFailure() {
        assertThatThrownBy(() -> CronSchedule.parse("*/5 * * * *", "Mars/Olympus"))
                .isInstanceOf(FlowPilotException.class)
                .hasMessageContaining("Mars/Olympus");
    }
}
