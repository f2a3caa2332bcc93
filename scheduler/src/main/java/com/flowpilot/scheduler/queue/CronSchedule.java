package com.flowpilot.scheduler.queue;

import com.flowpilot.scheduler.error.ErrorCode;
import com.flowpilot.scheduler.error.FlowPilotException;
import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;

/**
 * A parsed cron expression bound to a time zone.
 *
 * Accepts the 5-field Unix form used by triggers ("0 *&#47;12 * * *") and the
 * 6-field form with a leading seconds field understood by Spring.
 */
public final class CronSchedule {

    private final CronExpression expression;
    private final ZoneId zone;

    private CronSchedule(CronExpression expression, ZoneId zone) {
        this.expression = expression;
        this.zone = zone;
    }

    public static CronSchedule of(ScheduleOptions options) {
        return parse(options.cronExpression(), options.timezone());
    }

    /**
     * @throws FlowPilotException JOB_QUEUE_FAILURE if the expression or the zone is invalid
     */
    public static CronSchedule parse(String cron, String timezone) {
        if (cron == null || cron.isBlank()) {
            throw invalid(cron, timezone, "empty cron expression", null);
        }
        String trimmed = cron.trim();
        String springCron = trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
        try {
            ZoneId zone = ZoneId.of(timezone == null ? ScheduleOptions.UTC : timezone);
            return new CronSchedule(CronExpression.parse(springCron), zone);
        } catch (IllegalArgumentException | DateTimeException e) {
            throw invalid(cron, timezone, e.getMessage(), e);
        }
    }

    /**
     * First firing strictly after {@code after}.
     *
     * @throws FlowPilotException if the expression never fires again
     */
    public Instant nextAfter(Instant after) {
        ZonedDateTime next = expression.next(after.atZone(zone));
        if (next == null) {
            throw new FlowPilotException(ErrorCode.JOB_QUEUE_FAILURE,
                    "Cron expression '" + expression + "' has no firing after " + after);
        }
        return next.toInstant();
    }

    private static FlowPilotException invalid(String cron, String timezone, String reason, Throwable cause) {
        return new FlowPilotException(ErrorCode.JOB_QUEUE_FAILURE,
                "Invalid schedule cron='" + cron + "' timezone='" + timezone + "': " + reason,
                Map.of("cronExpression", String.valueOf(cron)), cause);
    }
}
