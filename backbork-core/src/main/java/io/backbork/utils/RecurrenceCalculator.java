package io.backbork.utils;

import io.backbork.core.Frequency;
import io.backbork.core.Schedule;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Computes the next execution instant of a schedule.
 * <p>
 * Every frequency is evaluated as a Quartz cron pattern:
 * <ul>
 *   <li>hourly: {@code 0 0 * * * ?} (top of the next hour)</li>
 *   <li>daily: {@code 0 0 H * * ?} (today at H if still ahead, else tomorrow)</li>
 *   <li>weekly: {@code 0 0 H ? * D} (next D at H, a full week ahead if already past today)</li>
 *   <li>monthly: {@code 0 0 H 1 * ?}, searched from the start of next month so the
 *       result is always the 1st of the following month</li>
 * </ul>
 * <p>
 * Daily, weekly and monthly patterns are matched against local wall-clock time; a preferred hour
 * that does not exist on a DST transition day runs at the first valid time after it.
 * Results are strictly after {@code now}. The functions are pure; callers persist the result.
 */
public final class RecurrenceCalculator {
    private RecurrenceCalculator() {
    }

    public static Instant nextRun(Frequency frequency, int preferredHour, int dayOfWeek, Instant now, ZoneId zone) {
        Objects.requireNonNull(frequency, "frequency must not be null");
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        if (preferredHour < 0 || preferredHour > 23) {
            throw new IllegalArgumentException("preferredHour must be within 0..23: " + preferredHour);
        }
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new IllegalArgumentException("dayOfWeek must be within 0..6: " + dayOfWeek);
        }

        if (frequency == Frequency.HOURLY) {
            return nextValid(cronExpression(cronFor(frequency, preferredHour, dayOfWeek), zone), now, frequency);
        }

        // Match wall-clock times in UTC, where no hour is skipped or repeated, then place the match
        // in the zone. A time inside a DST gap moves forward by the gap length instead of losing the day.
        CronExpression exp = cronExpression(cronFor(frequency, preferredHour, dayOfWeek), ZoneOffset.UTC);
        LocalDateTime searchFrom = LocalDateTime.ofInstant(now, zone);
        if (frequency == Frequency.MONTHLY) {
            searchFrom = searchFrom.toLocalDate()
                    .withDayOfMonth(1)
                    .plusMonths(1)
                    .atStartOfDay()
                    .minusSeconds(1);
        }

        while (true) {
            Instant match = nextValid(exp, searchFrom.toInstant(ZoneOffset.UTC), frequency);
            LocalDateTime wallTime = LocalDateTime.ofInstant(match, ZoneOffset.UTC);
            Instant next = ZonedDateTime.of(wallTime, zone).toInstant();
            if (next.isAfter(now)) {
                return next;
            }
            searchFrom = wallTime;
        }
    }

    /**
     * Next run of {@code schedule}, never earlier than its current {@code nextRun}, so repeated
     * recalculation cannot drift backwards.
     */
    public static Instant nextRun(Schedule schedule, Instant now, ZoneId zone) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Instant base = laterOf(schedule.nextRun(), now);
        return nextRun(schedule.frequency(), schedule.preferredHour(), schedule.dayOfWeek(), base, zone);
    }

    /**
     * Quartz cron pattern for a frequency. Quartz numbers weekdays 1=SUN..7=SAT.
     */
    public static String cronFor(Frequency frequency, int preferredHour, int dayOfWeek) {
        return switch (frequency) {
            case HOURLY -> "0 0 * * * ?";
            case DAILY -> "0 0 " + preferredHour + " * * ?";
            case WEEKLY -> "0 0 " + preferredHour + " ? * " + (dayOfWeek + 1);
            case MONTHLY -> "0 0 " + preferredHour + " 1 * ?";
        };
    }

    /* ================= helper ================= */

    private static CronExpression cronExpression(String cron, ZoneId zone) {
        try {
            CronExpression exp = new CronExpression(cron);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron, ex);
        }
    }

    private static Instant nextValid(CronExpression exp, Instant after, Frequency frequency) {
        Date next = exp.getNextValidTimeAfter(Date.from(after));
        if (next == null) {
            throw new IllegalStateException("No next execution time for " + frequency + " after " + after);
        }
        return next.toInstant();
    }

    private static Instant laterOf(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
