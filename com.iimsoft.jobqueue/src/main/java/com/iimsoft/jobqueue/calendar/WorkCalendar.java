package com.iimsoft.jobqueue.calendar;

import com.iimsoft.jobqueue.domain.OperationalConstraints;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Working-time calendar of one optimization run (minute precision).
 *
 * Rules:
 * - each working day opens one window [start, end) in the run's zone
 * - end <= start means the window crosses midnight (start..24:00 + 00:00..end);
 *   the window belongs to the day it opens on
 * - no window configured: every minute is working time
 *
 * Built per call from the operational constraints, never cached globally.
 */
public final class WorkCalendar {

    private final LocalTime windowStart;
    private final LocalTime windowEnd;
    private final Set<DayOfWeek> workingDays;
    private final ZoneId zone;

    private WorkCalendar(LocalTime windowStart, LocalTime windowEnd, Set<DayOfWeek> workingDays, ZoneId zone) {
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
        this.workingDays = workingDays == null || workingDays.isEmpty()
                ? EnumSet.allOf(DayOfWeek.class)
                : EnumSet.copyOf(workingDays);
        this.zone = zone;
    }

    public static WorkCalendar of(OperationalConstraints constraints, ZoneId zone) {
        if (constraints == null || !constraints.hasWorkingWindow()) {
            return alwaysWorking(zone);
        }
        return new WorkCalendar(constraints.getWorkingHoursStart(), constraints.getWorkingHoursEnd(),
                constraints.getWorkingDays(), zone);
    }

    public static WorkCalendar alwaysWorking(ZoneId zone) {
        return new WorkCalendar(null, null, null, zone);
    }

    public boolean isAlwaysWorking() {
        return windowStart == null;
    }

    /** Minutes of [from, to) that fall inside working windows. */
    public double workingMinutesBetween(Instant from, Instant to) {
        if (!to.isAfter(from)) {
            return 0;
        }
        if (isAlwaysWorking()) {
            return toMinutes(Duration.between(from, to));
        }
        // a window opened the day before may still be running at 'from'
        LocalDate day = from.atZone(zone).toLocalDate().minusDays(1);
        LocalDate lastDay = to.atZone(zone).toLocalDate();
        double total = 0;
        while (!day.isAfter(lastDay)) {
            if (workingDays.contains(day.getDayOfWeek())) {
                total += overlapMinutes(from, to, windowOpen(day), windowClose(day));
            }
            day = day.plusDays(1);
        }
        return total;
    }

    /** Minutes of [from, to) outside working windows, i.e. overtime. */
    public double overtimeMinutesBetween(Instant from, Instant to) {
        if (!to.isAfter(from)) {
            return 0;
        }
        return toMinutes(Duration.between(from, to)) - workingMinutesBetween(from, to);
    }

    private Instant windowOpen(LocalDate day) {
        return ZonedDateTime.of(day, windowStart, zone).toInstant();
    }

    private Instant windowClose(LocalDate day) {
        LocalDate closeDay = windowEnd.isAfter(windowStart) ? day : day.plusDays(1);
        return ZonedDateTime.of(closeDay, windowEnd, zone).toInstant();
    }

    private static double overlapMinutes(Instant from, Instant to, Instant open, Instant close) {
        Instant start = from.isAfter(open) ? from : open;
        Instant end = to.isBefore(close) ? to : close;
        return end.isAfter(start) ? toMinutes(Duration.between(start, end)) : 0;
    }

    private static double toMinutes(Duration duration) {
        return duration.toMillis() / 60_000d;
    }
}
