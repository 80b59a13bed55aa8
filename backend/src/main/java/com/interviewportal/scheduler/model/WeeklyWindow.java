package com.interviewportal.scheduler.model;

import com.interviewportal.scheduler.exception.ValidationException;
import lombok.Value;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Recurring weekly working window: a set of weekdays sharing one daily time range,
 * interpreted in the interviewer's time zone.
 */
@Value
public class WeeklyWindow {
    Set<DayOfWeek> days;
    LocalTime start;
    LocalTime end;
    ZoneId zone;

    public static WeeklyWindow of(Collection<DayOfWeek> days, LocalTime start, LocalTime end, String zone) {
        if (days == null || days.isEmpty()) {
            throw new ValidationException("available_days must name at least one weekday");
        }
        if (days.stream().anyMatch(Objects::isNull)) {
            throw new ValidationException("available_days contains an empty entry");
        }
        if (start == null || end == null) {
            throw new ValidationException("available_hours_start and available_hours_end are required");
        }
        if (!start.isBefore(end)) {
            throw new ValidationException("available_hours_start " + start + " must be before available_hours_end " + end);
        }
        ZoneId zoneId;
        try {
            zoneId = ZoneId.of(zone == null || zone.isBlank() ? "UTC" : zone.trim());
        } catch (DateTimeException e) {
            throw new ValidationException("Unknown timezone '" + zone + "'");
        }
        return new WeeklyWindow(EnumSet.copyOf(days), start, end, zoneId);
    }

    public static DayOfWeek parseDay(String raw) {
        if (raw == null) {
            throw new ValidationException("available_days contains an empty entry");
        }
        try {
            return DayOfWeek.valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown weekday '" + raw + "'");
        }
    }
}
