package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.model.AvailabilityCheck;
import com.interviewportal.scheduler.model.Interview;
import com.interviewportal.scheduler.model.InterviewerAvailability;
import com.interviewportal.scheduler.model.UnavailabilityReason;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collection;

/**
 * Pure evaluation of a proposed booking against an interviewer's availability record and
 * their existing bookings. The caller decides which bookings count (status filter, the
 * interview being moved) and is responsible for holding the calendar lock.
 */
public final class AvailabilityRules {

    private AvailabilityRules() {
    }

    public static AvailabilityCheck evaluate(InterviewerAvailability availability,
                                             Instant start,
                                             int durationMinutes,
                                             Collection<Interview> bookings) {
        ZoneId zone = ZoneId.of(availability.getTimezone());
        Instant end = start.plus(Duration.ofMinutes(durationMinutes));
        ZonedDateTime localStart = start.atZone(zone);
        ZonedDateTime localEnd = end.atZone(zone);
        LocalDate day = localStart.toLocalDate();

        if (!availability.getAvailableDays().contains(localStart.getDayOfWeek())) {
            return AvailabilityCheck.unavailable(UnavailabilityReason.OUTSIDE_WORKING_DAYS);
        }
        if (!localEnd.toLocalDate().equals(day)
                || localStart.toLocalTime().isBefore(availability.getStartTime())
                || localEnd.toLocalTime().isAfter(availability.getEndTime())) {
            return AvailabilityCheck.unavailable(UnavailabilityReason.OUTSIDE_WORKING_HOURS);
        }
        if (availability.getUnavailableDates().contains(day)) {
            return AvailabilityCheck.unavailable(UnavailabilityReason.BLACKOUT_DATE);
        }

        long sameDay = bookings.stream()
                .filter(b -> b.getScheduledAt().atZone(zone).toLocalDate().equals(day))
                .count();
        if (sameDay >= availability.getMaxInterviewsPerDay()) {
            return AvailabilityCheck.unavailable(UnavailabilityReason.DAILY_LIMIT_REACHED);
        }

        Duration buffer = Duration.ofMinutes(availability.getBufferMinutes());
        Instant paddedStart = start.minus(buffer);
        Instant paddedEnd = end.plus(buffer);
        return bookings.stream()
                .filter(b -> b.getScheduledAt().isBefore(paddedEnd) && b.getScheduledEnd().isAfter(paddedStart))
                .findFirst()
                .map(b -> AvailabilityCheck.overlapping(b.getId()))
                .orElse(AvailabilityCheck.available());
    }

    /**
     * Earliest booking start that can matter for a check on {@code start}. Bookings never cross
     * midnight, so anything starting more than a day plus the buffer before {@code start}'s day
     * cannot reach the padded interval.
     */
    public static Instant lookupFrom(InterviewerAvailability availability, Instant start) {
        ZoneId zone = ZoneId.of(availability.getTimezone());
        return start.atZone(zone).toLocalDate().atStartOfDay(zone).toInstant()
                .minus(Duration.ofDays(1))
                .minus(Duration.ofMinutes(availability.getBufferMinutes()));
    }

    /** Exclusive upper bound matching {@link #lookupFrom}. */
    public static Instant lookupTo(InterviewerAvailability availability, Instant start) {
        ZoneId zone = ZoneId.of(availability.getTimezone());
        return start.atZone(zone).toLocalDate().plusDays(2).atStartOfDay(zone).toInstant()
                .plus(Duration.ofMinutes(availability.getBufferMinutes()));
    }
}
