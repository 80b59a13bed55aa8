package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.dto.AvailabilityUpdateDto;
import com.interviewportal.scheduler.dto.TimeSlotDto;
import com.interviewportal.scheduler.exception.NotFoundException;
import com.interviewportal.scheduler.exception.ValidationException;
import com.interviewportal.scheduler.model.AvailabilityCheck;
import com.interviewportal.scheduler.model.Interview;
import com.interviewportal.scheduler.model.InterviewStatus;
import com.interviewportal.scheduler.model.InterviewerAvailability;
import com.interviewportal.scheduler.model.WeeklyWindow;
import com.interviewportal.scheduler.repository.InterviewRepository;
import com.interviewportal.scheduler.repository.InterviewerAvailabilityRepository;
import com.interviewportal.scheduler.security.AccessPolicy;
import com.interviewportal.scheduler.security.Caller;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@Slf4j
public class AvailabilityService {

    private final InterviewerAvailabilityRepository availabilityRepository;
    private final InterviewRepository interviewRepository;
    private final AccessPolicy accessPolicy;
    private final Clock clock;
    private final int slotStepMinutes;

    public AvailabilityService(InterviewerAvailabilityRepository availabilityRepository,
                               InterviewRepository interviewRepository,
                               AccessPolicy accessPolicy,
                               Clock clock,
                               @Value("${scheduling.slot-step-minutes:30}") int slotStepMinutes) {
        this.availabilityRepository = availabilityRepository;
        this.interviewRepository = interviewRepository;
        this.accessPolicy = accessPolicy;
        this.clock = clock;
        this.slotStepMinutes = slotStepMinutes;
    }

    /**
     * Replaces the interviewer's single availability record, creating it on first write.
     * Takes the calendar lock so a concurrent booking never sees a half-applied change.
     */
    @Transactional
    public InterviewerAvailability setAvailability(Caller caller, UUID interviewerId, AvailabilityUpdateDto dto) {
        if (interviewerId == null) {
            throw new ValidationException("interviewer id is required");
        }
        accessPolicy.requireAdminOrSelf(caller, interviewerId, "change availability");

        List<String> rawDays = dto.getAvailableDays() == null ? List.of() : dto.getAvailableDays();
        List<DayOfWeek> days = rawDays.stream().map(WeeklyWindow::parseDay).collect(Collectors.toList());
        WeeklyWindow window = WeeklyWindow.of(days, dto.getAvailableHoursStart(), dto.getAvailableHoursEnd(),
                dto.getTimezone());

        int buffer = dto.getBufferTimeMinutes() == null ? 15 : dto.getBufferTimeMinutes();
        if (buffer < 0) {
            throw new ValidationException("buffer_time_minutes must not be negative");
        }
        int maxPerDay = dto.getMaxInterviewsPerDay() == null ? 5 : dto.getMaxInterviewsPerDay();
        if (maxPerDay < 1) {
            throw new ValidationException("max_interviews_per_day must be at least 1");
        }
        Set<LocalDate> blackout = new HashSet<>();
        if (dto.getUnavailableDates() != null) {
            if (dto.getUnavailableDates().stream().anyMatch(Objects::isNull)) {
                throw new ValidationException("unavailable_dates contains an empty entry");
            }
            blackout.addAll(dto.getUnavailableDates());
        }

        Instant now = clock.instant();
        InterviewerAvailability availability = availabilityRepository.lockByInterviewerId(interviewerId)
                .orElseGet(() -> {
                    InterviewerAvailability created = new InterviewerAvailability();
                    created.setInterviewerId(interviewerId);
                    created.setCreatedAt(now);
                    return created;
                });

        availability.setAvailableDays(new HashSet<>(window.getDays()));
        availability.setStartTime(window.getStart());
        availability.setEndTime(window.getEnd());
        availability.setTimezone(window.getZone().getId());
        availability.setBufferMinutes(buffer);
        availability.setMaxInterviewsPerDay(maxPerDay);
        availability.setUnavailableDates(blackout);
        availability.setUpdatedAt(now);

        availability = availabilityRepository.saveAndFlush(availability);
        log.info("Availability for interviewer {} set: {} {}-{} {} buffer={}m max/day={}", interviewerId,
                window.getDays(), window.getStart(), window.getEnd(), window.getZone(), buffer, maxPerDay);
        return availability;
    }

    @Transactional(readOnly = true)
    public InterviewerAvailability getAvailability(UUID interviewerId) {
        return availabilityRepository.findByInterviewerId(interviewerId)
                .orElseThrow(() -> new NotFoundException("Interviewer availability", interviewerId));
    }

    @Transactional(readOnly = true)
    public boolean isAvailable(UUID interviewerId, Instant start, int durationMinutes) {
        return checkAvailability(interviewerId, start, durationMinutes).isAvailable();
    }

    @Transactional(readOnly = true)
    public AvailabilityCheck checkAvailability(UUID interviewerId, Instant start, int durationMinutes) {
        if (start == null || durationMinutes <= 0) {
            throw new ValidationException("start and a positive duration are required");
        }
        return evaluate(getAvailability(interviewerId), start, durationMinutes, null);
    }

    /**
     * Checks a booking against the given availability record and the interviewer's current
     * bookings, ignoring {@code excludeInterviewId} (the interview being moved, if any). Callers
     * that intend to commit must already hold the calendar lock.
     */
    @Transactional(readOnly = true)
    public AvailabilityCheck evaluate(InterviewerAvailability availability, Instant start, int durationMinutes,
                                      UUID excludeInterviewId) {
        List<Interview> bookings = interviewRepository.findBookings(availability.getInterviewerId(),
                        InterviewStatus.BOOKED,
                        AvailabilityRules.lookupFrom(availability, start),
                        AvailabilityRules.lookupTo(availability, start))
                .stream()
                .filter(i -> !Objects.equals(i.getId(), excludeInterviewId))
                .collect(Collectors.toList());
        return AvailabilityRules.evaluate(availability, start, durationMinutes, bookings);
    }

    /**
     * Candidate start times across the interviewer's window on {@code date}, stepping by the
     * configured slot size, each flagged with the outcome of the booking check.
     */
    @Transactional(readOnly = true)
    public List<TimeSlotDto> availableSlots(UUID interviewerId, LocalDate date, int durationMinutes) {
        if (date == null || durationMinutes <= 0) {
            throw new ValidationException("date and a positive duration are required");
        }
        InterviewerAvailability availability = getAvailability(interviewerId);
        ZoneId zone = ZoneId.of(availability.getTimezone());
        Instant now = clock.instant();

        List<TimeSlotDto> slots = new ArrayList<>();
        ZonedDateTime cursor = date.atTime(availability.getStartTime()).atZone(zone);
        ZonedDateTime windowEnd = date.atTime(availability.getEndTime()).atZone(zone);
        while (!cursor.plusMinutes(durationMinutes).isAfter(windowEnd)) {
            Instant start = cursor.toInstant();
            AvailabilityCheck check = start.isBefore(now)
                    ? null
                    : evaluate(availability, start, durationMinutes, null);
            slots.add(TimeSlotDto.builder()
                    .start(start)
                    .end(start.plus(Duration.ofMinutes(durationMinutes)))
                    .available(check != null && check.isAvailable())
                    .reason(check == null ? "in_past" : check.getReason() == null ? null : check.getReason().getValue())
                    .build());
            cursor = cursor.plusMinutes(slotStepMinutes);
        }
        return slots;
    }
}
