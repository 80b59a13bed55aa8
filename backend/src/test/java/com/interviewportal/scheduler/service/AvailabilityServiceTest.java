package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.IntegrationTestSupport;
import com.interviewportal.scheduler.dto.AvailabilityUpdateDto;
import com.interviewportal.scheduler.exception.ConflictException;
import com.interviewportal.scheduler.model.InterviewerAvailability;
import com.interviewportal.scheduler.model.UnavailabilityReason;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AvailabilityServiceTest extends IntegrationTestSupport {

    @Test
    void latestWriteReplacesTheSingleRecord() {
        UUID interviewerId = interviewerWithStandardWeek();
        InterviewerAvailability first = availabilityService.getAvailability(interviewerId);

        AvailabilityUpdateDto afternoons = week(List.of("tuesday", "thursday"), LocalTime.of(13, 0), LocalTime.of(18, 0));
        afternoons.setBufferTimeMinutes(0);
        InterviewerAvailability second = availabilityService.setAvailability(interviewer(interviewerId), interviewerId,
                afternoons);

        assertThat(availabilityRepository.findAll())
                .filteredOn(a -> a.getInterviewerId().equals(interviewerId))
                .hasSize(1);
        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(second.getCreatedAt()).isEqualTo(first.getCreatedAt());
        assertThat(second.getBufferMinutes()).isZero();

        assertThat(availabilityService.checkAvailability(interviewerId, MONDAY_10, 60).getReason())
                .isEqualTo(UnavailabilityReason.OUTSIDE_WORKING_DAYS);
        Instant tuesdayMorning = MONDAY_10.plus(Duration.ofDays(1));
        assertThatThrownBy(() -> schedule(interviewerId, tuesdayMorning, 60))
                .isInstanceOfSatisfying(ConflictException.class,
                        e -> assertThat(e.getReason()).isEqualTo("outside_working_hours"));

        Instant tuesdayAfternoon = Instant.parse("2030-01-08T17:00:00Z");
        assertThat(schedule(interviewerId, tuesdayAfternoon, 60).getScheduledAt()).isEqualTo(tuesdayAfternoon);
    }

    @Test
    void bufferLongerThanADayStillSeesEarlierBookings() {
        UUID interviewerId = UUID.randomUUID();
        AvailabilityUpdateDto dto = week(List.of("monday", "wednesday"), LocalTime.of(9, 0), LocalTime.of(17, 0));
        dto.setBufferTimeMinutes(2 * 24 * 60);
        availabilityService.setAvailability(ADMIN, interviewerId, dto);
        schedule(interviewerId, MONDAY_10, 60);

        Instant wednesday = MONDAY_10.plus(Duration.ofDays(2));
        assertThat(availabilityService.checkAvailability(interviewerId, wednesday, 60).getReason())
                .isEqualTo(UnavailabilityReason.OVERLAPPING_INTERVIEW);
        assertThat(availabilityService.isAvailable(interviewerId, wednesday.plus(Duration.ofHours(2)), 60)).isTrue();
    }

    private static AvailabilityUpdateDto week(List<String> days, LocalTime start, LocalTime end) {
        AvailabilityUpdateDto dto = new AvailabilityUpdateDto();
        dto.setAvailableDays(days);
        dto.setAvailableHoursStart(start);
        dto.setAvailableHoursEnd(end);
        dto.setTimezone("UTC");
        return dto;
    }
}
