package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.IntegrationTestSupport;
import com.interviewportal.scheduler.dto.BulkCandidateDto;
import com.interviewportal.scheduler.dto.BulkScheduleErrorDto;
import com.interviewportal.scheduler.dto.BulkScheduleRequestDto;
import com.interviewportal.scheduler.dto.BulkScheduleResultDto;
import com.interviewportal.scheduler.dto.InterviewResponseDto;
import com.interviewportal.scheduler.exception.AccessDeniedException;
import com.interviewportal.scheduler.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BulkSchedulingServiceTest extends IntegrationTestSupport {

    private static final LocalDate MONDAY = LocalDate.of(2030, 1, 7);

    @Autowired
    private BulkSchedulingService bulkSchedulingService;

    @Test
    void candidatesAreSpreadRoundRobinIntoFirstFreeSlots() {
        UUID first = interviewerWithStandardWeek();
        UUID second = interviewerWithStandardWeek();
        BulkScheduleRequestDto dto = request(MONDAY, MONDAY, List.of(first, second), 3);

        BulkScheduleResultDto result = bulkSchedulingService.scheduleBulk(ADMIN, dto);

        assertThat(result.getTotalCandidates()).isEqualTo(3);
        assertThat(result.getSuccessfullyScheduled()).isEqualTo(3);
        assertThat(result.getFailed()).isZero();
        List<InterviewResponseDto> booked = result.getInterviews();
        assertThat(booked).extracting(InterviewResponseDto::getInterviewerId).containsExactly(first, second, first);
        assertThat(booked.get(0).getScheduledAt()).isEqualTo(Instant.parse("2030-01-07T09:00:00Z"));
        assertThat(booked.get(1).getScheduledAt()).isEqualTo(Instant.parse("2030-01-07T09:00:00Z"));
        // 09:00-10:00 plus a 15 minute buffer pushes the next booking to the 10:30 step
        assertThat(booked.get(2).getScheduledAt()).isEqualTo(Instant.parse("2030-01-07T10:30:00Z"));
        assertThat(booked).allMatch(i -> "Backend Engineer Interview".equals(i.getTitle()));
        assertThat(interviewRepository.findByInterviewerIdOrderByScheduledAtAsc(first)).hasSize(2);
    }

    @Test
    void withoutAutoAssignEveryoneGoesToTheFirstInterviewer() {
        UUID first = interviewerWithStandardWeek();
        UUID second = interviewerWithStandardWeek();
        BulkScheduleRequestDto dto = request(MONDAY, MONDAY, List.of(first, second), 2);
        dto.setAutoAssign(false);

        BulkScheduleResultDto result = bulkSchedulingService.scheduleBulk(ADMIN, dto);

        assertThat(result.getInterviews()).extracting(InterviewResponseDto::getInterviewerId)
                .containsExactly(first, first);
        assertThat(interviewRepository.findByInterviewerIdOrderByScheduledAtAsc(second)).isEmpty();
    }

    @Test
    void failuresAreReportedPerCandidateWithoutUndoingOthers() {
        UUID known = interviewerWithStandardWeek();
        UUID unknown = UUID.randomUUID();
        BulkScheduleRequestDto dto = request(MONDAY, MONDAY, List.of(known, unknown), 2);
        dto.getCandidates().add(new BulkCandidateDto(null, "Backend Engineer", null));

        BulkScheduleResultDto result = bulkSchedulingService.scheduleBulk(ADMIN, dto);

        assertThat(result.getTotalCandidates()).isEqualTo(3);
        assertThat(result.getSuccessfullyScheduled()).isEqualTo(1);
        assertThat(result.getFailed()).isEqualTo(2);
        assertThat(result.getErrors()).extracting(BulkScheduleErrorDto::getCode)
                .containsExactly("not_found", "validation_error");
        assertThat(result.getErrors().get(0).getInterviewerId()).isEqualTo(unknown);
        assertThat(interviewRepository.findByInterviewerIdOrderByScheduledAtAsc(known)).hasSize(1);
    }

    @Test
    void rangeWithoutWorkingDaysReportsNoSlot() {
        UUID interviewerId = interviewerWithStandardWeek();
        LocalDate saturday = LocalDate.of(2030, 1, 12);
        BulkScheduleRequestDto dto = request(saturday, saturday.plusDays(1), List.of(interviewerId), 1);

        BulkScheduleResultDto result = bulkSchedulingService.scheduleBulk(ADMIN, dto);

        assertThat(result.getSuccessfullyScheduled()).isZero();
        assertThat(result.getErrors()).singleElement()
                .satisfies(e -> assertThat(e.getCode()).isEqualTo("no_available_slot"));
    }

    @Test
    void requestIsValidatedBeforeAnyBooking() {
        UUID interviewerId = interviewerWithStandardWeek();

        assertThatThrownBy(() -> bulkSchedulingService.scheduleBulk(interviewer(interviewerId),
                request(MONDAY, MONDAY, List.of(interviewerId), 1)))
                .isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> bulkSchedulingService.scheduleBulk(ADMIN,
                request(MONDAY, MONDAY.minusDays(1), List.of(interviewerId), 1)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> bulkSchedulingService.scheduleBulk(ADMIN,
                request(MONDAY, MONDAY.plusDays(60), List.of(interviewerId), 1)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> bulkSchedulingService.scheduleBulk(ADMIN, request(MONDAY, MONDAY, List.of(), 1)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> bulkSchedulingService.scheduleBulk(ADMIN,
                request(MONDAY, MONDAY, List.of(interviewerId), 0)))
                .isInstanceOf(ValidationException.class);
        assertThat(interviewRepository.findByInterviewerIdOrderByScheduledAtAsc(interviewerId)).isEmpty();
    }

    private static BulkScheduleRequestDto request(LocalDate from, LocalDate to, List<UUID> interviewerIds,
                                                  int candidates) {
        BulkScheduleRequestDto dto = new BulkScheduleRequestDto();
        dto.setInterviewType("technical");
        dto.setDurationMinutes(60);
        dto.setDateRangeStart(from);
        dto.setDateRangeEnd(to);
        dto.setInterviewerIds(interviewerIds);
        dto.setCandidates(IntStream.range(0, candidates)
                .mapToObj(i -> new BulkCandidateDto(UUID.randomUUID(), "Backend Engineer", null))
                .collect(Collectors.toCollection(ArrayList::new)));
        return dto;
    }
}
