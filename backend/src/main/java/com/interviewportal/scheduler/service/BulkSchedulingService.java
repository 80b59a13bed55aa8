package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.dto.BulkCandidateDto;
import com.interviewportal.scheduler.dto.BulkScheduleErrorDto;
import com.interviewportal.scheduler.dto.BulkScheduleRequestDto;
import com.interviewportal.scheduler.dto.BulkScheduleResultDto;
import com.interviewportal.scheduler.dto.DtoMapper;
import com.interviewportal.scheduler.dto.InterviewResponseDto;
import com.interviewportal.scheduler.dto.TimeSlotDto;
import com.interviewportal.scheduler.exception.ConflictException;
import com.interviewportal.scheduler.exception.InterviewPortalException;
import com.interviewportal.scheduler.exception.ValidationException;
import com.interviewportal.scheduler.model.Interview;
import com.interviewportal.scheduler.model.InterviewType;
import com.interviewportal.scheduler.security.AccessPolicy;
import com.interviewportal.scheduler.security.Caller;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Books one interview per candidate, spreading candidates over the given interviewers and
 * taking the first free slot in the date range. Each booking commits on its own, so one
 * candidate's failure is reported without undoing the others.
 */
@Service
@Slf4j
public class BulkSchedulingService {

    private final SchedulingService schedulingService;
    private final AvailabilityService availabilityService;
    private final SchedulingPolicy schedulingPolicy;
    private final AccessPolicy accessPolicy;
    private final int maxRangeDays;

    public BulkSchedulingService(SchedulingService schedulingService,
                                 AvailabilityService availabilityService,
                                 SchedulingPolicy schedulingPolicy,
                                 AccessPolicy accessPolicy,
                                 @Value("${scheduling.bulk.max-range-days:31}") int maxRangeDays) {
        this.schedulingService = schedulingService;
        this.availabilityService = availabilityService;
        this.schedulingPolicy = schedulingPolicy;
        this.accessPolicy = accessPolicy;
        this.maxRangeDays = maxRangeDays;
    }

    public BulkScheduleResultDto scheduleBulk(Caller caller, BulkScheduleRequestDto dto) {
        accessPolicy.requireAdmin(caller, "schedule interviews");

        InterviewType type = InterviewType.fromValue(dto.getInterviewType());
        schedulingPolicy.validateDuration(dto.getDurationMinutes());
        LocalDate from = dto.getDateRangeStart();
        LocalDate to = dto.getDateRangeEnd();
        if (from == null || to == null) {
            throw new ValidationException("date_range_start and date_range_end are required");
        }
        if (to.isBefore(from)) {
            throw new ValidationException("date_range_end must not be before date_range_start");
        }
        if (ChronoUnit.DAYS.between(from, to) >= maxRangeDays) {
            throw new ValidationException("date range may span at most " + maxRangeDays + " days");
        }
        List<UUID> interviewerIds = dto.getInterviewerIds() == null ? List.of() : dto.getInterviewerIds();
        if (interviewerIds.isEmpty() || interviewerIds.stream().anyMatch(Objects::isNull)) {
            throw new ValidationException("interviewer_ids must name at least one interviewer");
        }
        List<BulkCandidateDto> candidates = dto.getCandidates() == null ? List.of() : dto.getCandidates();
        if (candidates.isEmpty()) {
            throw new ValidationException("candidates must not be empty");
        }
        boolean roundRobin = dto.getAutoAssign() == null || dto.getAutoAssign();

        List<InterviewResponseDto> booked = new ArrayList<>();
        List<BulkScheduleErrorDto> errors = new ArrayList<>();
        int next = 0;
        for (BulkCandidateDto candidate : candidates) {
            UUID interviewerId = roundRobin ? interviewerIds.get(next++ % interviewerIds.size()) : interviewerIds.get(0);
            UUID candidateId = candidate == null ? null : candidate.getCandidateId();
            try {
                if (candidateId == null) {
                    throw new ValidationException("candidate_id is required");
                }
                Interview interview = bookFirstFreeSlot(caller, dto, type, candidate, interviewerId, from, to)
                        .orElseThrow(() -> new ConflictException("no_available_slot",
                                "No free slot for interviewer " + interviewerId + " between " + from + " and " + to));
                booked.add(DtoMapper.toDto(interview));
            } catch (InterviewPortalException e) {
                log.warn("Bulk booking for candidate {} with interviewer {} failed: {}", candidateId, interviewerId,
                        e.getMessage());
                errors.add(BulkScheduleErrorDto.builder()
                        .candidateId(candidateId)
                        .interviewerId(interviewerId)
                        .code(e instanceof ConflictException ? ((ConflictException) e).getReason() : e.getCode())
                        .error(e.getMessage())
                        .build());
            }
        }

        log.info("Bulk scheduling booked {} of {} candidates", booked.size(), candidates.size());
        return BulkScheduleResultDto.builder()
                .totalCandidates(candidates.size())
                .successfullyScheduled(booked.size())
                .failed(errors.size())
                .interviews(booked)
                .errors(errors)
                .build();
    }

    private Optional<Interview> bookFirstFreeSlot(Caller caller, BulkScheduleRequestDto dto, InterviewType type,
                                                  BulkCandidateDto candidate, UUID interviewerId,
                                                  LocalDate from, LocalDate to) {
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            for (TimeSlotDto slot : availabilityService.availableSlots(interviewerId, date, dto.getDurationMinutes())) {
                if (!slot.isAvailable()) {
                    continue;
                }
                try {
                    return Optional.of(schedulingService.book(draft(caller, dto, type, candidate, interviewerId, slot)));
                } catch (ConflictException e) {
                    // taken since the slot listing; keep looking
                    log.debug("Slot {} for interviewer {} taken meanwhile", slot.getStart(), interviewerId);
                }
            }
        }
        return Optional.empty();
    }

    private static Interview draft(Caller caller, BulkScheduleRequestDto dto, InterviewType type,
                                   BulkCandidateDto candidate, UUID interviewerId, TimeSlotDto slot) {
        Interview draft = new Interview();
        draft.setCandidateId(candidate.getCandidateId());
        draft.setInterviewerId(interviewerId);
        draft.setPosition(SchedulingService.trimToNull(candidate.getPosition()));
        draft.setTitle(SchedulingService.resolveTitle(candidate.getTitle(), draft.getPosition(), type));
        draft.setInterviewType(type);
        draft.setScheduledAt(slot.getStart());
        draft.setDurationMinutes(dto.getDurationMinutes());
        draft.setRoundNumber(1);
        draft.setRecordingEnabled(dto.getRecordingEnabled() == null || dto.getRecordingEnabled());
        draft.setCodeEditorEnabled(Boolean.TRUE.equals(dto.getCodeEditorEnabled()));
        draft.setWhiteboardEnabled(Boolean.TRUE.equals(dto.getWhiteboardEnabled()));
        draft.setProgrammingLanguages(dto.getProgrammingLanguages() == null
                ? new ArrayList<>() : new ArrayList<>(dto.getProgrammingLanguages()));
        draft.setCreatedBy(caller.getUserId());
        return draft;
    }
}
