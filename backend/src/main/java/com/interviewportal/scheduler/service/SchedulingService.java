package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.dto.ScheduleInterviewRequestDto;
import com.interviewportal.scheduler.exception.ConflictException;
import com.interviewportal.scheduler.exception.NotFoundException;
import com.interviewportal.scheduler.exception.ValidationException;
import com.interviewportal.scheduler.model.AvailabilityCheck;
import com.interviewportal.scheduler.model.Interview;
import com.interviewportal.scheduler.model.InterviewStatus;
import com.interviewportal.scheduler.model.InterviewType;
import com.interviewportal.scheduler.model.InterviewerAvailability;
import com.interviewportal.scheduler.repository.InterviewRepository;
import com.interviewportal.scheduler.repository.InterviewerAvailabilityRepository;
import com.interviewportal.scheduler.security.AccessPolicy;
import com.interviewportal.scheduler.security.Caller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.UUID;

/**
 * Books interviews onto interviewer calendars. The availability check and the insert run
 * under a row lock on the interviewer's availability record, so two overlapping bookings for
 * the same interviewer can never both commit.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SchedulingService {

    private final InterviewerAvailabilityRepository availabilityRepository;
    private final InterviewRepository interviewRepository;
    private final AvailabilityService availabilityService;
    private final SchedulingPolicy schedulingPolicy;
    private final RoomIdGenerator roomIdGenerator;
    private final NotificationService notificationService;
    private final AccessPolicy accessPolicy;

    @Transactional
    public Interview scheduleInterview(Caller caller, ScheduleInterviewRequestDto dto) {
        accessPolicy.requireAdmin(caller, "schedule interviews");

        if (dto.getCandidateId() == null) {
            throw new ValidationException("candidate_id is required");
        }
        if (dto.getInterviewerId() == null) {
            throw new ValidationException("interviewer_id is required");
        }
        InterviewType type = InterviewType.fromValue(dto.getInterviewType());
        schedulingPolicy.validateDuration(dto.getDurationMinutes());
        schedulingPolicy.validateStart(dto.getScheduledAt());
        int round = dto.getRoundNumber() == null ? 1 : dto.getRoundNumber();
        if (round < 1) {
            throw new ValidationException("round_number must be at least 1");
        }

        Interview draft = new Interview();
        draft.setCandidateId(dto.getCandidateId());
        draft.setInterviewerId(dto.getInterviewerId());
        draft.setPosition(trimToNull(dto.getPosition()));
        draft.setTitle(resolveTitle(dto.getTitle(), draft.getPosition(), type));
        draft.setInterviewType(type);
        draft.setScheduledAt(dto.getScheduledAt());
        draft.setDurationMinutes(dto.getDurationMinutes());
        draft.setRoundNumber(round);
        draft.setRecordingEnabled(dto.getRecordingEnabled() == null || dto.getRecordingEnabled());
        draft.setCodeEditorEnabled(Boolean.TRUE.equals(dto.getCodeEditorEnabled()));
        draft.setWhiteboardEnabled(Boolean.TRUE.equals(dto.getWhiteboardEnabled()));
        draft.setProgrammingLanguages(dto.getProgrammingLanguages() == null
                ? new ArrayList<>() : new ArrayList<>(dto.getProgrammingLanguages()));
        draft.setEvaluationCriteria(dto.getEvaluationCriteria() == null ? null : new HashMap<>(dto.getEvaluationCriteria()));
        draft.setCreatedBy(caller.getUserId());

        return book(draft);
    }

    /** Commits a new booking and notifies both parties. */
    @Transactional
    public Interview book(Interview draft) {
        Interview interview = commitBooking(draft, null);
        notificationService.interviewScheduled(interview);
        return interview;
    }

    /**
     * Locks the interviewer's calendar, re-runs the availability check and inserts the draft
     * with a fresh room id. {@code excludeInterviewId} names a booking being replaced, which
     * must not count against the new slot.
     *
     * @throws ConflictException when the slot is unavailable; nothing is written
     */
    @Transactional
    public Interview commitBooking(Interview draft, UUID excludeInterviewId) {
        InterviewerAvailability availability = availabilityRepository.lockByInterviewerId(draft.getInterviewerId())
                .orElseThrow(() -> new NotFoundException("Interviewer availability", draft.getInterviewerId()));

        AvailabilityCheck check = availabilityService.evaluate(availability, draft.getScheduledAt(),
                draft.getDurationMinutes(), excludeInterviewId);
        if (!check.isAvailable()) {
            log.warn("Booking for interviewer {} at {} rejected: {} {}", draft.getInterviewerId(),
                    draft.getScheduledAt(), check.getReason().getValue(),
                    check.getConflictingInterviewId() == null ? "" : check.getConflictingInterviewId());
            throw new ConflictException(check.getReason().getValue(),
                    "Interviewer is not available at " + draft.getScheduledAt() + " (" + check.getReason().getValue() + ")",
                    check.getConflictingInterviewId());
        }

        Instant now = schedulingPolicy.now();
        String roomId = roomIdGenerator.nextRoomId();
        draft.setRoomId(roomId);
        draft.setMeetingUrl("/interview/" + roomId);
        draft.setStatus(InterviewStatus.SCHEDULED);
        draft.setCreatedAt(now);
        draft.setUpdatedAt(now);

        Interview saved = interviewRepository.saveAndFlush(draft);
        log.info("Scheduled interview {} for interviewer {} at {} ({} min, room {})", saved.getId(),
                saved.getInterviewerId(), saved.getScheduledAt(), saved.getDurationMinutes(), roomId);
        return saved;
    }

    static String resolveTitle(String title, String position, InterviewType type) {
        String trimmed = trimToNull(title);
        if (trimmed != null) {
            return trimmed;
        }
        return position != null ? position + " Interview" : "Interview (" + type.getValue() + ")";
    }

    static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
