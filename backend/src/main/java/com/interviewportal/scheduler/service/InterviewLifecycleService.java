package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.dto.InterviewUpdateDto;
import com.interviewportal.scheduler.exception.ConflictException;
import com.interviewportal.scheduler.exception.InvalidTransitionException;
import com.interviewportal.scheduler.exception.NotFoundException;
import com.interviewportal.scheduler.exception.ValidationException;
import com.interviewportal.scheduler.model.Interview;
import com.interviewportal.scheduler.model.InterviewStatus;
import com.interviewportal.scheduler.model.Party;
import com.interviewportal.scheduler.model.RecordingStatus;
import com.interviewportal.scheduler.repository.CodeSnapshotRepository;
import com.interviewportal.scheduler.repository.EvaluationRepository;
import com.interviewportal.scheduler.repository.InterviewRecordingRepository;
import com.interviewportal.scheduler.repository.InterviewRepository;
import com.interviewportal.scheduler.repository.RescheduleRequestRepository;
import com.interviewportal.scheduler.repository.WhiteboardSnapshotRepository;
import com.interviewportal.scheduler.security.AccessPolicy;
import com.interviewportal.scheduler.security.Caller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * State machine for a live interview:
 * <pre>
 *   scheduled --join--> in_progress --complete--> completed
 *   scheduled | in_progress --cancel--> cancelled
 *   scheduled (time passed, nobody joined) --markNoShow--> no_show
 * </pre>
 * The move to {@code rescheduled} belongs to {@link RescheduleService}. Every transition
 * locks the interview row; a rejected transition throws before anything is written.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InterviewLifecycleService {

    private final InterviewRepository interviewRepository;
    private final EvaluationRepository evaluationRepository;
    private final InterviewRecordingRepository recordingRepository;
    private final RescheduleRequestRepository rescheduleRequestRepository;
    private final CodeSnapshotRepository codeSnapshotRepository;
    private final WhiteboardSnapshotRepository whiteboardSnapshotRepository;
    private final NotificationService notificationService;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    // ─── Queries ────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public Interview getInterview(UUID interviewId) {
        return interviewRepository.findById(interviewId)
                .orElseThrow(() -> new NotFoundException("Interview", interviewId));
    }

    @Transactional(readOnly = true)
    public Interview getInterviewByRoom(String roomId) {
        return interviewRepository.findByRoomId(roomId)
                .orElseThrow(() -> new NotFoundException("Interview room", roomId));
    }

    @Transactional(readOnly = true)
    public List<Interview> listByInterviewer(UUID interviewerId, Instant from, Instant to) {
        if (from == null && to == null) {
            return interviewRepository.findByInterviewerIdOrderByScheduledAtAsc(interviewerId);
        }
        return interviewRepository.findByInterviewerIdAndScheduledAtBetweenOrderByScheduledAtAsc(interviewerId,
                from != null ? from : Instant.EPOCH,
                to != null ? to : Instant.parse("9999-12-31T23:59:59Z"));
    }

    @Transactional(readOnly = true)
    public List<Interview> listByCandidate(UUID candidateId) {
        return interviewRepository.findByCandidateIdOrderByScheduledAtAsc(candidateId);
    }

    // ─── Transitions ────────────────────────────────────────────────────

    /**
     * Records the first time {@code party} entered the room. Later calls for the same party
     * change nothing, even once the interview has closed. The first join on a scheduled
     * interview starts it.
     */
    @Transactional
    public Interview recordJoin(Caller caller, UUID interviewId, Party party) {
        Interview interview = lock(interviewId);
        accessPolicy.requireJoinAs(caller, interview, party);

        Instant existing = party == Party.INTERVIEWER
                ? interview.getInterviewerJoinedAt()
                : interview.getCandidateJoinedAt();
        if (existing != null) {
            log.debug("Repeat join by {} on interview {} ignored", party.getValue(), interviewId);
            return interview;
        }
        if (!interview.getStatus().isOpen()) {
            throw InvalidTransitionException.of("interview", interview.getStatus().getValue(),
                    InterviewStatus.IN_PROGRESS.getValue());
        }

        Instant now = clock.instant();
        Instant latest = latestOf(interview.getInterviewerJoinedAt(), interview.getCandidateJoinedAt(),
                interview.getActualStartTime());
        if (latest != null && now.isBefore(latest)) {
            throw InvalidTransitionException.because(interview.getStatus().getValue(),
                    InterviewStatus.IN_PROGRESS.getValue(), "Join time " + now + " precedes recorded time " + latest);
        }

        if (party == Party.INTERVIEWER) {
            interview.setInterviewerJoinedAt(now);
        } else {
            interview.setCandidateJoinedAt(now);
        }
        if (interview.getStatus() == InterviewStatus.SCHEDULED) {
            interview.setStatus(InterviewStatus.IN_PROGRESS);
            if (interview.getActualStartTime() == null) {
                interview.setActualStartTime(now);
            }
            log.info("Interview {} started by {} join", interviewId, party.getValue());
        }
        interview.setUpdatedAt(now);
        return interviewRepository.save(interview);
    }

    /**
     * Ends the interview. Legal from in_progress, or from scheduled when
     * {@code allowFromScheduled} is set for interviews held offline.
     */
    @Transactional
    public Interview complete(Caller caller, UUID interviewId, boolean allowFromScheduled) {
        Interview interview = lock(interviewId);
        accessPolicy.requireConductor(caller, interview, "complete interviews");

        InterviewStatus status = interview.getStatus();
        boolean legal = status == InterviewStatus.IN_PROGRESS
                || (status == InterviewStatus.SCHEDULED && allowFromScheduled);
        if (!legal) {
            throw InvalidTransitionException.of("interview", status.getValue(), InterviewStatus.COMPLETED.getValue());
        }

        Instant now = clock.instant();
        Instant start = interview.getActualStartTime() != null ? interview.getActualStartTime() : now;
        Instant latest = latestOf(start, interview.getInterviewerJoinedAt(), interview.getCandidateJoinedAt());
        if (now.isBefore(latest)) {
            throw InvalidTransitionException.because(status.getValue(), InterviewStatus.COMPLETED.getValue(),
                    "End time " + now + " precedes recorded time " + latest);
        }

        interview.setActualStartTime(start);
        interview.setActualEndTime(now);
        interview.setStatus(InterviewStatus.COMPLETED);
        interview.setUpdatedAt(now);
        log.info("Interview {} completed", interviewId);
        return interviewRepository.save(interview);
    }

    @Transactional
    public Interview cancel(Caller caller, UUID interviewId, String reason) {
        Interview interview = lock(interviewId);
        accessPolicy.requireConductor(caller, interview, "cancel interviews");

        if (!interview.getStatus().isOpen()) {
            throw InvalidTransitionException.of("interview", interview.getStatus().getValue(),
                    InterviewStatus.CANCELLED.getValue());
        }

        Instant now = clock.instant();
        interview.setStatus(InterviewStatus.CANCELLED);
        interview.setCancellationReason(reason == null || reason.isBlank() ? null : reason.trim());
        interview.setUpdatedAt(now);
        Interview saved = interviewRepository.save(interview);
        notificationService.interviewCancelled(saved);
        log.info("Interview {} cancelled", interviewId);
        return saved;
    }

    /**
     * Marks a scheduled interview nobody attended. Driven by an external timer (see
     * {@link NoShowSweeper}) once the start time has passed.
     */
    @Transactional
    public Interview markNoShow(Caller caller, UUID interviewId) {
        Interview interview = lock(interviewId);
        accessPolicy.requireConductor(caller, interview, "mark no-shows");

        String current = interview.getStatus().getValue();
        String attempted = InterviewStatus.NO_SHOW.getValue();
        if (interview.getStatus() != InterviewStatus.SCHEDULED) {
            throw InvalidTransitionException.of("interview", current, attempted);
        }
        if (interview.hasAnyJoin()) {
            throw InvalidTransitionException.because(current, attempted, "A participant already joined interview " + interviewId);
        }
        Instant now = clock.instant();
        if (now.isBefore(interview.getScheduledAt())) {
            throw InvalidTransitionException.because(current, attempted,
                    "Interview " + interviewId + " is not due until " + interview.getScheduledAt());
        }

        interview.setStatus(InterviewStatus.NO_SHOW);
        interview.setUpdatedAt(now);
        log.info("Interview {} marked as no-show", interviewId);
        return interviewRepository.save(interview);
    }

    // ─── Edits ──────────────────────────────────────────────────────────

    /**
     * Admin edit of descriptive fields and tool flags. Time, duration and participants only
     * change through a reschedule.
     */
    @Transactional
    public Interview updateDetails(Caller caller, UUID interviewId, InterviewUpdateDto dto) {
        accessPolicy.requireAdmin(caller, "edit interviews");
        Interview interview = lock(interviewId);
        if (!interview.getStatus().isOpen()) {
            throw InvalidTransitionException.because(interview.getStatus().getValue(), "updated",
                    "Only scheduled or in-progress interviews can be edited");
        }

        if (dto.getTitle() != null) {
            String title = dto.getTitle().trim();
            if (title.length() < 3 || title.length() > 200) {
                throw new ValidationException("title must be between 3 and 200 characters");
            }
            interview.setTitle(title);
        }
        if (dto.getPosition() != null) {
            String position = dto.getPosition().trim();
            if (position.length() > 100) {
                throw new ValidationException("position must be at most 100 characters");
            }
            interview.setPosition(position.isEmpty() ? null : position);
        }
        if (Boolean.FALSE.equals(dto.getRecordingEnabled()) && interview.isRecordingEnabled()) {
            recordingRepository.findFirstByInterviewIdAndStatusIn(interviewId, RecordingStatus.ACTIVE)
                    .ifPresent(active -> {
                        throw new ConflictException("recording_active",
                                "Stop recording " + active.getId() + " before disabling recording", active.getId());
                    });
        }
        if (dto.getRecordingEnabled() != null) {
            interview.setRecordingEnabled(dto.getRecordingEnabled());
        }
        if (dto.getCodeEditorEnabled() != null) {
            interview.setCodeEditorEnabled(dto.getCodeEditorEnabled());
        }
        if (dto.getWhiteboardEnabled() != null) {
            interview.setWhiteboardEnabled(dto.getWhiteboardEnabled());
        }
        if (dto.getProgrammingLanguages() != null) {
            if (dto.getProgrammingLanguages().stream().anyMatch(l -> l == null || l.isBlank())) {
                throw new ValidationException("programming_languages contains an empty entry");
            }
            interview.setProgrammingLanguages(new ArrayList<>(dto.getProgrammingLanguages()));
        }
        if (dto.getEvaluationCriteria() != null) {
            interview.setEvaluationCriteria(new HashMap<>(dto.getEvaluationCriteria()));
        }

        interview.setUpdatedAt(clock.instant());
        log.info("Interview {} details updated", interviewId);
        return interviewRepository.save(interview);
    }

    // ─── Removal ────────────────────────────────────────────────────────

    @Transactional
    public void deleteInterview(Caller caller, UUID interviewId) {
        accessPolicy.requireAdmin(caller, "delete interviews");
        Interview interview = getInterview(interviewId);
        purge(List.of(interview));
        log.info("Deleted interview {} and its records", interviewId);
    }

    /**
     * Removes every interview of a candidate together with the records they own. Called when
     * the candidate is deleted upstream.
     */
    @Transactional
    public int purgeCandidate(Caller caller, UUID candidateId) {
        accessPolicy.requireAdmin(caller, "purge candidates");
        List<Interview> interviews = interviewRepository.findByCandidateIdOrderByScheduledAtAsc(candidateId);
        purge(interviews);
        log.info("Purged {} interviews of candidate {}", interviews.size(), candidateId);
        return interviews.size();
    }

    private void purge(List<Interview> interviews) {
        if (interviews.isEmpty()) {
            return;
        }
        List<UUID> ids = interviews.stream().map(Interview::getId).collect(Collectors.toList());
        evaluationRepository.deleteByInterviewIdIn(ids);
        recordingRepository.deleteByInterviewIdIn(ids);
        rescheduleRequestRepository.deleteByInterviewIdIn(ids);
        codeSnapshotRepository.deleteByInterviewIdIn(ids);
        whiteboardSnapshotRepository.deleteByInterviewIdIn(ids);
        interviewRepository.deleteAll(interviews);
    }

    private Interview lock(UUID interviewId) {
        return interviewRepository.lockById(interviewId)
                .orElseThrow(() -> new NotFoundException("Interview", interviewId));
    }

    private static Instant latestOf(Instant... instants) {
        Instant latest = null;
        for (Instant instant : instants) {
            if (instant != null && (latest == null || instant.isAfter(latest))) {
                latest = instant;
            }
        }
        return latest;
    }
}
