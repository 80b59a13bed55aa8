package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.dto.DtoMapper;
import com.interviewportal.scheduler.dto.RescheduleOutcomeDto;
import com.interviewportal.scheduler.exception.AlreadyResolvedException;
import com.interviewportal.scheduler.exception.InvalidTransitionException;
import com.interviewportal.scheduler.exception.NotFoundException;
import com.interviewportal.scheduler.exception.ValidationException;
import com.interviewportal.scheduler.model.Interview;
import com.interviewportal.scheduler.model.InterviewStatus;
import com.interviewportal.scheduler.model.ProposedTimes;
import com.interviewportal.scheduler.model.RescheduleDecision;
import com.interviewportal.scheduler.model.RescheduleRequest;
import com.interviewportal.scheduler.model.RescheduleStatus;
import com.interviewportal.scheduler.repository.InterviewRepository;
import com.interviewportal.scheduler.repository.RescheduleRequestRepository;
import com.interviewportal.scheduler.security.AccessPolicy;
import com.interviewportal.scheduler.security.Caller;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;

/**
 * Two-step negotiation for moving an interview: a participant proposes alternative start
 * times, an admin approves one of them or rejects the request.
 *
 * <p>Approval books the chosen time through {@link SchedulingService#commitBooking} while
 * excluding the interview being moved, then retires the old row as {@code rescheduled}.
 * If the slot is taken the whole transaction rolls back and the request stays pending.
 */
@Service
@Slf4j
public class RescheduleService {

    private static final int MIN_REASON_LENGTH = 10;
    private static final int MAX_REASON_LENGTH = 500;

    private final RescheduleRequestRepository requestRepository;
    private final InterviewRepository interviewRepository;
    private final SchedulingService schedulingService;
    private final SchedulingPolicy schedulingPolicy;
    private final NotificationService notificationService;
    private final AccessPolicy accessPolicy;
    private final int maxProposals;

    public RescheduleService(RescheduleRequestRepository requestRepository,
                             InterviewRepository interviewRepository,
                             SchedulingService schedulingService,
                             SchedulingPolicy schedulingPolicy,
                             NotificationService notificationService,
                             AccessPolicy accessPolicy,
                             @Value("${reschedule.max-proposals:5}") int maxProposals) {
        this.requestRepository = requestRepository;
        this.interviewRepository = interviewRepository;
        this.schedulingService = schedulingService;
        this.schedulingPolicy = schedulingPolicy;
        this.notificationService = notificationService;
        this.accessPolicy = accessPolicy;
        this.maxProposals = maxProposals;
    }

    @Transactional
    public RescheduleRequest requestReschedule(Caller caller, UUID interviewId, String reason, List<Instant> proposed) {
        Interview interview = interviewRepository.findById(interviewId)
                .orElseThrow(() -> new NotFoundException("Interview", interviewId));
        accessPolicy.requireParticipant(caller, interview, "request a reschedule");
        if (caller.getUserId() == null) {
            throw new ValidationException("A requester identity is required");
        }
        if (!interview.getStatus().isOpen()) {
            throw InvalidTransitionException.of("interview", interview.getStatus().getValue(),
                    InterviewStatus.RESCHEDULED.getValue());
        }

        String trimmedReason = reason == null ? "" : reason.trim();
        if (trimmedReason.length() < MIN_REASON_LENGTH || trimmedReason.length() > MAX_REASON_LENGTH) {
            throw new ValidationException("reason must be between " + MIN_REASON_LENGTH + " and "
                    + MAX_REASON_LENGTH + " characters");
        }
        ProposedTimes times = ProposedTimes.of(proposed, maxProposals);
        times.asList().forEach(schedulingPolicy::validateStart);

        RescheduleRequest request = new RescheduleRequest();
        request.setInterviewId(interviewId);
        request.setRequestedBy(caller.getUserId());
        request.setReason(trimmedReason);
        request.setProposedTimes(new ArrayList<>(times.asList()));
        request.setStatus(RescheduleStatus.PENDING);
        request.setCreatedAt(schedulingPolicy.now());

        RescheduleRequest saved = requestRepository.save(request);
        notificationService.rescheduleRequested(interview, saved.getId(), caller.getUserId());
        log.info("Reschedule request {} opened for interview {} with {} proposal(s)", saved.getId(),
                interviewId, times.asList().size());
        return saved;
    }

    @Transactional
    public RescheduleOutcomeDto resolveReschedule(Caller caller, UUID requestId, String rawDecision, Instant chosenTime) {
        accessPolicy.requireAdmin(caller, "resolve reschedule requests");
        RescheduleDecision decision = RescheduleDecision.fromValue(rawDecision);

        RescheduleRequest request = requestRepository.lockById(requestId)
                .orElseThrow(() -> new NotFoundException("Reschedule request", requestId));
        if (!request.isPending()) {
            throw new AlreadyResolvedException(requestId, request.getStatus().getValue());
        }

        if (decision == RescheduleDecision.REJECTED) {
            return reject(caller, request);
        }
        return approve(caller, request, chosenTime);
    }

    @Transactional(readOnly = true)
    public List<RescheduleRequest> listRescheduleRequests(UUID interviewId) {
        if (!interviewRepository.existsById(interviewId)) {
            throw new NotFoundException("Interview", interviewId);
        }
        return requestRepository.findByInterviewIdOrderByCreatedAtAsc(interviewId);
    }

    @Transactional(readOnly = true)
    public RescheduleRequest getRescheduleRequest(UUID requestId) {
        return requestRepository.findById(requestId)
                .orElseThrow(() -> new NotFoundException("Reschedule request", requestId));
    }

    private RescheduleOutcomeDto reject(Caller caller, RescheduleRequest request) {
        Interview interview = interviewRepository.findById(request.getInterviewId())
                .orElseThrow(() -> new NotFoundException("Interview", request.getInterviewId()));

        request.setStatus(RescheduleStatus.REJECTED);
        request.setResolvedAt(schedulingPolicy.now());
        request.setResolvedBy(caller.getUserId());
        RescheduleRequest saved = requestRepository.save(request);

        notificationService.rescheduleRejected(interview, saved.getId(), saved.getRequestedBy());
        log.info("Reschedule request {} rejected", saved.getId());
        return RescheduleOutcomeDto.builder()
                .request(saved)
                .interview(DtoMapper.toDto(interview))
                .build();
    }

    private RescheduleOutcomeDto approve(Caller caller, RescheduleRequest request, Instant chosenTime) {
        if (chosenTime == null) {
            throw new ValidationException("chosen_time is required when approving");
        }
        if (!request.getProposedTimes().contains(chosenTime)) {
            throw new ValidationException("chosen_time " + chosenTime + " is not one of the proposed times");
        }
        schedulingPolicy.validateStart(chosenTime);

        Interview previous = interviewRepository.lockById(request.getInterviewId())
                .orElseThrow(() -> new NotFoundException("Interview", request.getInterviewId()));
        if (!previous.getStatus().isOpen()) {
            throw InvalidTransitionException.of("interview", previous.getStatus().getValue(),
                    InterviewStatus.RESCHEDULED.getValue());
        }

        Interview replacement = schedulingService.commitBooking(replacementFor(previous, chosenTime), previous.getId());

        Instant now = schedulingPolicy.now();
        previous.setStatus(InterviewStatus.RESCHEDULED);
        previous.setUpdatedAt(now);
        interviewRepository.save(previous);

        request.setStatus(RescheduleStatus.APPROVED);
        request.setResolvedAt(now);
        request.setResolvedBy(caller.getUserId());
        request.setChosenTime(chosenTime);
        request.setResultingInterviewId(replacement.getId());
        RescheduleRequest saved = requestRepository.save(request);

        notificationService.interviewRescheduled(previous, replacement);
        log.info("Reschedule request {} approved: interview {} moved to {} as {}", saved.getId(),
                previous.getId(), chosenTime, replacement.getId());
        return RescheduleOutcomeDto.builder()
                .request(saved)
                .previousInterview(DtoMapper.toDto(previous))
                .interview(DtoMapper.toDto(replacement))
                .build();
    }

    private static Interview replacementFor(Interview previous, Instant start) {
        Interview draft = new Interview();
        draft.setCandidateId(previous.getCandidateId());
        draft.setInterviewerId(previous.getInterviewerId());
        draft.setTitle(previous.getTitle());
        draft.setPosition(previous.getPosition());
        draft.setInterviewType(previous.getInterviewType());
        draft.setScheduledAt(start);
        draft.setDurationMinutes(previous.getDurationMinutes());
        draft.setRoundNumber(previous.getRoundNumber());
        draft.setRecordingEnabled(previous.isRecordingEnabled());
        draft.setCodeEditorEnabled(previous.isCodeEditorEnabled());
        draft.setWhiteboardEnabled(previous.isWhiteboardEnabled());
        draft.setProgrammingLanguages(new ArrayList<>(previous.getProgrammingLanguages()));
        draft.setEvaluationCriteria(previous.getEvaluationCriteria() == null
                ? null : new HashMap<>(previous.getEvaluationCriteria()));
        draft.setRescheduledFromId(previous.getId());
        draft.setCreatedBy(previous.getCreatedBy());
        return draft;
    }
}
