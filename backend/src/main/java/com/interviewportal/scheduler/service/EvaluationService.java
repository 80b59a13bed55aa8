package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.dto.EvaluationSubmissionDto;
import com.interviewportal.scheduler.dto.EvaluationSummaryDto;
import com.interviewportal.scheduler.exception.InvalidTransitionException;
import com.interviewportal.scheduler.exception.NotFoundException;
import com.interviewportal.scheduler.exception.ValidationException;
import com.interviewportal.scheduler.model.Evaluation;
import com.interviewportal.scheduler.model.Interview;
import com.interviewportal.scheduler.model.InterviewStatus;
import com.interviewportal.scheduler.model.Recommendation;
import com.interviewportal.scheduler.repository.EvaluationRepository;
import com.interviewportal.scheduler.repository.InterviewRepository;
import com.interviewportal.scheduler.security.AccessPolicy;
import com.interviewportal.scheduler.security.Caller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class EvaluationService {

    private static final int MIN_RATING = 1;
    private static final int MAX_RATING = 5;

    private final EvaluationRepository evaluationRepository;
    private final InterviewRepository interviewRepository;
    private final NotificationService notificationService;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    /**
     * Creates or replaces the caller's evaluation of an interview. One evaluation per
     * (interview, evaluator); resubmitting overwrites every field.
     */
    @Transactional
    public Evaluation submitEvaluation(Caller caller, UUID interviewId, EvaluationSubmissionDto dto) {
        accessPolicy.requireEvaluator(caller);
        if (caller.getUserId() == null) {
            throw new ValidationException("An evaluator identity is required");
        }
        // serializes first submissions for the same evaluator
        Interview interview = interviewRepository.lockById(interviewId)
                .orElseThrow(() -> new NotFoundException("Interview", interviewId));
        accessPolicy.requireConductor(caller, interview, "evaluate this interview");

        InterviewStatus status = interview.getStatus();
        if (status != InterviewStatus.IN_PROGRESS && status != InterviewStatus.COMPLETED) {
            throw InvalidTransitionException.because(status.getValue(), "evaluated",
                    "Only in-progress or completed interviews can be evaluated");
        }

        Recommendation recommendation = Recommendation.fromValue(dto.getRecommendation());
        checkRating("technical_skills", dto.getTechnicalSkills());
        checkRating("problem_solving", dto.getProblemSolving());
        checkRating("communication", dto.getCommunication());
        checkRating("cultural_fit", dto.getCulturalFit());
        checkRating("overall_rating", dto.getOverallRating());
        Map<String, Integer> customRatings = dto.getCustomRatings() == null ? Map.of() : dto.getCustomRatings();
        customRatings.forEach((criterion, rating) -> {
            if (criterion == null || criterion.isBlank()) {
                throw new ValidationException("custom_ratings contains an unnamed criterion");
            }
            if (rating == null) {
                throw new ValidationException("custom_ratings." + criterion + " must be between "
                        + MIN_RATING + " and " + MAX_RATING);
            }
            checkRating("custom_ratings." + criterion, rating);
        });

        Instant now = clock.instant();
        Evaluation evaluation = evaluationRepository.findByInterviewIdAndEvaluatorId(interviewId, caller.getUserId())
                .orElseGet(() -> {
                    Evaluation fresh = new Evaluation();
                    fresh.setInterviewId(interviewId);
                    fresh.setEvaluatorId(caller.getUserId());
                    fresh.setSubmittedAt(now);
                    return fresh;
                });
        boolean update = evaluation.getId() != null;

        evaluation.setTechnicalSkills(dto.getTechnicalSkills());
        evaluation.setProblemSolving(dto.getProblemSolving());
        evaluation.setCommunication(dto.getCommunication());
        evaluation.setCulturalFit(dto.getCulturalFit());
        evaluation.setOverallRating(dto.getOverallRating());
        evaluation.setRecommendation(recommendation);
        evaluation.setStrengths(dto.getStrengths());
        evaluation.setWeaknesses(dto.getWeaknesses());
        evaluation.setDetailedFeedback(dto.getDetailedFeedback());
        evaluation.setNotes(dto.getNotes());
        evaluation.setCustomRatings(new HashMap<>(customRatings));
        evaluation.setUpdatedAt(now);

        Evaluation saved = evaluationRepository.saveAndFlush(evaluation);
        notificationService.evaluationSubmitted(interview, caller.getUserId());
        log.info("{} evaluation {} for interview {} by {} ({})", update ? "Updated" : "Recorded", saved.getId(),
                interviewId, caller.getUserId(), recommendation.getValue());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Evaluation> listEvaluations(UUID interviewId) {
        requireInterview(interviewId);
        return evaluationRepository.findByInterviewIdOrderBySubmittedAtAsc(interviewId);
    }

    @Transactional(readOnly = true)
    public EvaluationSummaryDto summarize(UUID interviewId) {
        requireInterview(interviewId);
        return EvaluationSummaryCalculator.summarize(interviewId,
                evaluationRepository.findByInterviewIdOrderBySubmittedAtAsc(interviewId));
    }

    private void requireInterview(UUID interviewId) {
        if (!interviewRepository.existsById(interviewId)) {
            throw new NotFoundException("Interview", interviewId);
        }
    }

    private static void checkRating(String field, Integer rating) {
        if (rating != null && (rating < MIN_RATING || rating > MAX_RATING)) {
            throw new ValidationException(field + " must be between " + MIN_RATING + " and " + MAX_RATING);
        }
    }
}
