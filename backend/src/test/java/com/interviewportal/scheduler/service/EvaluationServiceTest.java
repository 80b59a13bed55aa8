package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.IntegrationTestSupport;
import com.interviewportal.scheduler.dto.EvaluationSubmissionDto;
import com.interviewportal.scheduler.dto.EvaluationSummaryDto;
import com.interviewportal.scheduler.exception.AccessDeniedException;
import com.interviewportal.scheduler.exception.InvalidTransitionException;
import com.interviewportal.scheduler.exception.ValidationException;
import com.interviewportal.scheduler.model.Evaluation;
import com.interviewportal.scheduler.model.Interview;
import com.interviewportal.scheduler.model.Party;
import com.interviewportal.scheduler.model.Recommendation;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvaluationServiceTest extends IntegrationTestSupport {

    @Autowired
    private EvaluationService evaluationService;

    @Autowired
    private InterviewLifecycleService lifecycleService;

    @Test
    void resubmissionReplacesTheEvaluatorsEvaluation() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = startedInterview(interviewerId);

        Evaluation first = evaluationService.submitEvaluation(interviewer(interviewerId), interview.getId(),
                submission(4, "hire"));
        clock.advance(Duration.ofMinutes(10));
        EvaluationSubmissionDto revised = submission(2, "no_hire");
        revised.setCustomRatings(Map.of("api_design", 3));
        Evaluation second = evaluationService.submitEvaluation(interviewer(interviewerId), interview.getId(), revised);

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(evaluationService.listEvaluations(interview.getId()))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.getTechnicalSkills()).isEqualTo(2);
                    assertThat(e.getRecommendation()).isEqualTo(Recommendation.NO_HIRE);
                    assertThat(e.getCustomRatings()).containsEntry("api_design", 3);
                    assertThat(e.getSubmittedAt()).isEqualTo(first.getSubmittedAt());
                    assertThat(e.getUpdatedAt()).isEqualTo(clock.instant());
                });
    }

    @Test
    void summaryAcrossEvaluators() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = startedInterview(interviewerId);

        evaluationService.submitEvaluation(interviewer(interviewerId), interview.getId(), submission(4, "hire"));
        evaluationService.submitEvaluation(ADMIN, interview.getId(), submission(3, "no_hire"));

        EvaluationSummaryDto summary = evaluationService.summarize(interview.getId());
        assertThat(summary.getEvaluationCount()).isEqualTo(2);
        assertThat(summary.getAverageTechnicalSkills()).isEqualTo(3.5);
        assertThat(summary.getOverallRecommendation()).isEqualTo("no_hire");
    }

    @Test
    void rejectsOutOfRangeRatingsAndUnknownRecommendation() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = startedInterview(interviewerId);

        assertThatThrownBy(() -> evaluationService.submitEvaluation(ADMIN, interview.getId(), submission(6, "hire")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> evaluationService.submitEvaluation(ADMIN, interview.getId(), submission(0, "hire")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> evaluationService.submitEvaluation(ADMIN, interview.getId(), submission(3, "great")))
                .isInstanceOf(ValidationException.class);
        EvaluationSubmissionDto badCustom = submission(3, "maybe");
        badCustom.setCustomRatings(Map.of("teamwork", 9));
        assertThatThrownBy(() -> evaluationService.submitEvaluation(ADMIN, interview.getId(), badCustom))
                .isInstanceOf(ValidationException.class);

        assertThat(evaluationService.listEvaluations(interview.getId())).isEmpty();
    }

    @Test
    void onlyStartedInterviewsByConductors() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview scheduled = schedule(interviewerId, MONDAY_10, 60);

        assertThatThrownBy(() -> evaluationService.submitEvaluation(interviewer(interviewerId), scheduled.getId(),
                submission(4, "hire")))
                .isInstanceOf(InvalidTransitionException.class);

        Interview started = startedInterview(interviewerId);
        assertThatThrownBy(() -> evaluationService.submitEvaluation(candidate(started), started.getId(), submission(4, "hire")))
                .isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> evaluationService.submitEvaluation(interviewer(UUID.randomUUID()), started.getId(),
                submission(4, "hire")))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    void simultaneousFirstSubmissionsCollapseIntoOneEvaluation() throws Exception {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = startedInterview(interviewerId);
        int threads = 4;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Evaluation>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                int technical = i + 1;
                futures.add(executor.submit(() -> {
                    go.await();
                    return evaluationService.submitEvaluation(interviewer(interviewerId), interview.getId(),
                            submission(technical, "maybe"));
                }));
            }
            go.countDown();
            for (Future<Evaluation> future : futures) {
                assertThat(future.get(30, TimeUnit.SECONDS).getEvaluatorId()).isEqualTo(interviewerId);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(evaluationRepository.findByInterviewIdOrderBySubmittedAtAsc(interview.getId())).hasSize(1);
    }

    @Test
    void purgingCandidateRemovesInterviewsAndEvaluations() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = startedInterview(interviewerId);
        evaluationService.submitEvaluation(ADMIN, interview.getId(), submission(4, "hire"));

        int removed = lifecycleService.purgeCandidate(ADMIN, interview.getCandidateId());

        assertThat(removed).isEqualTo(1);
        assertThat(interviewRepository.findById(interview.getId())).isEmpty();
        assertThat(evaluationRepository.findByInterviewIdOrderBySubmittedAtAsc(interview.getId())).isEmpty();
    }

    private Interview startedInterview(UUID interviewerId) {
        Interview interview = schedule(interviewerId, MONDAY_10.plus(Duration.ofDays(2)), 60);
        clock.set(MONDAY_10.plus(Duration.ofDays(2)));
        return lifecycleService.recordJoin(interviewer(interviewerId), interview.getId(), Party.INTERVIEWER);
    }

    private static EvaluationSubmissionDto submission(int technical, String recommendation) {
        EvaluationSubmissionDto dto = new EvaluationSubmissionDto();
        dto.setTechnicalSkills(technical);
        dto.setProblemSolving(technical);
        dto.setCommunication(4);
        dto.setCulturalFit(4);
        dto.setOverallRating(technical);
        dto.setRecommendation(recommendation);
        dto.setStrengths("Clear reasoning");
        return dto;
    }
}
