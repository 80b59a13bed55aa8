package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.IntegrationTestSupport;
import com.interviewportal.scheduler.dto.InterviewUpdateDto;
import com.interviewportal.scheduler.exception.AccessDeniedException;
import com.interviewportal.scheduler.exception.InvalidTransitionException;
import com.interviewportal.scheduler.exception.NotFoundException;
import com.interviewportal.scheduler.exception.ValidationException;
import com.interviewportal.scheduler.model.Interview;
import com.interviewportal.scheduler.model.InterviewStatus;
import com.interviewportal.scheduler.model.Party;
import com.interviewportal.scheduler.security.Caller;
import com.interviewportal.scheduler.security.Role;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InterviewLifecycleServiceTest extends IntegrationTestSupport {

    @Autowired
    private InterviewLifecycleService lifecycleService;

    @Test
    void firstJoinStartsInterviewAndRepeatsAreNoOps() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = schedule(interviewerId, MONDAY_10, 60);
        Caller candidate = candidate(interview);

        clock.set(MONDAY_10.minus(Duration.ofMinutes(2)));
        Interview started = lifecycleService.recordJoin(candidate, interview.getId(), Party.CANDIDATE);
        assertThat(started.getStatus()).isEqualTo(InterviewStatus.IN_PROGRESS);
        assertThat(started.getCandidateJoinedAt()).isEqualTo(clock.instant());
        assertThat(started.getActualStartTime()).isEqualTo(clock.instant());
        assertThat(started.getInterviewerJoinedAt()).isNull();

        Instant firstJoin = clock.instant();
        clock.advance(Duration.ofMinutes(3));
        Interview repeated = lifecycleService.recordJoin(candidate, interview.getId(), Party.CANDIDATE);
        assertThat(repeated.getCandidateJoinedAt()).isEqualTo(firstJoin);
        assertThat(repeated.getActualStartTime()).isEqualTo(firstJoin);

        Interview both = lifecycleService.recordJoin(interviewer(interviewerId), interview.getId(), Party.INTERVIEWER);
        assertThat(both.getInterviewerJoinedAt()).isEqualTo(clock.instant());
        assertThat(both.getActualStartTime()).isEqualTo(firstJoin);
        assertThat(both.getStatus()).isEqualTo(InterviewStatus.IN_PROGRESS);
    }

    @Test
    void repeatJoinAfterCompletionIsIgnored() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = schedule(interviewerId, MONDAY_10, 60);
        clock.set(MONDAY_10);
        Instant joinedAt = lifecycleService.recordJoin(interviewer(interviewerId), interview.getId(), Party.INTERVIEWER)
                .getInterviewerJoinedAt();
        clock.advance(Duration.ofMinutes(45));
        lifecycleService.complete(interviewer(interviewerId), interview.getId(), false);
        Interview completed = interviewRepository.findById(interview.getId()).orElseThrow();

        clock.advance(Duration.ofMinutes(1));
        Interview repeated = lifecycleService.recordJoin(interviewer(interviewerId), interview.getId(), Party.INTERVIEWER);

        assertThat(repeated.getStatus()).isEqualTo(InterviewStatus.COMPLETED);
        assertThat(repeated.getInterviewerJoinedAt()).isEqualTo(joinedAt);
        assertThat(repeated.getVersion()).isEqualTo(completed.getVersion());
        assertThatThrownBy(() -> lifecycleService.recordJoin(candidate(interview), interview.getId(), Party.CANDIDATE))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void otherCandidatesCannotJoinSomeoneElsesInterview() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = schedule(interviewerId, MONDAY_10, 60);
        Caller stranger = Caller.of(UUID.randomUUID(), Role.CANDIDATE);

        clock.set(MONDAY_10);
        assertThatThrownBy(() -> lifecycleService.recordJoin(stranger, interview.getId(), Party.CANDIDATE))
                .isInstanceOf(AccessDeniedException.class);

        Interview untouched = interviewRepository.findById(interview.getId()).orElseThrow();
        assertThat(untouched.getStatus()).isEqualTo(InterviewStatus.SCHEDULED);
        assertThat(untouched.getCandidateJoinedAt()).isNull();

        clock.advance(Duration.ofMinutes(20));
        assertThat(lifecycleService.markNoShow(ADMIN, interview.getId()).getStatus()).isEqualTo(InterviewStatus.NO_SHOW);
    }

    @Test
    void adminEditsDetailsButNotTheSlot() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = schedule(interviewerId, MONDAY_10, 60);
        InterviewUpdateDto edit = new InterviewUpdateDto();
        edit.setTitle("  Platform Engineer - Round 1 ");
        edit.setCodeEditorEnabled(true);
        edit.setProgrammingLanguages(List.of("java", "go"));
        edit.setEvaluationCriteria(Map.of("system_design", 2));

        clock.advance(Duration.ofMinutes(5));
        Interview updated = lifecycleService.updateDetails(ADMIN, interview.getId(), edit);

        assertThat(updated.getTitle()).isEqualTo("Platform Engineer - Round 1");
        assertThat(updated.isCodeEditorEnabled()).isTrue();
        assertThat(updated.getProgrammingLanguages()).containsExactly("java", "go");
        assertThat(updated.getEvaluationCriteria()).containsEntry("system_design", 2);
        assertThat(updated.getPosition()).isEqualTo(interview.getPosition());
        assertThat(updated.getScheduledAt()).isEqualTo(MONDAY_10);
        assertThat(updated.getRoomId()).isEqualTo(interview.getRoomId());
        assertThat(updated.getUpdatedAt()).isEqualTo(clock.instant());

        InterviewUpdateDto shortTitle = new InterviewUpdateDto();
        shortTitle.setTitle("x");
        assertThatThrownBy(() -> lifecycleService.updateDetails(ADMIN, interview.getId(), shortTitle))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> lifecycleService.updateDetails(interviewer(interviewerId), interview.getId(), edit))
                .isInstanceOf(AccessDeniedException.class);

        lifecycleService.cancel(ADMIN, interview.getId(), null);
        assertThatThrownBy(() -> lifecycleService.updateDetails(ADMIN, interview.getId(), edit))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void completeSetsEndAfterStart() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = schedule(interviewerId, MONDAY_10, 60);
        clock.set(MONDAY_10);
        lifecycleService.recordJoin(interviewer(interviewerId), interview.getId(), Party.INTERVIEWER);

        clock.advance(Duration.ofMinutes(55));
        Interview completed = lifecycleService.complete(interviewer(interviewerId), interview.getId(), false);

        assertThat(completed.getStatus()).isEqualTo(InterviewStatus.COMPLETED);
        assertThat(completed.getActualStartTime()).isEqualTo(MONDAY_10);
        assertThat(completed.getActualEndTime()).isEqualTo(MONDAY_10.plus(Duration.ofMinutes(55)));
    }

    @Test
    void completeFromScheduledNeedsOverride() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = schedule(interviewerId, MONDAY_10, 60);
        clock.set(MONDAY_10.plus(Duration.ofHours(1)));

        assertThatThrownBy(() -> lifecycleService.complete(ADMIN, interview.getId(), false))
                .isInstanceOfSatisfying(InvalidTransitionException.class, e -> {
                    assertThat(e.getCurrentState()).isEqualTo("scheduled");
                    assertThat(e.getAttemptedState()).isEqualTo("completed");
                });

        Interview completed = lifecycleService.complete(ADMIN, interview.getId(), true);
        assertThat(completed.getStatus()).isEqualTo(InterviewStatus.COMPLETED);
        assertThat(completed.getActualStartTime()).isEqualTo(completed.getActualEndTime());
    }

    @Test
    void illegalTransitionsLeaveInterviewUntouched() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = schedule(interviewerId, MONDAY_10, 60);
        lifecycleService.cancel(ADMIN, interview.getId(), "Candidate withdrew");
        Interview cancelled = interviewRepository.findById(interview.getId()).orElseThrow();

        clock.advance(Duration.ofHours(1));
        assertThatThrownBy(() -> lifecycleService.recordJoin(candidate(interview), interview.getId(), Party.CANDIDATE))
                .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> lifecycleService.complete(ADMIN, interview.getId(), true))
                .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> lifecycleService.cancel(ADMIN, interview.getId(), "again"))
                .isInstanceOf(InvalidTransitionException.class);

        Interview after = interviewRepository.findById(interview.getId()).orElseThrow();
        assertThat(after.getStatus()).isEqualTo(InterviewStatus.CANCELLED);
        assertThat(after.getCancellationReason()).isEqualTo("Candidate withdrew");
        assertThat(after.getUpdatedAt()).isEqualTo(cancelled.getUpdatedAt());
        assertThat(after.getVersion()).isEqualTo(cancelled.getVersion());
        assertThat(after.getCandidateJoinedAt()).isNull();
    }

    @Test
    void cancelledSlotCanBeBookedAgain() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = schedule(interviewerId, MONDAY_10, 60);

        lifecycleService.cancel(interviewer(interviewerId), interview.getId(), null);

        assertThat(schedule(interviewerId, MONDAY_10, 60).getId()).isNotEqualTo(interview.getId());
    }

    @Test
    void noShowOnlyAfterStartAndWithoutJoins() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = schedule(interviewerId, MONDAY_10, 60);

        assertThatThrownBy(() -> lifecycleService.markNoShow(ADMIN, interview.getId()))
                .isInstanceOf(InvalidTransitionException.class);

        clock.set(MONDAY_10.plus(Duration.ofMinutes(20)));
        Interview noShow = lifecycleService.markNoShow(ADMIN, interview.getId());
        assertThat(noShow.getStatus()).isEqualTo(InterviewStatus.NO_SHOW);

        Interview joined = schedule(interviewerId, MONDAY_10.plus(Duration.ofDays(1)), 60);
        clock.set(MONDAY_10.plus(Duration.ofDays(1)));
        lifecycleService.recordJoin(candidate(joined), joined.getId(), Party.CANDIDATE);
        clock.advance(Duration.ofMinutes(30));
        assertThatThrownBy(() -> lifecycleService.markNoShow(ADMIN, joined.getId()))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void joinRolesAreChecked() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = schedule(interviewerId, MONDAY_10, 60);

        assertThatThrownBy(() -> lifecycleService.recordJoin(interviewer(UUID.randomUUID()), interview.getId(),
                Party.INTERVIEWER))
                .isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> lifecycleService.recordJoin(candidate(interview), interview.getId(), Party.INTERVIEWER))
                .isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> lifecycleService.cancel(candidate(interview), interview.getId(), "no"))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    void queriesByRoomInterviewerAndCandidate() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview monday = schedule(interviewerId, MONDAY_10, 60);
        Interview tuesday = schedule(interviewerId, MONDAY_10.plus(Duration.ofDays(1)), 60);

        assertThat(lifecycleService.getInterviewByRoom(monday.getRoomId()).getId()).isEqualTo(monday.getId());
        assertThat(lifecycleService.listByInterviewer(interviewerId, null, null))
                .extracting(Interview::getId).containsExactly(monday.getId(), tuesday.getId());
        assertThat(lifecycleService.listByInterviewer(interviewerId, MONDAY_10.plus(Duration.ofHours(12)), null))
                .extracting(Interview::getId).containsExactly(tuesday.getId());
        assertThat(lifecycleService.listByCandidate(tuesday.getCandidateId()))
                .extracting(Interview::getId).containsExactly(tuesday.getId());
        assertThatThrownBy(() -> lifecycleService.getInterviewByRoom("room_000000000000"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void deleteAndPurgeAreAdminOnly() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = schedule(interviewerId, MONDAY_10, 60);

        assertThatThrownBy(() -> lifecycleService.deleteInterview(interviewer(interviewerId), interview.getId()))
                .isInstanceOf(AccessDeniedException.class);

        lifecycleService.deleteInterview(ADMIN, interview.getId());
        assertThat(interviewRepository.findById(interview.getId())).isEmpty();
    }
}
