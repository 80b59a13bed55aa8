package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.IntegrationTestSupport;
import com.interviewportal.scheduler.dto.RecordingFinishDto;
import com.interviewportal.scheduler.dto.ScheduleInterviewRequestDto;
import com.interviewportal.scheduler.exception.ConflictException;
import com.interviewportal.scheduler.exception.InvalidTransitionException;
import com.interviewportal.scheduler.exception.ValidationException;
import com.interviewportal.scheduler.model.Interview;
import com.interviewportal.scheduler.model.InterviewRecording;
import com.interviewportal.scheduler.model.RecordingStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordingServiceTest extends IntegrationTestSupport {

    @Autowired
    private RecordingService recordingService;

    @Autowired
    private InterviewLifecycleService lifecycleService;

    @Test
    void recordingRunsToCompletionAndPublishesUrl() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = schedule(interviewerId, MONDAY_10, 60);
        clock.set(MONDAY_10);

        InterviewRecording recording = recordingService.startRecording(interviewer(interviewerId), interview.getId());
        assertThat(recording.getStatus()).isEqualTo(RecordingStatus.RECORDING);

        assertThatThrownBy(() -> recordingService.startRecording(ADMIN, interview.getId()))
                .isInstanceOfSatisfying(ConflictException.class,
                        e -> assertThat(e.getConflictingId()).isEqualTo(recording.getId()));

        clock.advance(Duration.ofMinutes(45));
        InterviewRecording processing = recordingService.stopRecording(ADMIN, recording.getId());
        assertThat(processing.getStatus()).isEqualTo(RecordingStatus.PROCESSING);
        assertThat(processing.getEndedAt()).isEqualTo(clock.instant());

        assertThatThrownBy(() -> recordingService.startRecording(ADMIN, interview.getId()))
                .isInstanceOf(ConflictException.class);

        clock.advance(Duration.ofMinutes(5));
        InterviewRecording completed = recordingService.finishProcessing(ADMIN, recording.getId(),
                new RecordingFinishDto("https://media.example.com/rec/1.mp4", 2700, 52_000_000L));
        assertThat(completed.getStatus()).isEqualTo(RecordingStatus.COMPLETED);
        assertThat(completed.getProcessedAt()).isEqualTo(clock.instant());
        assertThat(interviewRepository.findById(interview.getId()).orElseThrow().getRecordingUrl())
                .isEqualTo("https://media.example.com/rec/1.mp4");

        InterviewRecording next = recordingService.startRecording(ADMIN, interview.getId());
        assertThat(recordingService.listRecordings(interview.getId()))
                .extracting(InterviewRecording::getId)
                .containsExactly(recording.getId(), next.getId());
    }

    @Test
    void failureIsReachableFromActiveStatesOnly() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = schedule(interviewerId, MONDAY_10, 60);

        InterviewRecording recording = recordingService.startRecording(ADMIN, interview.getId());
        InterviewRecording failed = recordingService.markFailed(ADMIN, recording.getId(), "Encoder crashed");
        assertThat(failed.getStatus()).isEqualTo(RecordingStatus.FAILED);
        assertThat(failed.getFailureReason()).isEqualTo("Encoder crashed");

        assertThatThrownBy(() -> recordingService.markFailed(ADMIN, recording.getId(), "again"))
                .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> recordingService.stopRecording(ADMIN, recording.getId()))
                .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> recordingService.finishProcessing(ADMIN, recording.getId(),
                new RecordingFinishDto("https://media.example.com/x.mp4", 1, 1L)))
                .isInstanceOf(InvalidTransitionException.class);

        InterviewRecording retry = recordingService.startRecording(ADMIN, interview.getId());
        assertThat(retry.getStatus()).isEqualTo(RecordingStatus.RECORDING);
    }

    @Test
    void finishRequiresProcessing() {
        UUID interviewerId = interviewerWithStandardWeek();
        Interview interview = schedule(interviewerId, MONDAY_10, 60);
        InterviewRecording recording = recordingService.startRecording(ADMIN, interview.getId());

        assertThatThrownBy(() -> recordingService.finishProcessing(ADMIN, recording.getId(),
                new RecordingFinishDto("https://media.example.com/x.mp4", 1, 1L)))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void disabledOrClosedInterviewsCannotRecord() {
        UUID interviewerId = interviewerWithStandardWeek();
        ScheduleInterviewRequestDto dto = bookingRequest(interviewerId, MONDAY_10, 60);
        dto.setRecordingEnabled(false);
        Interview unrecorded = schedulingService.scheduleInterview(ADMIN, dto);

        assertThatThrownBy(() -> recordingService.startRecording(ADMIN, unrecorded.getId()))
                .isInstanceOf(ValidationException.class);

        Interview cancelled = schedule(interviewerId, MONDAY_10.plus(Duration.ofDays(1)), 60);
        lifecycleService.cancel(ADMIN, cancelled.getId(), "Role filled");
        assertThatThrownBy(() -> recordingService.startRecording(ADMIN, cancelled.getId()))
                .isInstanceOf(InvalidTransitionException.class);
    }
}
