package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.dto.RecordingFinishDto;
import com.interviewportal.scheduler.exception.ConflictException;
import com.interviewportal.scheduler.exception.InvalidTransitionException;
import com.interviewportal.scheduler.exception.NotFoundException;
import com.interviewportal.scheduler.exception.ValidationException;
import com.interviewportal.scheduler.model.Interview;
import com.interviewportal.scheduler.model.InterviewRecording;
import com.interviewportal.scheduler.model.RecordingStatus;
import com.interviewportal.scheduler.repository.InterviewRecordingRepository;
import com.interviewportal.scheduler.repository.InterviewRepository;
import com.interviewportal.scheduler.security.AccessPolicy;
import com.interviewportal.scheduler.security.Caller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Recording lifecycle: {@code recording -> processing -> completed}, with {@code failed}
 * reachable from either active state. At most one active recording per interview; the
 * check runs under the interview row lock.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RecordingService {

    private final InterviewRecordingRepository recordingRepository;
    private final InterviewRepository interviewRepository;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Transactional
    public InterviewRecording startRecording(Caller caller, UUID interviewId) {
        Interview interview = interviewRepository.lockById(interviewId)
                .orElseThrow(() -> new NotFoundException("Interview", interviewId));
        accessPolicy.requireConductor(caller, interview, "start recordings");

        if (!interview.isRecordingEnabled()) {
            throw new ValidationException("Recording is disabled for interview " + interviewId);
        }
        if (!interview.getStatus().isOpen()) {
            throw InvalidTransitionException.because(interview.getStatus().getValue(),
                    RecordingStatus.RECORDING.getValue(), "Interview " + interviewId + " is not open for recording");
        }
        recordingRepository.findFirstByInterviewIdAndStatusIn(interviewId, RecordingStatus.ACTIVE)
                .ifPresent(active -> {
                    throw new ConflictException("recording_active",
                            "Recording " + active.getId() + " is still " + active.getStatus().getValue(),
                            active.getId());
                });

        Instant now = clock.instant();
        InterviewRecording recording = new InterviewRecording();
        recording.setInterviewId(interviewId);
        recording.setStatus(RecordingStatus.RECORDING);
        recording.setStartedAt(now);
        recording.setCreatedAt(now);

        InterviewRecording saved = recordingRepository.save(recording);
        log.info("Recording {} started for interview {}", saved.getId(), interviewId);
        return saved;
    }

    @Transactional
    public InterviewRecording stopRecording(Caller caller, UUID recordingId) {
        InterviewRecording recording = load(caller, recordingId);
        requireStatus(recording, RecordingStatus.PROCESSING, RecordingStatus.RECORDING);

        Instant now = monotonicNow(recording, recording.getStartedAt(), RecordingStatus.PROCESSING);
        recording.setStatus(RecordingStatus.PROCESSING);
        recording.setEndedAt(now);
        log.info("Recording {} stopped, processing", recordingId);
        return recordingRepository.save(recording);
    }

    @Transactional
    public InterviewRecording finishProcessing(Caller caller, UUID recordingId, RecordingFinishDto dto) {
        InterviewRecording recording = load(caller, recordingId);
        requireStatus(recording, RecordingStatus.COMPLETED, RecordingStatus.PROCESSING);

        if (dto.getVideoUrl() == null || dto.getVideoUrl().isBlank()) {
            throw new ValidationException("video_url is required");
        }
        if (dto.getDurationSeconds() != null && dto.getDurationSeconds() < 0) {
            throw new ValidationException("duration_seconds must not be negative");
        }
        if (dto.getFileSizeBytes() != null && dto.getFileSizeBytes() < 0) {
            throw new ValidationException("file_size_bytes must not be negative");
        }

        Instant now = monotonicNow(recording, recording.getEndedAt(), RecordingStatus.COMPLETED);
        recording.setStatus(RecordingStatus.COMPLETED);
        recording.setVideoUrl(dto.getVideoUrl().trim());
        recording.setDurationSeconds(dto.getDurationSeconds());
        recording.setFileSizeBytes(dto.getFileSizeBytes());
        recording.setProcessedAt(now);
        InterviewRecording saved = recordingRepository.save(recording);

        Interview interview = interviewRepository.findById(recording.getInterviewId())
                .orElseThrow(() -> new NotFoundException("Interview", recording.getInterviewId()));
        interview.setRecordingUrl(saved.getVideoUrl());
        interview.setUpdatedAt(now);
        interviewRepository.save(interview);

        log.info("Recording {} completed for interview {}", recordingId, interview.getId());
        return saved;
    }

    @Transactional
    public InterviewRecording markFailed(Caller caller, UUID recordingId, String reason) {
        InterviewRecording recording = load(caller, recordingId);
        requireStatus(recording, RecordingStatus.FAILED, RecordingStatus.RECORDING, RecordingStatus.PROCESSING);

        recording.setStatus(RecordingStatus.FAILED);
        recording.setFailureReason(reason == null || reason.isBlank() ? null : reason.trim());
        if (recording.getEndedAt() == null) {
            recording.setEndedAt(monotonicNow(recording, recording.getStartedAt(), RecordingStatus.FAILED));
        }
        log.warn("Recording {} failed: {}", recordingId, recording.getFailureReason());
        return recordingRepository.save(recording);
    }

    @Transactional(readOnly = true)
    public List<InterviewRecording> listRecordings(UUID interviewId) {
        if (!interviewRepository.existsById(interviewId)) {
            throw new NotFoundException("Interview", interviewId);
        }
        return recordingRepository.findByInterviewIdOrderByStartedAtAsc(interviewId);
    }

    private InterviewRecording load(Caller caller, UUID recordingId) {
        InterviewRecording recording = recordingRepository.findById(recordingId)
                .orElseThrow(() -> new NotFoundException("Recording", recordingId));
        Interview interview = interviewRepository.findById(recording.getInterviewId())
                .orElseThrow(() -> new NotFoundException("Interview", recording.getInterviewId()));
        accessPolicy.requireConductor(caller, interview, "manage recordings");
        return recording;
    }

    private static void requireStatus(InterviewRecording recording, RecordingStatus attempted, RecordingStatus... from) {
        for (RecordingStatus status : from) {
            if (recording.getStatus() == status) {
                return;
            }
        }
        throw InvalidTransitionException.of("recording", recording.getStatus().getValue(), attempted.getValue());
    }

    private Instant monotonicNow(InterviewRecording recording, Instant previous, RecordingStatus attempted) {
        Instant now = clock.instant();
        if (previous != null && now.isBefore(previous)) {
            throw InvalidTransitionException.because(recording.getStatus().getValue(), attempted.getValue(),
                    "Clock reading " + now + " precedes " + previous);
        }
        return now;
    }
}
