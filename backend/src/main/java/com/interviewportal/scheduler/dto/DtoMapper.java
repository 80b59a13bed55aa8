package com.interviewportal.scheduler.dto;

import com.interviewportal.scheduler.model.Evaluation;
import com.interviewportal.scheduler.model.Interview;
import com.interviewportal.scheduler.model.InterviewerAvailability;

import java.time.DayOfWeek;
import java.util.HashMap;
import java.util.List;
import java.util.stream.Collectors;

public final class DtoMapper {

    private DtoMapper() {
    }

    public static InterviewResponseDto toDto(Interview interview) {
        return InterviewResponseDto.builder()
                .id(interview.getId())
                .candidateId(interview.getCandidateId())
                .interviewerId(interview.getInterviewerId())
                .title(interview.getTitle())
                .position(interview.getPosition())
                .interviewType(interview.getInterviewType().getValue())
                .status(interview.getStatus().getValue())
                .scheduledAt(interview.getScheduledAt())
                .durationMinutes(interview.getDurationMinutes())
                .roundNumber(interview.getRoundNumber())
                .roomId(interview.getRoomId())
                .meetingUrl(interview.getMeetingUrl())
                .actualStartTime(interview.getActualStartTime())
                .actualEndTime(interview.getActualEndTime())
                .interviewerJoinedAt(interview.getInterviewerJoinedAt())
                .candidateJoinedAt(interview.getCandidateJoinedAt())
                .recordingEnabled(interview.isRecordingEnabled())
                .recordingUrl(interview.getRecordingUrl())
                .codeEditorEnabled(interview.isCodeEditorEnabled())
                .whiteboardEnabled(interview.isWhiteboardEnabled())
                .programmingLanguages(List.copyOf(interview.getProgrammingLanguages()))
                .evaluationCriteria(interview.getEvaluationCriteria())
                .cancellationReason(interview.getCancellationReason())
                .rescheduledFromId(interview.getRescheduledFromId())
                .createdAt(interview.getCreatedAt())
                .updatedAt(interview.getUpdatedAt())
                .build();
    }

    public static List<InterviewResponseDto> toInterviewDtos(List<Interview> interviews) {
        return interviews.stream().map(DtoMapper::toDto).collect(Collectors.toList());
    }

    public static EvaluationResponseDto toDto(Evaluation evaluation) {
        return EvaluationResponseDto.builder()
                .id(evaluation.getId())
                .interviewId(evaluation.getInterviewId())
                .evaluatorId(evaluation.getEvaluatorId())
                .technicalSkills(evaluation.getTechnicalSkills())
                .problemSolving(evaluation.getProblemSolving())
                .communication(evaluation.getCommunication())
                .culturalFit(evaluation.getCulturalFit())
                .overallRating(evaluation.getOverallRating())
                .recommendation(evaluation.getRecommendation().getValue())
                .strengths(evaluation.getStrengths())
                .weaknesses(evaluation.getWeaknesses())
                .detailedFeedback(evaluation.getDetailedFeedback())
                .notes(evaluation.getNotes())
                .customRatings(new HashMap<>(evaluation.getCustomRatings()))
                .submittedAt(evaluation.getSubmittedAt())
                .updatedAt(evaluation.getUpdatedAt())
                .build();
    }

    public static AvailabilityResponseDto toDto(InterviewerAvailability availability) {
        return AvailabilityResponseDto.builder()
                .interviewerId(availability.getInterviewerId())
                .availableDays(availability.getAvailableDays().stream()
                        .sorted()
                        .map(DayOfWeek::name)
                        .map(String::toLowerCase)
                        .collect(Collectors.toList()))
                .availableHoursStart(availability.getStartTime())
                .availableHoursEnd(availability.getEndTime())
                .bufferTimeMinutes(availability.getBufferMinutes())
                .maxInterviewsPerDay(availability.getMaxInterviewsPerDay())
                .unavailableDates(availability.getUnavailableDates().stream().sorted().collect(Collectors.toList()))
                .timezone(availability.getTimezone())
                .updatedAt(availability.getUpdatedAt())
                .build();
    }
}
