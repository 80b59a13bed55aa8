package com.interviewportal.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InterviewResponseDto {
    private UUID id;
    private UUID candidateId;
    private UUID interviewerId;
    private String title;
    private String position;
    private String interviewType;
    private String status;
    private Instant scheduledAt;
    private Integer durationMinutes;
    private Integer roundNumber;
    private String roomId;
    private String meetingUrl;
    private Instant actualStartTime;
    private Instant actualEndTime;
    private Instant interviewerJoinedAt;
    private Instant candidateJoinedAt;
    private boolean recordingEnabled;
    private String recordingUrl;
    private boolean codeEditorEnabled;
    private boolean whiteboardEnabled;
    private List<String> programmingLanguages;
    private Map<String, Object> evaluationCriteria;
    private String cancellationReason;
    private UUID rescheduledFromId;
    private Instant createdAt;
    private Instant updatedAt;
}
