package com.interviewportal.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleInterviewRequestDto {
    private UUID candidateId;
    private UUID interviewerId;
    private String title;
    private String position;
    private String interviewType;
    private Instant scheduledAt;
    private Integer durationMinutes = 60;
    private Integer roundNumber = 1;
    private Boolean recordingEnabled = true;
    private Boolean codeEditorEnabled = false;
    private Boolean whiteboardEnabled = false;
    private List<String> programmingLanguages = List.of();
    private Map<String, Object> evaluationCriteria;
}
