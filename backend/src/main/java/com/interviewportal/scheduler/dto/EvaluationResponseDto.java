package com.interviewportal.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvaluationResponseDto {
    private UUID id;
    private UUID interviewId;
    private UUID evaluatorId;
    private Integer technicalSkills;
    private Integer problemSolving;
    private Integer communication;
    private Integer culturalFit;
    private Integer overallRating;
    private String recommendation;
    private String strengths;
    private String weaknesses;
    private String detailedFeedback;
    private String notes;
    private Map<String, Integer> customRatings;
    private Instant submittedAt;
    private Instant updatedAt;
}
