package com.interviewportal.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationSubmissionDto {
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
}
