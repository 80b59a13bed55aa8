package com.interviewportal.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvaluationSummaryDto {
    private UUID interviewId;
    private int evaluationCount;
    private Double averageTechnicalSkills;
    private Double averageProblemSolving;
    private Double averageCommunication;
    private Double averageCulturalFit;
    private Double averageOverallRating;
    private Map<String, Long> recommendationDistribution;
    private String overallRecommendation;
    /** True when the overall recommendation came from the tie-break rather than a strict majority. */
    private boolean tieBroken;
}
