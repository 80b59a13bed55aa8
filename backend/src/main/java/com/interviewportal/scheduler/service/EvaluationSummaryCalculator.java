package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.dto.EvaluationSummaryDto;
import com.interviewportal.scheduler.model.Evaluation;
import com.interviewportal.scheduler.model.Recommendation;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Folds the evaluations of one interview into a summary. Pure; no persistence.
 */
public final class EvaluationSummaryCalculator {

    private EvaluationSummaryCalculator() {
    }

    public static EvaluationSummaryDto summarize(UUID interviewId, List<Evaluation> evaluations) {
        Map<Recommendation, Long> counts = new EnumMap<>(Recommendation.class);
        for (Recommendation recommendation : Recommendation.values()) {
            counts.put(recommendation, 0L);
        }
        evaluations.forEach(e -> counts.merge(e.getRecommendation(), 1L, Long::sum));

        Map<String, Long> distribution = new LinkedHashMap<>();
        counts.forEach((recommendation, count) -> distribution.put(recommendation.getValue(), count));

        EvaluationSummaryDto.EvaluationSummaryDtoBuilder summary = EvaluationSummaryDto.builder()
                .interviewId(interviewId)
                .evaluationCount(evaluations.size())
                .averageTechnicalSkills(mean(evaluations, Evaluation::getTechnicalSkills))
                .averageProblemSolving(mean(evaluations, Evaluation::getProblemSolving))
                .averageCommunication(mean(evaluations, Evaluation::getCommunication))
                .averageCulturalFit(mean(evaluations, Evaluation::getCulturalFit))
                .averageOverallRating(mean(evaluations, Evaluation::getOverallRating))
                .recommendationDistribution(distribution);

        if (evaluations.isEmpty()) {
            return summary.build();
        }

        long top = counts.values().stream().mapToLong(Long::longValue).max().orElse(0L);
        List<Recommendation> leaders = counts.entrySet().stream()
                .filter(entry -> entry.getValue() == top)
                .map(Map.Entry::getKey)
                .sorted(Comparator.comparingInt(Recommendation::tieBreakRank))
                .collect(Collectors.toList());

        return summary
                .overallRecommendation(leaders.get(0).getValue())
                .tieBroken(leaders.size() > 1)
                .build();
    }

    /** Mean of the present ratings rounded to two decimals, or null when none were given. */
    static Double mean(List<Evaluation> evaluations, Function<Evaluation, Integer> rating) {
        OptionalDouble average = evaluations.stream()
                .map(rating)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .average();
        if (average.isEmpty()) {
            return null;
        }
        return Math.round(average.getAsDouble() * 100) / 100.0;
    }
}
