package com.interviewportal.scheduler.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "evaluations", uniqueConstraints = @UniqueConstraint(
        name = "uk_evaluations_interview_evaluator", columnNames = {"interview_id", "evaluator_id"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Evaluation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "interview_id", nullable = false)
    private UUID interviewId;

    @Column(name = "evaluator_id", nullable = false)
    private UUID evaluatorId;

    @Column(name = "technical_skills")
    private Integer technicalSkills;

    @Column(name = "problem_solving")
    private Integer problemSolving;

    private Integer communication;

    @Column(name = "cultural_fit")
    private Integer culturalFit;

    @Column(name = "overall_rating")
    private Integer overallRating;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private Recommendation recommendation;

    @Column(columnDefinition = "TEXT")
    private String strengths;

    @Column(columnDefinition = "TEXT")
    private String weaknesses;

    @Column(name = "detailed_feedback", columnDefinition = "TEXT")
    private String detailedFeedback;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "evaluation_custom_ratings", joinColumns = @JoinColumn(name = "evaluation_id"))
    @MapKeyColumn(name = "criterion", length = 100)
    @Column(name = "rating", nullable = false)
    private Map<String, Integer> customRatings = new HashMap<>();

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private Instant submittedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;
}
