package com.interviewportal.scheduler.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "interviews", indexes = {
        @Index(name = "idx_interviews_interviewer", columnList = "interviewer_id"),
        @Index(name = "idx_interviews_candidate", columnList = "candidate_id"),
        @Index(name = "idx_interviews_scheduled_at", columnList = "scheduled_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Interview {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "candidate_id", nullable = false)
    private UUID candidateId;

    @Column(name = "interviewer_id", nullable = false)
    private UUID interviewerId;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 100)
    private String position;

    @Enumerated(EnumType.STRING)
    @Column(name = "interview_type", nullable = false, length = 50)
    private InterviewType interviewType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private InterviewStatus status = InterviewStatus.SCHEDULED;

    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Column(name = "duration_minutes", nullable = false)
    private Integer durationMinutes = 60;

    @Column(name = "round_number", nullable = false)
    private Integer roundNumber = 1;

    @Column(name = "room_id", nullable = false, unique = true, updatable = false, length = 100)
    private String roomId;

    @Column(name = "meeting_url", nullable = false, length = 500)
    private String meetingUrl;

    @Column(name = "actual_start_time")
    private Instant actualStartTime;

    @Column(name = "actual_end_time")
    private Instant actualEndTime;

    @Column(name = "interviewer_joined_at")
    private Instant interviewerJoinedAt;

    @Column(name = "candidate_joined_at")
    private Instant candidateJoinedAt;

    @Column(name = "recording_enabled", nullable = false)
    private boolean recordingEnabled = true;

    @Column(name = "recording_url", length = 1000)
    private String recordingUrl;

    @Column(name = "code_editor_enabled", nullable = false)
    private boolean codeEditorEnabled;

    @Column(name = "whiteboard_enabled", nullable = false)
    private boolean whiteboardEnabled;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "interview_languages", joinColumns = @JoinColumn(name = "interview_id"))
    @OrderColumn(name = "sort_order")
    @Column(name = "language", nullable = false, length = 50)
    private List<String> programmingLanguages = new ArrayList<>();

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "evaluation_criteria", columnDefinition = "TEXT")
    private Map<String, Object> evaluationCriteria;

    @Column(name = "cancellation_reason", columnDefinition = "TEXT")
    private String cancellationReason;

    @Column(name = "rescheduled_from_id")
    private UUID rescheduledFromId;

    @Column(name = "created_by")
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public Instant getScheduledEnd() {
        return scheduledAt.plus(Duration.ofMinutes(durationMinutes));
    }

    public boolean hasAnyJoin() {
        return interviewerJoinedAt != null || candidateJoinedAt != null;
    }
}
