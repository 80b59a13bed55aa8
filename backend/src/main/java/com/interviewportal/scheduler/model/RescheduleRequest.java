package com.interviewportal.scheduler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "reschedule_requests", indexes = @Index(name = "idx_reschedule_requests_interview", columnList = "interview_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RescheduleRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "interview_id", nullable = false)
    private UUID interviewId;

    @Column(name = "requested_by", nullable = false)
    private UUID requestedBy;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String reason;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "reschedule_proposed_times", joinColumns = @JoinColumn(name = "request_id"))
    @OrderColumn(name = "sort_order")
    @Column(name = "proposed_time", nullable = false)
    private List<Instant> proposedTimes = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private RescheduleStatus status = RescheduleStatus.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolved_by")
    private UUID resolvedBy;

    @Column(name = "chosen_time")
    private Instant chosenTime;

    @Column(name = "resulting_interview_id")
    private UUID resultingInterviewId;

    @Version
    private Long version;

    @JsonIgnore
    public boolean isPending() {
        return status == RescheduleStatus.PENDING;
    }
}
