package com.interviewportal.scheduler.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

@Entity
@Immutable
@Table(name = "code_snapshots", indexes = @Index(name = "idx_code_snapshots_interview", columnList = "interview_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CodeSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "interview_id", nullable = false, updatable = false)
    private UUID interviewId;

    @Column(nullable = false, updatable = false, length = 50)
    private String language;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String code;

    @Column(name = "author_id", updatable = false)
    private UUID authorId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
