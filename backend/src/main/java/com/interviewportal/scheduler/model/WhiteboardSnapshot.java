package com.interviewportal.scheduler.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Immutable
@Table(name = "whiteboard_snapshots", indexes = @Index(name = "idx_whiteboard_snapshots_interview", columnList = "interview_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WhiteboardSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "interview_id", nullable = false, updatable = false)
    private UUID interviewId;

    @Convert(converter = JsonMapConverter.class)
    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private Map<String, Object> data;

    @Column(name = "image_url", updatable = false, length = 1000)
    private String imageUrl;

    @Column(name = "author_id", updatable = false)
    private UUID authorId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
