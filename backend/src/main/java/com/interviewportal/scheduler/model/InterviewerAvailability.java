package com.interviewportal.scheduler.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "interviewer_availability")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InterviewerAvailability {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "interviewer_id", nullable = false, unique = true)
    private UUID interviewerId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "availability_days", joinColumns = @JoinColumn(name = "availability_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false)
    private Set<DayOfWeek> availableDays = EnumSet.noneOf(DayOfWeek.class);

    @Column(name = "available_hours_start", nullable = false)
    private LocalTime startTime = LocalTime.of(9, 0);

    @Column(name = "available_hours_end", nullable = false)
    private LocalTime endTime = LocalTime.of(17, 0);

    @Column(name = "buffer_time_minutes", nullable = false)
    private Integer bufferMinutes = 15;

    @Column(name = "max_interviews_per_day", nullable = false)
    private Integer maxInterviewsPerDay = 5;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "availability_blackout_dates", joinColumns = @JoinColumn(name = "availability_id"))
    @Column(name = "unavailable_date", nullable = false)
    private Set<LocalDate> unavailableDates = new HashSet<>();

    @Column(nullable = false)
    private String timezone = "UTC";

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;
}
