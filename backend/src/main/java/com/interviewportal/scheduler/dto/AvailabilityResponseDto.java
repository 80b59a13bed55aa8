package com.interviewportal.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AvailabilityResponseDto {
    private UUID interviewerId;
    private List<String> availableDays;
    private LocalTime availableHoursStart;
    private LocalTime availableHoursEnd;
    private Integer bufferTimeMinutes;
    private Integer maxInterviewsPerDay;
    private List<LocalDate> unavailableDates;
    private String timezone;
    private Instant updatedAt;
}
