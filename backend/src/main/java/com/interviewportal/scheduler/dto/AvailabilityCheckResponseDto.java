package com.interviewportal.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AvailabilityCheckResponseDto {
    private UUID interviewerId;
    private Instant start;
    private Integer durationMinutes;
    private boolean available;
    private String reason;
    private UUID conflictingInterviewId;
}
