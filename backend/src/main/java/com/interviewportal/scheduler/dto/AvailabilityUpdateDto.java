package com.interviewportal.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilityUpdateDto {
    private List<String> availableDays;
    private LocalTime availableHoursStart;
    private LocalTime availableHoursEnd;
    private Integer bufferTimeMinutes = 15;
    private Integer maxInterviewsPerDay = 5;
    private List<LocalDate> unavailableDates = List.of();
    private String timezone = "UTC";
}
