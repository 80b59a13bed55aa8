package com.interviewportal.scheduler.controller;

import com.interviewportal.scheduler.dto.AvailabilityCheckResponseDto;
import com.interviewportal.scheduler.dto.AvailabilityResponseDto;
import com.interviewportal.scheduler.dto.AvailabilityUpdateDto;
import com.interviewportal.scheduler.dto.DtoMapper;
import com.interviewportal.scheduler.dto.TimeSlotDto;
import com.interviewportal.scheduler.model.AvailabilityCheck;
import com.interviewportal.scheduler.security.Caller;
import com.interviewportal.scheduler.service.AvailabilityService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/interviewers/{interviewerId}")
@RequiredArgsConstructor
@Slf4j
public class AvailabilityController {

    private final AvailabilityService availabilityService;

    @PutMapping("/availability")
    public AvailabilityResponseDto setAvailability(Caller caller,
                                                   @PathVariable UUID interviewerId,
                                                   @RequestBody AvailabilityUpdateDto dto) {
        return DtoMapper.toDto(availabilityService.setAvailability(caller, interviewerId, dto));
    }

    @GetMapping("/availability")
    public AvailabilityResponseDto getAvailability(@PathVariable UUID interviewerId) {
        return DtoMapper.toDto(availabilityService.getAvailability(interviewerId));
    }

    @GetMapping("/availability/check")
    public AvailabilityCheckResponseDto checkAvailability(@PathVariable UUID interviewerId,
                                                          @RequestParam Instant start,
                                                          @RequestParam(name = "duration_minutes", defaultValue = "60") int durationMinutes) {
        AvailabilityCheck check = availabilityService.checkAvailability(interviewerId, start, durationMinutes);
        return AvailabilityCheckResponseDto.builder()
                .interviewerId(interviewerId)
                .start(start)
                .durationMinutes(durationMinutes)
                .available(check.isAvailable())
                .reason(check.getReason() == null ? null : check.getReason().getValue())
                .conflictingInterviewId(check.getConflictingInterviewId())
                .build();
    }

    @GetMapping("/slots")
    public List<TimeSlotDto> availableSlots(@PathVariable UUID interviewerId,
                                            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                            @RequestParam(name = "duration_minutes", defaultValue = "60") int durationMinutes) {
        return availabilityService.availableSlots(interviewerId, date, durationMinutes);
    }
}
