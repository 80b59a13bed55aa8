package com.interviewportal.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkScheduleRequestDto {
    private String interviewType;
    private Integer durationMinutes = 60;
    private LocalDate dateRangeStart;
    private LocalDate dateRangeEnd;
    private List<UUID> interviewerIds = List.of();
    private Boolean autoAssign = true;
    private List<BulkCandidateDto> candidates = List.of();
    private Boolean recordingEnabled = true;
    private Boolean codeEditorEnabled = false;
    private Boolean whiteboardEnabled = false;
    private List<String> programmingLanguages = List.of();
}
