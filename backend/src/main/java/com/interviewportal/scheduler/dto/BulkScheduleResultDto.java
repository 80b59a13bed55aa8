package com.interviewportal.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BulkScheduleResultDto {
    private int totalCandidates;
    private int successfullyScheduled;
    private int failed;
    private List<InterviewResponseDto> interviews;
    private List<BulkScheduleErrorDto> errors;
}
