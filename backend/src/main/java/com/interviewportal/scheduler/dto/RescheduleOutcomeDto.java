package com.interviewportal.scheduler.dto;

import com.interviewportal.scheduler.model.RescheduleRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RescheduleOutcomeDto {
    private RescheduleRequest request;
    private InterviewResponseDto previousInterview;
    private InterviewResponseDto interview;
}
