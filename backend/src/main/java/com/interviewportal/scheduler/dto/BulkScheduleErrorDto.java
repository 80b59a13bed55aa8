package com.interviewportal.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BulkScheduleErrorDto {
    private UUID candidateId;
    private UUID interviewerId;
    private String code;
    private String error;
}
