package com.interviewportal.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkCandidateDto {
    private UUID candidateId;
    private String position;
    private String title;
}
