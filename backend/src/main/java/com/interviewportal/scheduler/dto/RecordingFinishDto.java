package com.interviewportal.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecordingFinishDto {
    private String videoUrl;
    private Integer durationSeconds;
    private Long fileSizeBytes;
}
