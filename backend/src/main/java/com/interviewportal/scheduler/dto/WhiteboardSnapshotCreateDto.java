package com.interviewportal.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WhiteboardSnapshotCreateDto {
    private Map<String, Object> data;
    private String imageUrl;
}
