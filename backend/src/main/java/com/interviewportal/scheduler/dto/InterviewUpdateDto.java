package com.interviewportal.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InterviewUpdateDto {
    private String title;
    private String position;
    private Boolean recordingEnabled;
    private Boolean codeEditorEnabled;
    private Boolean whiteboardEnabled;
    private List<String> programmingLanguages;
    private Map<String, Object> evaluationCriteria;
}
