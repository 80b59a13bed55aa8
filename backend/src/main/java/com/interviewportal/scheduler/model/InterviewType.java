package com.interviewportal.scheduler.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.interviewportal.scheduler.exception.ValidationException;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum InterviewType {
    PHONE_SCREEN("phone_screen"),
    TECHNICAL("technical"),
    SYSTEM_DESIGN("system_design"),
    BEHAVIORAL("behavioral"),
    HR("hr"),
    FINAL("final"),
    MIXED("mixed");

    private final String value;

    InterviewType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static InterviewType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("interview_type is required");
        }
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(raw.trim()))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown interview_type '" + raw + "', expected one of "
                        + Arrays.stream(values()).map(InterviewType::getValue).collect(Collectors.joining(", "))));
    }
}
