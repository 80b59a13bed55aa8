package com.interviewportal.scheduler.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.interviewportal.scheduler.exception.ValidationException;

public enum Party {
    INTERVIEWER("interviewer"),
    CANDIDATE("candidate");

    private final String value;

    Party(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Party fromValue(String raw) {
        if ("interviewer".equalsIgnoreCase(raw)) {
            return INTERVIEWER;
        }
        if ("candidate".equalsIgnoreCase(raw)) {
            return CANDIDATE;
        }
        throw new ValidationException("party must be 'interviewer' or 'candidate', got '" + raw + "'");
    }
}
