package com.interviewportal.scheduler.model;

import com.interviewportal.scheduler.exception.ValidationException;

public enum RescheduleDecision {
    APPROVED,
    REJECTED;

    public static RescheduleDecision fromValue(String raw) {
        if ("approved".equalsIgnoreCase(raw)) {
            return APPROVED;
        }
        if ("rejected".equalsIgnoreCase(raw)) {
            return REJECTED;
        }
        throw new ValidationException("decision must be 'approved' or 'rejected', got '" + raw + "'");
    }
}
