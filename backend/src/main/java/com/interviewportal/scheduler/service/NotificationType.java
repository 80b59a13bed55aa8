package com.interviewportal.scheduler.service;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType {
    INTERVIEW_SCHEDULED("interview_scheduled"),
    INTERVIEW_CANCELLED("interview_cancelled"),
    INTERVIEW_RESCHEDULED("interview_rescheduled"),
    RESCHEDULE_REQUESTED("reschedule_requested"),
    RESCHEDULE_REJECTED("reschedule_rejected"),
    EVALUATION_SUBMITTED("evaluation_submitted");

    private final String value;

    NotificationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
