package com.interviewportal.scheduler.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RescheduleStatus {
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected");

    private final String value;

    RescheduleStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
