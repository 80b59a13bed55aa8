package com.interviewportal.scheduler.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum UnavailabilityReason {
    OUTSIDE_WORKING_DAYS("outside_working_days"),
    OUTSIDE_WORKING_HOURS("outside_working_hours"),
    BLACKOUT_DATE("blackout_date"),
    DAILY_LIMIT_REACHED("daily_limit_reached"),
    OVERLAPPING_INTERVIEW("overlapping_interview");

    private final String value;

    UnavailabilityReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
