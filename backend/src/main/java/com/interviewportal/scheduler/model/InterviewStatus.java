package com.interviewportal.scheduler.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

public enum InterviewStatus {
    SCHEDULED("scheduled"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    CANCELLED("cancelled"),
    RESCHEDULED("rescheduled"),
    NO_SHOW("no_show");

    /** Statuses that occupy a slot on the interviewer's calendar. */
    public static final Set<InterviewStatus> BOOKED = EnumSet.of(SCHEDULED, IN_PROGRESS, COMPLETED);

    /** Statuses from which the session can still change course. */
    public static final Set<InterviewStatus> OPEN = EnumSet.of(SCHEDULED, IN_PROGRESS);

    private final String value;

    InterviewStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isOpen() {
        return OPEN.contains(this);
    }
}
