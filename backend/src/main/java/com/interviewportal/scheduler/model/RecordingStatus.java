package com.interviewportal.scheduler.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

public enum RecordingStatus {
    RECORDING("recording"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    public static final Set<RecordingStatus> ACTIVE = EnumSet.of(RECORDING, PROCESSING);

    private final String value;

    RecordingStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
