package com.interviewportal.scheduler.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.interviewportal.scheduler.exception.ValidationException;

import java.util.Arrays;

public enum Recommendation {
    STRONG_HIRE("strong_hire", 3),
    HIRE("hire", 4),
    MAYBE("maybe", 2),
    NO_HIRE("no_hire", 1),
    STRONG_NO_HIRE("strong_no_hire", 0);

    private final String value;
    private final int tieBreakRank;

    Recommendation(String value, int tieBreakRank) {
        this.value = value;
        this.tieBreakRank = tieBreakRank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    // lower rank wins an exact tie
    public int tieBreakRank() {
        return tieBreakRank;
    }

    public static Recommendation fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("recommendation is required");
        }
        return Arrays.stream(values())
                .filter(r -> r.value.equalsIgnoreCase(raw.trim()))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown recommendation '" + raw + "'"));
    }
}
