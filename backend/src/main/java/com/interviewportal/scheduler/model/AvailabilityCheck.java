package com.interviewportal.scheduler.model;

import lombok.Value;

import java.util.UUID;

@Value
public class AvailabilityCheck {

    private static final AvailabilityCheck AVAILABLE = new AvailabilityCheck(true, null, null);

    boolean available;
    UnavailabilityReason reason;
    UUID conflictingInterviewId;

    public static AvailabilityCheck available() {
        return AVAILABLE;
    }

    public static AvailabilityCheck unavailable(UnavailabilityReason reason) {
        return new AvailabilityCheck(false, reason, null);
    }

    public static AvailabilityCheck overlapping(UUID conflictingInterviewId) {
        return new AvailabilityCheck(false, UnavailabilityReason.OVERLAPPING_INTERVIEW, conflictingInterviewId);
    }
}
