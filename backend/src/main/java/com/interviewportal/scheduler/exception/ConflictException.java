package com.interviewportal.scheduler.exception;

import org.springframework.http.HttpStatus;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public class ConflictException extends InterviewPortalException {

    private final String reason;
    private final UUID conflictingId;

    public ConflictException(String reason, String message) {
        this(reason, message, null);
    }

    public ConflictException(String reason, String message, UUID conflictingId) {
        super(message);
        this.reason = reason;
        this.conflictingId = conflictingId;
    }

    public String getReason() {
        return reason;
    }

    public UUID getConflictingId() {
        return conflictingId;
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }

    @Override
    public String getCode() {
        return "conflict";
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason);
        if (conflictingId != null) {
            details.put("conflicting_id", conflictingId.toString());
        }
        return details;
    }
}
