package com.interviewportal.scheduler.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Base of the typed failures returned by the scheduling core. Each subtype carries the
 * HTTP status it maps to and a machine-readable code plus structured details so callers
 * can decide on remediation without parsing messages.
 */
public abstract class InterviewPortalException extends RuntimeException {

    protected InterviewPortalException(String message) {
        super(message);
    }

    public abstract HttpStatus getStatus();

    public abstract String getCode();

    public Map<String, Object> getDetails() {
        return Map.of();
    }
}
