package com.interviewportal.scheduler.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;
import java.util.UUID;

public class AlreadyResolvedException extends InterviewPortalException {

    private final UUID requestId;
    private final String status;

    public AlreadyResolvedException(UUID requestId, String status) {
        super("Reschedule request " + requestId + " is already " + status);
        this.requestId = requestId;
        this.status = status;
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }

    @Override
    public String getCode() {
        return "already_resolved";
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("request_id", requestId.toString(), "status", status);
    }
}
