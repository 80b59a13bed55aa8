package com.interviewportal.scheduler.exception;

import org.springframework.http.HttpStatus;

public class AccessDeniedException extends InterviewPortalException {

    public AccessDeniedException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.FORBIDDEN;
    }

    @Override
    public String getCode() {
        return "access_denied";
    }
}
