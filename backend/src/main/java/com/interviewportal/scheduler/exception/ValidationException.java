package com.interviewportal.scheduler.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends InterviewPortalException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }

    @Override
    public String getCode() {
        return "validation_error";
    }
}
