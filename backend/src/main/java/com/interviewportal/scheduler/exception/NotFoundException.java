package com.interviewportal.scheduler.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class NotFoundException extends InterviewPortalException {

    private final String entity;
    private final Object reference;

    public NotFoundException(String entity, Object reference) {
        super(entity + " not found: " + reference);
        this.entity = entity;
        this.reference = reference;
    }

    public String getEntity() {
        return entity;
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.NOT_FOUND;
    }

    @Override
    public String getCode() {
        return "not_found";
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("entity", entity, "reference", String.valueOf(reference));
    }
}
