package com.interviewportal.scheduler.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class InvalidTransitionException extends InterviewPortalException {

    private final String currentState;
    private final String attemptedState;

    private InvalidTransitionException(String message, String currentState, String attemptedState) {
        super(message);
        this.currentState = currentState;
        this.attemptedState = attemptedState;
    }

    public static InvalidTransitionException of(String entity, String currentState, String attemptedState) {
        return new InvalidTransitionException(
                "Cannot move " + entity + " from '" + currentState + "' to '" + attemptedState + "'",
                currentState, attemptedState);
    }

    public static InvalidTransitionException because(String currentState, String attemptedState, String reason) {
        return new InvalidTransitionException(reason, currentState, attemptedState);
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getAttemptedState() {
        return attemptedState;
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }

    @Override
    public String getCode() {
        return "invalid_transition";
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("current_state", currentState, "attempted_state", attemptedState);
    }
}
