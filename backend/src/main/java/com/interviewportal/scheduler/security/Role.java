package com.interviewportal.scheduler.security;

import com.interviewportal.scheduler.exception.AccessDeniedException;

public enum Role {
    ADMIN,
    INTERVIEWER,
    CANDIDATE;

    public static Role fromHeader(String raw) {
        if (raw != null) {
            for (Role role : values()) {
                if (role.name().equalsIgnoreCase(raw.trim())) {
                    return role;
                }
            }
        }
        throw new AccessDeniedException("Unknown role '" + raw + "'");
    }
}
