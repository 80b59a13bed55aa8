package com.interviewportal.scheduler.security;

import lombok.Value;

import java.util.UUID;

@Value
public class Caller {
    UUID userId;
    Role role;

    /** Identity used by in-process timers acting on behalf of the platform. */
    public static final Caller SYSTEM = new Caller(null, Role.ADMIN);

    public static Caller of(UUID userId, Role role) {
        return new Caller(userId, role);
    }

    public static Caller admin(UUID userId) {
        return new Caller(userId, Role.ADMIN);
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public boolean is(UUID otherId) {
        return userId != null && userId.equals(otherId);
    }
}
