package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.exception.ValidationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Component
public class SchedulingPolicy {

    private final Clock clock;
    private final Duration pastGrace;
    private final int minDurationMinutes;
    private final int maxDurationMinutes;

    public SchedulingPolicy(Clock clock,
                            @Value("${scheduling.past-grace-minutes:5}") long pastGraceMinutes,
                            @Value("${scheduling.min-duration-minutes:15}") int minDurationMinutes,
                            @Value("${scheduling.max-duration-minutes:240}") int maxDurationMinutes) {
        this.clock = clock;
        this.pastGrace = Duration.ofMinutes(pastGraceMinutes);
        this.minDurationMinutes = Math.max(1, minDurationMinutes);
        this.maxDurationMinutes = maxDurationMinutes;
    }

    public void validateStart(Instant start) {
        if (start == null) {
            throw new ValidationException("scheduled start time is required");
        }
        Instant earliest = clock.instant().minus(pastGrace);
        if (start.isBefore(earliest)) {
            throw new ValidationException("Start time " + start + " is in the past");
        }
    }

    public void validateDuration(Integer durationMinutes) {
        if (durationMinutes == null || durationMinutes <= 0) {
            throw new ValidationException("duration_minutes must be positive");
        }
        if (durationMinutes < minDurationMinutes || durationMinutes > maxDurationMinutes) {
            throw new ValidationException("duration_minutes must be between " + minDurationMinutes
                    + " and " + maxDurationMinutes);
        }
    }

    public Instant now() {
        return clock.instant();
    }
}
