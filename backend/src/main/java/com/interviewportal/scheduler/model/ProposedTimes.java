package com.interviewportal.scheduler.model;

import com.interviewportal.scheduler.exception.ValidationException;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class ProposedTimes {

    private final List<Instant> times;

    private ProposedTimes(List<Instant> times) {
        this.times = times;
    }

    public static ProposedTimes of(List<Instant> times, int maxProposals) {
        if (times == null || times.isEmpty()) {
            throw new ValidationException("proposed_times must contain at least one instant");
        }
        if (times.size() > maxProposals) {
            throw new ValidationException("proposed_times may contain at most " + maxProposals + " instants");
        }
        Set<Instant> seen = new HashSet<>();
        for (Instant time : times) {
            if (time == null) {
                throw new ValidationException("proposed_times contains an empty entry");
            }
            if (!seen.add(time)) {
                throw new ValidationException("proposed_times contains " + time + " more than once");
            }
        }
        return new ProposedTimes(List.copyOf(times));
    }

    public List<Instant> asList() {
        return times;
    }
}
