package com.interviewportal.scheduler.security;

import com.interviewportal.scheduler.exception.AccessDeniedException;
import com.interviewportal.scheduler.model.Interview;
import com.interviewportal.scheduler.model.Party;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Who may act on what. Every mutating service call checks here before touching state.
 *
 * <p>A candidate caller's user id is the candidate record id, so candidate-side actions are
 * scoped to interviews booked for that candidate.
 */
@Component
public class AccessPolicy {

    public void requireAdmin(Caller caller, String action) {
        if (!caller.isAdmin()) {
            throw new AccessDeniedException("Only admins may " + action);
        }
    }

    public void requireAdminOrSelf(Caller caller, UUID interviewerId, String action) {
        if (!caller.isAdmin() && !(caller.getRole() == Role.INTERVIEWER && caller.is(interviewerId))) {
            throw new AccessDeniedException("Only admins or the interviewer themselves may " + action);
        }
    }

    /** Admin or the interviewer assigned to this interview. */
    public void requireConductor(Caller caller, Interview interview, String action) {
        if (!caller.isAdmin() && !(caller.getRole() == Role.INTERVIEWER && caller.is(interview.getInterviewerId()))) {
            throw new AccessDeniedException("Only admins or the assigned interviewer may " + action);
        }
    }

    /** Anyone taking part: admin, assigned interviewer, or the booked candidate. */
    public void requireParticipant(Caller caller, Interview interview, String action) {
        if (caller.getRole() == Role.CANDIDATE) {
            requireBookedCandidate(caller, interview, action);
            return;
        }
        requireConductor(caller, interview, action);
    }

    public void requireJoinAs(Caller caller, Interview interview, Party party) {
        if (party == Party.INTERVIEWER) {
            requireConductor(caller, interview, "join as interviewer");
        } else if (caller.getRole() == Role.CANDIDATE) {
            requireBookedCandidate(caller, interview, "join as candidate");
        } else if (!caller.isAdmin()) {
            throw new AccessDeniedException("Only candidates may join as candidate");
        }
    }

    private static void requireBookedCandidate(Caller caller, Interview interview, String action) {
        if (!caller.is(interview.getCandidateId())) {
            throw new AccessDeniedException("Only the candidate booked for this interview may " + action);
        }
    }

    public void requireEvaluator(Caller caller) {
        if (caller.getRole() == Role.CANDIDATE) {
            throw new AccessDeniedException("Candidates may not submit evaluations");
        }
    }
}
