package com.interviewportal.scheduler.controller;

import com.interviewportal.scheduler.security.Caller;
import com.interviewportal.scheduler.service.InterviewLifecycleService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/candidates")
@RequiredArgsConstructor
public class CandidateController {

    private final InterviewLifecycleService lifecycleService;

    @DeleteMapping("/{candidateId}/interviews")
    public Map<String, Object> purgeCandidate(Caller caller, @PathVariable UUID candidateId) {
        int removed = lifecycleService.purgeCandidate(caller, candidateId);
        Map<String, Object> result = new HashMap<>();
        result.put("candidate_id", candidateId);
        result.put("interviews_removed", removed);
        return result;
    }
}
