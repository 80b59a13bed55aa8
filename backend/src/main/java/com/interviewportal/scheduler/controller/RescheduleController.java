package com.interviewportal.scheduler.controller;

import com.interviewportal.scheduler.dto.RescheduleOutcomeDto;
import com.interviewportal.scheduler.dto.RescheduleRequestCreateDto;
import com.interviewportal.scheduler.dto.RescheduleResolutionDto;
import com.interviewportal.scheduler.model.RescheduleRequest;
import com.interviewportal.scheduler.security.Caller;
import com.interviewportal.scheduler.service.RescheduleService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RescheduleController {

    private final RescheduleService rescheduleService;

    @PostMapping("/interviews/{interviewId}/reschedule-requests")
    @ResponseStatus(HttpStatus.CREATED)
    public RescheduleRequest requestReschedule(Caller caller,
                                               @PathVariable UUID interviewId,
                                               @RequestBody RescheduleRequestCreateDto dto) {
        return rescheduleService.requestReschedule(caller, interviewId, dto.getReason(), dto.getProposedTimes());
    }

    @GetMapping("/interviews/{interviewId}/reschedule-requests")
    public List<RescheduleRequest> listRescheduleRequests(@PathVariable UUID interviewId) {
        return rescheduleService.listRescheduleRequests(interviewId);
    }

    @GetMapping("/reschedule-requests/{requestId}")
    public RescheduleRequest getRescheduleRequest(@PathVariable UUID requestId) {
        return rescheduleService.getRescheduleRequest(requestId);
    }

    @PostMapping("/reschedule-requests/{requestId}/resolve")
    public RescheduleOutcomeDto resolveReschedule(Caller caller,
                                                  @PathVariable UUID requestId,
                                                  @RequestBody RescheduleResolutionDto dto) {
        return rescheduleService.resolveReschedule(caller, requestId, dto.getDecision(), dto.getChosenTime());
    }
}
