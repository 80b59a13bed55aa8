package com.interviewportal.scheduler.controller;

import com.interviewportal.scheduler.dto.BulkScheduleRequestDto;
import com.interviewportal.scheduler.dto.BulkScheduleResultDto;
import com.interviewportal.scheduler.dto.CancelRequestDto;
import com.interviewportal.scheduler.dto.DtoMapper;
import com.interviewportal.scheduler.dto.InterviewResponseDto;
import com.interviewportal.scheduler.dto.InterviewUpdateDto;
import com.interviewportal.scheduler.dto.JoinRequestDto;
import com.interviewportal.scheduler.dto.ScheduleInterviewRequestDto;
import com.interviewportal.scheduler.exception.ValidationException;
import com.interviewportal.scheduler.model.Party;
import com.interviewportal.scheduler.security.Caller;
import com.interviewportal.scheduler.service.BulkSchedulingService;
import com.interviewportal.scheduler.service.InterviewLifecycleService;
import com.interviewportal.scheduler.service.SchedulingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/interviews")
@RequiredArgsConstructor
@Slf4j
public class InterviewController {

    private final SchedulingService schedulingService;
    private final InterviewLifecycleService lifecycleService;
    private final BulkSchedulingService bulkSchedulingService;

    // ─── Booking ────────────────────────────────────────────────────────

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public InterviewResponseDto scheduleInterview(Caller caller, @RequestBody ScheduleInterviewRequestDto dto) {
        log.info("Schedule request for interviewer {} at {}", dto.getInterviewerId(), dto.getScheduledAt());
        return DtoMapper.toDto(schedulingService.scheduleInterview(caller, dto));
    }

    @PostMapping("/bulk")
    public BulkScheduleResultDto scheduleBulk(Caller caller, @RequestBody BulkScheduleRequestDto dto) {
        log.info("Bulk schedule request for {} candidates", dto.getCandidates() == null ? 0 : dto.getCandidates().size());
        return bulkSchedulingService.scheduleBulk(caller, dto);
    }

    @PatchMapping("/{interviewId}")
    public InterviewResponseDto updateInterview(Caller caller,
                                                @PathVariable UUID interviewId,
                                                @RequestBody InterviewUpdateDto dto) {
        return DtoMapper.toDto(lifecycleService.updateDetails(caller, interviewId, dto));
    }

    // ─── Queries ────────────────────────────────────────────────────────

    @GetMapping("/{interviewId}")
    public InterviewResponseDto getInterview(@PathVariable UUID interviewId) {
        return DtoMapper.toDto(lifecycleService.getInterview(interviewId));
    }

    @GetMapping("/by-room/{roomId}")
    public InterviewResponseDto getInterviewByRoom(@PathVariable String roomId) {
        return DtoMapper.toDto(lifecycleService.getInterviewByRoom(roomId));
    }

    @GetMapping
    public List<InterviewResponseDto> listInterviews(@RequestParam(name = "interviewer_id", required = false) UUID interviewerId,
                                                     @RequestParam(name = "candidate_id", required = false) UUID candidateId,
                                                     @RequestParam(required = false) Instant from,
                                                     @RequestParam(required = false) Instant to) {
        if (interviewerId != null) {
            return DtoMapper.toInterviewDtos(lifecycleService.listByInterviewer(interviewerId, from, to));
        }
        if (candidateId != null) {
            return DtoMapper.toInterviewDtos(lifecycleService.listByCandidate(candidateId));
        }
        throw new ValidationException("interviewer_id or candidate_id is required");
    }

    // ─── Lifecycle ──────────────────────────────────────────────────────

    @PostMapping("/{interviewId}/join")
    public InterviewResponseDto join(Caller caller, @PathVariable UUID interviewId, @RequestBody JoinRequestDto dto) {
        return DtoMapper.toDto(lifecycleService.recordJoin(caller, interviewId, Party.fromValue(dto.getParty())));
    }

    @PostMapping("/{interviewId}/complete")
    public InterviewResponseDto complete(Caller caller,
                                         @PathVariable UUID interviewId,
                                         @RequestParam(name = "allow_from_scheduled", defaultValue = "false") boolean allowFromScheduled) {
        return DtoMapper.toDto(lifecycleService.complete(caller, interviewId, allowFromScheduled));
    }

    @PostMapping("/{interviewId}/cancel")
    public InterviewResponseDto cancel(Caller caller,
                                       @PathVariable UUID interviewId,
                                       @RequestBody(required = false) CancelRequestDto dto) {
        return DtoMapper.toDto(lifecycleService.cancel(caller, interviewId, dto == null ? null : dto.getReason()));
    }

    @PostMapping("/{interviewId}/no-show")
    public InterviewResponseDto markNoShow(Caller caller, @PathVariable UUID interviewId) {
        return DtoMapper.toDto(lifecycleService.markNoShow(caller, interviewId));
    }

    @DeleteMapping("/{interviewId}")
    public Map<String, Object> deleteInterview(Caller caller, @PathVariable UUID interviewId) {
        lifecycleService.deleteInterview(caller, interviewId);
        Map<String, Object> result = new HashMap<>();
        result.put("message", "Interview deleted");
        result.put("interview_id", interviewId);
        return result;
    }
}
