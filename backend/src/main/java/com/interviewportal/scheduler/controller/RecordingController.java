package com.interviewportal.scheduler.controller;

import com.interviewportal.scheduler.dto.RecordingFailureDto;
import com.interviewportal.scheduler.dto.RecordingFinishDto;
import com.interviewportal.scheduler.model.InterviewRecording;
import com.interviewportal.scheduler.security.Caller;
import com.interviewportal.scheduler.service.RecordingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RecordingController {

    private final RecordingService recordingService;

    @PostMapping("/interviews/{interviewId}/recordings")
    @ResponseStatus(HttpStatus.CREATED)
    public InterviewRecording startRecording(Caller caller, @PathVariable UUID interviewId) {
        return recordingService.startRecording(caller, interviewId);
    }

    @GetMapping("/interviews/{interviewId}/recordings")
    public List<InterviewRecording> listRecordings(@PathVariable UUID interviewId) {
        return recordingService.listRecordings(interviewId);
    }

    @PostMapping("/recordings/{recordingId}/stop")
    public InterviewRecording stopRecording(Caller caller, @PathVariable UUID recordingId) {
        return recordingService.stopRecording(caller, recordingId);
    }

    @PostMapping("/recordings/{recordingId}/finish")
    public InterviewRecording finishProcessing(Caller caller,
                                               @PathVariable UUID recordingId,
                                               @RequestBody RecordingFinishDto dto) {
        return recordingService.finishProcessing(caller, recordingId, dto);
    }

    @PostMapping("/recordings/{recordingId}/fail")
    public InterviewRecording markFailed(Caller caller,
                                         @PathVariable UUID recordingId,
                                         @RequestBody(required = false) RecordingFailureDto dto) {
        return recordingService.markFailed(caller, recordingId, dto == null ? null : dto.getReason());
    }
}
