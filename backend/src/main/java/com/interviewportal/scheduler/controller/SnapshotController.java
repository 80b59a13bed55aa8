package com.interviewportal.scheduler.controller;

import com.interviewportal.scheduler.dto.CodeSnapshotCreateDto;
import com.interviewportal.scheduler.dto.WhiteboardSnapshotCreateDto;
import com.interviewportal.scheduler.model.CodeSnapshot;
import com.interviewportal.scheduler.model.WhiteboardSnapshot;
import com.interviewportal.scheduler.security.Caller;
import com.interviewportal.scheduler.service.SnapshotService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/interviews/{interviewId}")
@RequiredArgsConstructor
public class SnapshotController {

    private final SnapshotService snapshotService;

    @PostMapping("/code-snapshots")
    @ResponseStatus(HttpStatus.CREATED)
    public CodeSnapshot saveCodeSnapshot(Caller caller,
                                         @PathVariable UUID interviewId,
                                         @RequestBody CodeSnapshotCreateDto dto) {
        return snapshotService.saveCodeSnapshot(caller, interviewId, dto.getLanguage(), dto.getCode());
    }

    @GetMapping("/code-snapshots")
    public List<CodeSnapshot> listCodeSnapshots(@PathVariable UUID interviewId) {
        return snapshotService.listCodeSnapshots(interviewId);
    }

    @PostMapping("/whiteboard-snapshots")
    @ResponseStatus(HttpStatus.CREATED)
    public WhiteboardSnapshot saveWhiteboardSnapshot(Caller caller,
                                                     @PathVariable UUID interviewId,
                                                     @RequestBody WhiteboardSnapshotCreateDto dto) {
        return snapshotService.saveWhiteboardSnapshot(caller, interviewId, dto.getData(), dto.getImageUrl());
    }

    @GetMapping("/whiteboard-snapshots")
    public List<WhiteboardSnapshot> listWhiteboardSnapshots(@PathVariable UUID interviewId) {
        return snapshotService.listWhiteboardSnapshots(interviewId);
    }
}
