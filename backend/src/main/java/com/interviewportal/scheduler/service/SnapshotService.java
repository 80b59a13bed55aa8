package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.exception.NotFoundException;
import com.interviewportal.scheduler.exception.ValidationException;
import com.interviewportal.scheduler.model.CodeSnapshot;
import com.interviewportal.scheduler.model.Interview;
import com.interviewportal.scheduler.model.WhiteboardSnapshot;
import com.interviewportal.scheduler.repository.CodeSnapshotRepository;
import com.interviewportal.scheduler.repository.InterviewRepository;
import com.interviewportal.scheduler.repository.WhiteboardSnapshotRepository;
import com.interviewportal.scheduler.security.AccessPolicy;
import com.interviewportal.scheduler.security.Caller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class SnapshotService {

    private final CodeSnapshotRepository codeSnapshotRepository;
    private final WhiteboardSnapshotRepository whiteboardSnapshotRepository;
    private final InterviewRepository interviewRepository;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Transactional
    public CodeSnapshot saveCodeSnapshot(Caller caller, UUID interviewId, String language, String code) {
        Interview interview = load(interviewId);
        accessPolicy.requireParticipant(caller, interview, "save code snapshots");
        if (!interview.isCodeEditorEnabled()) {
            throw new ValidationException("Code editor is disabled for interview " + interviewId);
        }
        if (language == null || language.isBlank()) {
            throw new ValidationException("language is required");
        }
        if (code == null) {
            throw new ValidationException("code is required");
        }

        CodeSnapshot snapshot = new CodeSnapshot();
        snapshot.setInterviewId(interviewId);
        snapshot.setLanguage(language.trim().toLowerCase());
        snapshot.setCode(code);
        snapshot.setAuthorId(caller.getUserId());
        snapshot.setCreatedAt(clock.instant());

        CodeSnapshot saved = codeSnapshotRepository.save(snapshot);
        log.debug("Code snapshot {} saved for interview {} ({} chars)", saved.getId(), interviewId, code.length());
        return saved;
    }

    @Transactional
    public WhiteboardSnapshot saveWhiteboardSnapshot(Caller caller, UUID interviewId, Map<String, Object> data,
                                                     String imageUrl) {
        Interview interview = load(interviewId);
        accessPolicy.requireParticipant(caller, interview, "save whiteboard snapshots");
        if (!interview.isWhiteboardEnabled()) {
            throw new ValidationException("Whiteboard is disabled for interview " + interviewId);
        }
        if (data == null) {
            throw new ValidationException("data is required");
        }

        WhiteboardSnapshot snapshot = new WhiteboardSnapshot();
        snapshot.setInterviewId(interviewId);
        snapshot.setData(new HashMap<>(data));
        snapshot.setImageUrl(imageUrl == null || imageUrl.isBlank() ? null : imageUrl.trim());
        snapshot.setAuthorId(caller.getUserId());
        snapshot.setCreatedAt(clock.instant());

        WhiteboardSnapshot saved = whiteboardSnapshotRepository.save(snapshot);
        log.debug("Whiteboard snapshot {} saved for interview {}", saved.getId(), interviewId);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<CodeSnapshot> listCodeSnapshots(UUID interviewId) {
        load(interviewId);
        return codeSnapshotRepository.findByInterviewIdOrderByCreatedAtAsc(interviewId);
    }

    @Transactional(readOnly = true)
    public List<WhiteboardSnapshot> listWhiteboardSnapshots(UUID interviewId) {
        load(interviewId);
        return whiteboardSnapshotRepository.findByInterviewIdOrderByCreatedAtAsc(interviewId);
    }

    private Interview load(UUID interviewId) {
        return interviewRepository.findById(interviewId)
                .orElseThrow(() -> new NotFoundException("Interview", interviewId));
    }
}
