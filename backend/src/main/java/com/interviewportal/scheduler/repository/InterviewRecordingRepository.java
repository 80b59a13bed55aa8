package com.interviewportal.scheduler.repository;

import com.interviewportal.scheduler.model.InterviewRecording;
import com.interviewportal.scheduler.model.RecordingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InterviewRecordingRepository extends JpaRepository<InterviewRecording, UUID> {

    Optional<InterviewRecording> findFirstByInterviewIdAndStatusIn(UUID interviewId, Collection<RecordingStatus> statuses);

    List<InterviewRecording> findByInterviewIdOrderByStartedAtAsc(UUID interviewId);

    void deleteByInterviewIdIn(Collection<UUID> interviewIds);
}
