package com.interviewportal.scheduler.repository;

import com.interviewportal.scheduler.model.WhiteboardSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface WhiteboardSnapshotRepository extends JpaRepository<WhiteboardSnapshot, UUID> {

    List<WhiteboardSnapshot> findByInterviewIdOrderByCreatedAtAsc(UUID interviewId);

    void deleteByInterviewIdIn(Collection<UUID> interviewIds);
}
