package com.interviewportal.scheduler.repository;

import com.interviewportal.scheduler.model.CodeSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface CodeSnapshotRepository extends JpaRepository<CodeSnapshot, UUID> {

    List<CodeSnapshot> findByInterviewIdOrderByCreatedAtAsc(UUID interviewId);

    void deleteByInterviewIdIn(Collection<UUID> interviewIds);
}
