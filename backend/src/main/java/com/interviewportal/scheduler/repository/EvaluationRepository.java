package com.interviewportal.scheduler.repository;

import com.interviewportal.scheduler.model.Evaluation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EvaluationRepository extends JpaRepository<Evaluation, UUID> {

    Optional<Evaluation> findByInterviewIdAndEvaluatorId(UUID interviewId, UUID evaluatorId);

    List<Evaluation> findByInterviewIdOrderBySubmittedAtAsc(UUID interviewId);

    void deleteByInterviewIdIn(Collection<UUID> interviewIds);
}
