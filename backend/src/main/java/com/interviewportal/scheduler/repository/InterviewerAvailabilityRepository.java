package com.interviewportal.scheduler.repository;

import com.interviewportal.scheduler.model.InterviewerAvailability;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface InterviewerAvailabilityRepository extends JpaRepository<InterviewerAvailability, UUID> {

    Optional<InterviewerAvailability> findByInterviewerId(UUID interviewerId);

    /**
     * Row lock on the interviewer's calendar. Held until the surrounding transaction ends, it
     * serializes every booking for that interviewer.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from InterviewerAvailability a where a.interviewerId = :interviewerId")
    Optional<InterviewerAvailability> lockByInterviewerId(@Param("interviewerId") UUID interviewerId);
}
