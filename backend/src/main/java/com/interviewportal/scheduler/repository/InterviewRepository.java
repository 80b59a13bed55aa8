package com.interviewportal.scheduler.repository;

import com.interviewportal.scheduler.model.Interview;
import com.interviewportal.scheduler.model.InterviewStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InterviewRepository extends JpaRepository<Interview, UUID> {

    Optional<Interview> findByRoomId(String roomId);

    boolean existsByRoomId(String roomId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select i from Interview i where i.id = :id")
    Optional<Interview> lockById(@Param("id") UUID id);

    /**
     * Bookings of an interviewer whose scheduled start falls in {@code [from, to)}. Callers widen
     * the range by the longest allowed duration to catch sessions that start earlier and run in.
     */
    @Query("select i from Interview i where i.interviewerId = :interviewerId and i.status in :statuses "
            + "and i.scheduledAt >= :from and i.scheduledAt < :to order by i.scheduledAt")
    List<Interview> findBookings(@Param("interviewerId") UUID interviewerId,
                                 @Param("statuses") Collection<InterviewStatus> statuses,
                                 @Param("from") Instant from,
                                 @Param("to") Instant to);

    List<Interview> findByInterviewerIdOrderByScheduledAtAsc(UUID interviewerId);

    List<Interview> findByInterviewerIdAndScheduledAtBetweenOrderByScheduledAtAsc(UUID interviewerId,
                                                                                 Instant from, Instant to);

    List<Interview> findByCandidateIdOrderByScheduledAtAsc(UUID candidateId);

    List<Interview> findByStatusAndScheduledAtBefore(InterviewStatus status, Instant cutoff);
}
