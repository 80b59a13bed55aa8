package com.interviewportal.scheduler.repository;

import com.interviewportal.scheduler.model.RescheduleRequest;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RescheduleRequestRepository extends JpaRepository<RescheduleRequest, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from RescheduleRequest r where r.id = :id")
    Optional<RescheduleRequest> lockById(@Param("id") UUID id);

    List<RescheduleRequest> findByInterviewIdOrderByCreatedAtAsc(UUID interviewId);

    void deleteByInterviewIdIn(Collection<UUID> interviewIds);
}
