package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.exception.InterviewPortalException;
import com.interviewportal.scheduler.model.Interview;
import com.interviewportal.scheduler.model.InterviewStatus;
import com.interviewportal.scheduler.repository.InterviewRepository;
import com.interviewportal.scheduler.security.Caller;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Component
@Slf4j
@ConditionalOnProperty(name = "no-show.sweep.enabled", havingValue = "true")
public class NoShowSweeper {

    private final InterviewRepository interviewRepository;
    private final InterviewLifecycleService lifecycleService;
    private final Clock clock;
    private final Duration grace;

    public NoShowSweeper(InterviewRepository interviewRepository,
                         InterviewLifecycleService lifecycleService,
                         Clock clock,
                         @Value("${no-show.sweep.grace-minutes:15}") long graceMinutes) {
        this.interviewRepository = interviewRepository;
        this.lifecycleService = lifecycleService;
        this.clock = clock;
        this.grace = Duration.ofMinutes(graceMinutes);
    }

    @Scheduled(fixedDelayString = "${no-show.sweep.interval-ms:60000}")
    public void run() {
        sweep();
    }

    public int sweep() {
        Instant cutoff = clock.instant().minus(grace);
        List<Interview> overdue = interviewRepository.findByStatusAndScheduledAtBefore(InterviewStatus.SCHEDULED, cutoff);
        int marked = 0;
        for (Interview interview : overdue) {
            if (interview.hasAnyJoin()) {
                continue;
            }
            try {
                lifecycleService.markNoShow(Caller.SYSTEM, interview.getId());
                marked++;
            } catch (InterviewPortalException | ObjectOptimisticLockingFailureException e) {
                log.warn("Could not mark interview {} as no-show: {}", interview.getId(), e.getMessage());
            }
        }
        if (marked > 0) {
            log.info("No-show sweep marked {} interview(s)", marked);
        }
        return marked;
    }
}
