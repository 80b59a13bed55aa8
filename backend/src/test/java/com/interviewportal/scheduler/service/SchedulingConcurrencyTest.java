package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.IntegrationTestSupport;
import com.interviewportal.scheduler.exception.ConflictException;
import com.interviewportal.scheduler.model.InterviewStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.IntFunction;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulingConcurrencyTest extends IntegrationTestSupport {

    private static final int THREADS = 6;

    @Test
    void overlappingBookingsRaceToExactlyOneWinner() throws Exception {
        UUID interviewerId = interviewerWithStandardWeek();
        List<Object> outcomes = race(THREADS, i -> MONDAY_10.plus(Duration.ofMinutes(5L * i)), interviewerId);

        long booked = outcomes.stream().filter(o -> o instanceof UUID).count();
        long conflicts = outcomes.stream().filter(o -> o instanceof ConflictException).count();
        assertThat(booked).isEqualTo(1);
        assertThat(conflicts).isEqualTo(THREADS - 1);
        assertThat(interviewRepository.findByInterviewerIdOrderByScheduledAtAsc(interviewerId))
                .hasSize(1)
                .allMatch(i -> i.getStatus() == InterviewStatus.SCHEDULED);
    }

    @Test
    void disjointBookingsAllSucceed() throws Exception {
        UUID interviewerId = interviewerWithStandardWeek();
        // 09:00, 10:30, 12:00, 13:30, 15:00: 60 minutes each leaves 30 minutes between them
        List<Object> outcomes = race(5, i -> Instant.parse("2030-01-07T09:00:00Z").plus(Duration.ofMinutes(90L * i)),
                interviewerId);

        assertThat(outcomes).allMatch(o -> o instanceof UUID);
        assertThat(interviewRepository.findByInterviewerIdOrderByScheduledAtAsc(interviewerId)).hasSize(5);
    }

    private List<Object> race(int threads, IntFunction<Instant> startFor, UUID interviewerId)
            throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Object>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                Instant start = startFor.apply(i);
                Callable<Object> attempt = () -> {
                    ready.countDown();
                    go.await();
                    return schedule(interviewerId, start, 60).getId();
                };
                futures.add(executor.submit(attempt));
            }
            ready.await(10, TimeUnit.SECONDS);
            go.countDown();

            List<Object> outcomes = new ArrayList<>();
            for (Future<Object> future : futures) {
                try {
                    outcomes.add(future.get(30, TimeUnit.SECONDS));
                } catch (ExecutionException e) {
                    outcomes.add(e.getCause());
                } catch (TimeoutException e) {
                    outcomes.add(e);
                }
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }
}
