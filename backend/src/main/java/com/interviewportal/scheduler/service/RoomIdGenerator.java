package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.exception.ConflictException;
import com.interviewportal.scheduler.repository.InterviewRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.function.Supplier;

@Component
@Slf4j
public class RoomIdGenerator {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final InterviewRepository interviewRepository;
    private final int maxAttempts;
    private final Supplier<String> candidates;

    @Autowired
    public RoomIdGenerator(InterviewRepository interviewRepository,
                           @Value("${scheduling.room-id.max-attempts:5}") int maxAttempts) {
        this(interviewRepository, maxAttempts, RoomIdGenerator::randomRoomId);
    }

    RoomIdGenerator(InterviewRepository interviewRepository, int maxAttempts, Supplier<String> candidates) {
        this.interviewRepository = interviewRepository;
        this.maxAttempts = maxAttempts;
        this.candidates = candidates;
    }

    public String nextRoomId() {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String roomId = candidates.get();
            if (!interviewRepository.existsByRoomId(roomId)) {
                return roomId;
            }
            log.warn("Room id collision on attempt {}: {}", attempt, roomId);
        }
        throw new ConflictException("room_id_exhausted",
                "Could not allocate a unique room id after " + maxAttempts + " attempts");
    }

    static String randomRoomId() {
        byte[] bytes = new byte[6];
        RANDOM.nextBytes(bytes);
        return "room_" + HexFormat.of().formatHex(bytes);
    }
}
