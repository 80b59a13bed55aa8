package com.interviewportal.scheduler.controller;

import com.interviewportal.scheduler.repository.InterviewerAvailabilityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final InterviewerAvailabilityRepository availabilityRepository;

    @Value("${notifications.webhook-url:}")
    private String webhookUrl;

    @GetMapping({"", "/"})
    public Map<String, String> healthCheck() {
        return Map.of(
                "status", "healthy",
                "service", "Interview Portal API",
                "version", "1.0.0"
        );
    }

    @GetMapping("/ready")
    public Map<String, Object> readinessCheck() {
        String database;
        try {
            availabilityRepository.count();
            database = "up";
        } catch (DataAccessException e) {
            log.warn("Database readiness check failed: {}", e.getMessage());
            database = "down";
        }
        return Map.of(
                "status", "up".equals(database) ? "ready" : "degraded",
                "dependencies", Map.of(
                        "database", database,
                        "notifications", webhookUrl.isBlank() ? "log_only" : "webhook"
                )
        );
    }
}
