package com.interviewportal.scheduler.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Delivers committed notifications to the external delivery service. Fire-and-forget:
 * failures are logged and never reach the operation that produced the event.
 */
@Component
@Slf4j
public class NotificationDispatcher {

    private final WebClient notificationWebClient;
    private final String webhookUrl;
    private final Duration timeout;

    public NotificationDispatcher(WebClient notificationWebClient,
                                  @Value("${notifications.webhook-url:}") String webhookUrl,
                                  @Value("${notifications.timeout-seconds:10}") long timeoutSeconds) {
        this.notificationWebClient = notificationWebClient;
        this.webhookUrl = webhookUrl;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onNotification(NotificationEvent event) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.info("Notification {} for user {}: {}", event.getType().getValue(), event.getUserId(), event.getTitle());
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user_id", event.getUserId().toString());
        payload.put("type", event.getType().getValue());
        payload.put("title", event.getTitle());
        payload.put("message", event.getMessage());
        payload.put("data", event.getData());

        notificationWebClient.post()
                .uri(webhookUrl)
                .bodyValue(payload)
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .subscribe(
                        response -> log.debug("Delivered {} notification to user {}", event.getType().getValue(), event.getUserId()),
                        error -> log.warn("Notification delivery failed for user {}: {}", event.getUserId(), error.getMessage()));
    }
}
