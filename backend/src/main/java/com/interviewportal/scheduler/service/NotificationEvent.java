package com.interviewportal.scheduler.service;

import lombok.Value;

import java.util.Map;
import java.util.UUID;

@Value
public class NotificationEvent {
    UUID userId;
    NotificationType type;
    String title;
    String message;
    Map<String, Object> data;
}
