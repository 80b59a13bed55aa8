package com.interviewportal.scheduler.service;

import com.interviewportal.scheduler.model.Interview;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationService {

    private static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("MMMM dd, yyyy 'at' hh:mm a 'UTC'").withZone(ZoneOffset.UTC);

    private final ApplicationEventPublisher eventPublisher;

    public void interviewScheduled(Interview interview) {
        publish(interview.getInterviewerId(), NotificationType.INTERVIEW_SCHEDULED, "Interview Assigned",
                "You have been assigned " + describe(interview) + " on " + display(interview),
                interviewData(interview));
    }

    public void interviewCancelled(Interview interview) {
        String message = describe(interview) + " on " + display(interview) + " has been cancelled";
        publish(interview.getInterviewerId(), NotificationType.INTERVIEW_CANCELLED, "Interview Cancelled",
                message, interviewData(interview));
        publish(interview.getCandidateId(), NotificationType.INTERVIEW_CANCELLED, "Interview Cancelled",
                message + ". We will reach out to reschedule.", interviewData(interview));
    }

    public void interviewRescheduled(Interview previous, Interview replacement) {
        Map<String, Object> data = interviewData(replacement);
        data.put("previous_interview_id", previous.getId().toString());
        String message = describe(replacement) + " moved from " + display(previous) + " to " + display(replacement);
        publish(replacement.getInterviewerId(), NotificationType.INTERVIEW_RESCHEDULED, "Interview Rescheduled",
                message, data);
        publish(replacement.getCandidateId(), NotificationType.INTERVIEW_RESCHEDULED, "Interview Rescheduled",
                message, data);
    }

    public void rescheduleRequested(Interview interview, UUID requestId, UUID requestedBy) {
        Map<String, Object> data = interviewData(interview);
        data.put("request_id", requestId.toString());
        publish(interview.getInterviewerId(), NotificationType.RESCHEDULE_REQUESTED, "Reschedule Requested",
                "A new time was requested for " + describe(interview) + " on " + display(interview), data);
        if (interview.getCreatedBy() != null && !interview.getCreatedBy().equals(requestedBy)) {
            publish(interview.getCreatedBy(), NotificationType.RESCHEDULE_REQUESTED, "Reschedule Requested",
                    "A reschedule request awaits your decision for " + describe(interview), data);
        }
    }

    public void rescheduleRejected(Interview interview, UUID requestId, UUID requestedBy) {
        Map<String, Object> data = interviewData(interview);
        data.put("request_id", requestId.toString());
        publish(requestedBy, NotificationType.RESCHEDULE_REJECTED, "Reschedule Declined",
                describe(interview) + " stays on " + display(interview), data);
    }

    public void evaluationSubmitted(Interview interview, UUID evaluatorId) {
        if (interview.getCreatedBy() == null) {
            return;
        }
        Map<String, Object> data = interviewData(interview);
        data.put("evaluator_id", evaluatorId.toString());
        publish(interview.getCreatedBy(), NotificationType.EVALUATION_SUBMITTED, "Evaluation Submitted",
                "An evaluation was submitted for " + describe(interview), data);
    }

    private void publish(UUID userId, NotificationType type, String title, String message, Map<String, Object> data) {
        if (userId == null) {
            log.debug("Skipping {} notification without recipient", type.getValue());
            return;
        }
        eventPublisher.publishEvent(new NotificationEvent(userId, type, title, message, data));
    }

    private static String describe(Interview interview) {
        String subject = interview.getPosition() != null ? interview.getPosition() : interview.getTitle();
        return "the " + interview.getInterviewType().getValue() + " interview for " + subject;
    }

    private static String display(Interview interview) {
        return DISPLAY_FORMAT.format(interview.getScheduledAt());
    }

    private static Map<String, Object> interviewData(Interview interview) {
        Map<String, Object> data = new HashMap<>();
        data.put("interview_id", interview.getId().toString());
        data.put("room_id", interview.getRoomId());
        data.put("meeting_url", interview.getMeetingUrl());
        data.put("scheduled_at", interview.getScheduledAt().toString());
        return data;
    }
}
