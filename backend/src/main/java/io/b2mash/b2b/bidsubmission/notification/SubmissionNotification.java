package io.b2mash.b2b.bidsubmission.notification;

import java.time.Instant;
import java.util.Map;

public record SubmissionNotification(
    String eventType,
    String subject,
    String message,
    NotificationPriority priority,
    Map<String, Object> payload,
    Instant createdAt) {}
