package io.b2mash.b2b.bidsubmission.notification;

import java.util.Arrays;
import java.util.Optional;

/** Notification event types emitted by the submission orchestrator. */
public enum SubmissionEventType {
  QUEUED("queued", "Submission Queued", NotificationPriority.LOW),
  SUBMISSION_SUCCESSFUL(
      "submission_successful", "Submission Successful", NotificationPriority.HIGH),
  SUBMISSION_FAILED("submission_failed", "Submission Failed", NotificationPriority.CRITICAL),
  DEADLINE_WARNING("deadline_warning", "Deadline Approaching", NotificationPriority.HIGH);

  private final String eventType;
  private final String subject;
  private final NotificationPriority priority;

  SubmissionEventType(String eventType, String subject, NotificationPriority priority) {
    this.eventType = eventType;
    this.subject = subject;
    this.priority = priority;
  }

  public String getEventType() {
    return eventType;
  }

  public String getSubject() {
    return subject;
  }

  public NotificationPriority getPriority() {
    return priority;
  }

  public static Optional<SubmissionEventType> fromEventType(String eventType) {
    return Arrays.stream(values()).filter(t -> t.eventType.equals(eventType)).findFirst();
  }
}
