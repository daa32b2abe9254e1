package io.b2mash.b2b.bidsubmission.notification;

import io.b2mash.b2b.bidsubmission.notification.channel.NotificationChannel;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * {@link NotificationSink} that formats submission events and fans them out to every enabled
 * {@link NotificationChannel} on the notification executor. Channel failures are logged and
 * dropped.
 */
@Component
public class SubmissionNotificationDispatcher implements NotificationSink {

  private static final Logger log = LoggerFactory.getLogger(SubmissionNotificationDispatcher.class);

  private final Map<String, NotificationChannel> channels;
  private final Executor notificationExecutor;
  private final Clock clock;

  public SubmissionNotificationDispatcher(
      List<NotificationChannel> channelBeans,
      @Qualifier("notificationExecutor") Executor notificationExecutor,
      Clock clock) {
    this.channels = new LinkedHashMap<>();
    for (var channel : channelBeans) {
      if (channel.isEnabled()) {
        channels.put(channel.channelId(), channel);
      }
    }
    this.notificationExecutor = notificationExecutor;
    this.clock = clock;
  }

  @Override
  public void notify(String eventType, Map<String, Object> payload) {
    SubmissionNotification notification;
    try {
      notification = buildNotification(eventType, payload);
    } catch (RuntimeException e) {
      log.warn("Failed to build notification for event={}", eventType, e);
      return;
    }
    try {
      notificationExecutor.execute(
          () -> channels.keySet().forEach(channelId -> dispatch(channelId, notification)));
    } catch (RejectedExecutionException e) {
      log.warn(
          "Notification executor rejected event={} jobId={}",
          eventType,
          notification.payload().get("jobId"));
    }
  }

  private void dispatch(String channelId, SubmissionNotification notification) {
    var channel = channels.get(channelId);
    try {
      channel.deliver(notification);
    } catch (Exception e) {
      log.warn(
          "Failed to deliver notification via channel={} event={} jobId={}",
          channelId,
          notification.eventType(),
          notification.payload().get("jobId"),
          e);
    }
  }

  SubmissionNotification buildNotification(String eventType, Map<String, Object> payload) {
    var safePayload = payload != null ? payload : Map.<String, Object>of();
    var type = SubmissionEventType.fromEventType(eventType);
    String subject = type.map(SubmissionEventType::getSubject).orElse(eventType);
    NotificationPriority priority =
        type.map(SubmissionEventType::getPriority).orElse(NotificationPriority.NORMAL);
    String message = type.map(t -> formatMessage(t, safePayload)).orElse(eventType);
    return new SubmissionNotification(
        eventType, subject, message, priority, safePayload, clock.instant());
  }

  static String formatMessage(SubmissionEventType type, Map<String, Object> payload) {
    var rfpId = payload.get("rfpId");
    var portal = payload.get("portal");
    return switch (type) {
      case QUEUED -> "Bid for RFP " + rfpId + " queued for submission to " + portal;
      case SUBMISSION_SUCCESSFUL ->
          "Bid for RFP "
              + rfpId
              + " submitted successfully to "
              + portal
              + ". Confirmation: "
              + payload.get("confirmationNumber");
      case SUBMISSION_FAILED ->
          "Bid for RFP "
              + rfpId
              + " failed to submit to "
              + portal
              + ". Error: "
              + payload.get("error");
      case DEADLINE_WARNING ->
          "RFP "
              + rfpId
              + " is due in "
              + payload.get("hoursRemaining")
              + " hour(s) and has not been submitted";
    };
  }
}
