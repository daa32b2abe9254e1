package io.b2mash.b2b.bidsubmission.notification.channel;

import io.b2mash.b2b.bidsubmission.notification.NotificationPriority;
import io.b2mash.b2b.bidsubmission.notification.SubmissionNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Writes every notification to the application log. Always enabled. */
@Component
public class LoggingNotificationChannel implements NotificationChannel {

  private static final Logger log = LoggerFactory.getLogger(LoggingNotificationChannel.class);

  @Override
  public String channelId() {
    return "log";
  }

  @Override
  public void deliver(SubmissionNotification notification) {
    if (notification.priority() == NotificationPriority.CRITICAL) {
      log.warn(
          "[{}] {}: {}",
          notification.priority(),
          notification.subject(),
          notification.message());
    } else {
      log.info(
          "[{}] {}: {}",
          notification.priority(),
          notification.subject(),
          notification.message());
    }
  }

  @Override
  public boolean isEnabled() {
    return true;
  }
}
