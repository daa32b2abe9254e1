package io.b2mash.b2b.bidsubmission.notification.channel;

import io.b2mash.b2b.bidsubmission.notification.NotificationPriority;
import io.b2mash.b2b.bidsubmission.notification.SubmissionNotification;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * Emails notifications at or above a minimum priority to a fixed operator distribution list via
 * {@link JavaMailSender}. Only active when {@code spring.mail.host} is configured.
 */
@Component
@ConditionalOnProperty(name = "spring.mail.host")
public class EmailNotificationChannel implements NotificationChannel {

  private static final Logger log = LoggerFactory.getLogger(EmailNotificationChannel.class);

  private final JavaMailSender mailSender;
  private final String senderAddress;
  private final List<String> recipients;
  private final NotificationPriority minimumPriority;

  public EmailNotificationChannel(
      JavaMailSender mailSender,
      @Value("${submission.notifications.email.sender-address:noreply@bids.local}")
          String senderAddress,
      @Value("${submission.notifications.email.recipients:}") String recipients,
      @Value("${submission.notifications.email.minimum-priority:HIGH}")
          NotificationPriority minimumPriority) {
    this.mailSender = mailSender;
    this.senderAddress = senderAddress;
    this.recipients =
        Arrays.stream(recipients.split(","))
            .map(String::strip)
            .filter(address -> !address.isEmpty())
            .toList();
    this.minimumPriority = minimumPriority;
  }

  @Override
  public String channelId() {
    return "email";
  }

  @Override
  public void deliver(SubmissionNotification notification) {
    if (notification.priority().compareTo(minimumPriority) < 0) {
      log.debug(
          "Skipping email for event={} -- priority {} below {}",
          notification.eventType(),
          notification.priority(),
          minimumPriority);
      return;
    }
    try {
      MimeMessage mimeMessage = mailSender.createMimeMessage();
      MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, false, "UTF-8");
      helper.setFrom(senderAddress);
      helper.setTo(recipients.toArray(String[]::new));
      helper.setSubject("[" + notification.priority() + "] " + notification.subject());
      helper.setText(notification.message(), false);
      mailSender.send(mimeMessage);
      log.debug("Emailed event={} to {} recipient(s)", notification.eventType(), recipients.size());
    } catch (MailException | MessagingException e) {
      throw new IllegalStateException(
          "Failed to email notification for event " + notification.eventType(), e);
    }
  }

  @Override
  public boolean isEnabled() {
    return !recipients.isEmpty();
  }
}
