package io.b2mash.b2b.bidsubmission.notification.channel;

import io.b2mash.b2b.bidsubmission.notification.SubmissionNotification;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/** Posts notifications to a Slack incoming webhook. */
@Component
@ConditionalOnProperty(name = "submission.notifications.slack.webhook-url")
public class SlackNotificationChannel implements NotificationChannel {

  private static final Logger log = LoggerFactory.getLogger(SlackNotificationChannel.class);

  private final RestClient restClient;
  private final String webhookUrl;

  public SlackNotificationChannel(
      @Value("${submission.notifications.slack.webhook-url}") String webhookUrl) {
    this.restClient = RestClient.create();
    this.webhookUrl = webhookUrl;
  }

  @Override
  public String channelId() {
    return "slack";
  }

  @Override
  public void deliver(SubmissionNotification notification) {
    restClient
        .post()
        .uri(webhookUrl)
        .contentType(MediaType.APPLICATION_JSON)
        .body(slackMessage(notification))
        .retrieve()
        .toBodilessEntity();
    log.debug("Posted event={} to Slack", notification.eventType());
  }

  @Override
  public boolean isEnabled() {
    return webhookUrl != null && !webhookUrl.isBlank();
  }

  static Map<String, Object> slackMessage(SubmissionNotification notification) {
    var color =
        switch (notification.priority()) {
          case CRITICAL -> "danger";
          case HIGH -> "warning";
          case NORMAL, LOW -> "good";
        };
    return Map.of(
        "text",
        notification.subject(),
        "attachments",
        List.of(
            Map.of(
                "color", color,
                "title", notification.subject(),
                "text", notification.message(),
                "footer", "priority " + notification.priority())));
  }
}
