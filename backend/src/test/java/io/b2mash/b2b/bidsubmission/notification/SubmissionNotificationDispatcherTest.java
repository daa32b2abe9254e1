package io.b2mash.b2b.bidsubmission.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import io.b2mash.b2b.bidsubmission.notification.channel.NotificationChannel;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SubmissionNotificationDispatcherTest {

  private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

  private NotificationChannel logChannel;
  private NotificationChannel slackChannel;
  private SubmissionNotificationDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    logChannel = mock(NotificationChannel.class);
    when(logChannel.channelId()).thenReturn("log");
    when(logChannel.isEnabled()).thenReturn(true);

    slackChannel = mock(NotificationChannel.class);
    when(slackChannel.channelId()).thenReturn("slack");
    when(slackChannel.isEnabled()).thenReturn(true);

    dispatcher =
        new SubmissionNotificationDispatcher(
            List.of(logChannel, slackChannel), Runnable::run, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void deliversFormattedNotificationToEveryEnabledChannel() {
    dispatcher.notify(
        "submission_successful",
        Map.of(
            "jobId", "job-1",
            "rfpId", "rfp-1",
            "portal", "sam-gov",
            "confirmationNumber", "SAM-42"));

    var captor = ArgumentCaptor.forClass(SubmissionNotification.class);
    verify(logChannel).deliver(captor.capture());
    verify(slackChannel).deliver(any());
    var notification = captor.getValue();
    assertThat(notification.subject()).isEqualTo("Submission Successful");
    assertThat(notification.priority()).isEqualTo(NotificationPriority.HIGH);
    assertThat(notification.message())
        .isEqualTo("Bid for RFP rfp-1 submitted successfully to sam-gov. Confirmation: SAM-42");
    assertThat(notification.createdAt()).isEqualTo(NOW);
  }

  @Test
  void skipsDisabledChannels() {
    var disabled = mock(NotificationChannel.class);
    when(disabled.channelId()).thenReturn("email");
    when(disabled.isEnabled()).thenReturn(false);
    var withDisabled =
        new SubmissionNotificationDispatcher(
            List.of(logChannel, disabled), Runnable::run, Clock.systemUTC());

    withDisabled.notify("queued", Map.of("jobId", "job-1", "rfpId", "rfp-1", "portal", "mock"));

    verify(logChannel).deliver(any());
    verify(disabled, never()).deliver(any());
  }

  @Test
  void failingChannelDoesNotStopOtherChannels() {
    doThrow(new IllegalStateException("webhook 500")).when(logChannel).deliver(any());

    dispatcher.notify(
        "submission_failed",
        Map.of("jobId", "job-1", "rfpId", "rfp-1", "portal", "mock", "error", "400"));

    verify(slackChannel).deliver(any());
  }

  @Test
  void rejectedExecutionIsSwallowed() {
    Executor rejecting =
        task -> {
          throw new RejectedExecutionException("shutting down");
        };
    var shuttingDown =
        new SubmissionNotificationDispatcher(List.of(logChannel), rejecting, Clock.systemUTC());

    assertThatCode(() -> shuttingDown.notify("queued", Map.of("jobId", "job-1")))
        .doesNotThrowAnyException();
    verify(logChannel, never()).deliver(any());
  }

  @Test
  void unknownEventTypeUsesNormalPriorityAndRawType() {
    var notification = dispatcher.buildNotification("portal_maintenance", null);

    assertThat(notification.priority()).isEqualTo(NotificationPriority.NORMAL);
    assertThat(notification.subject()).isEqualTo("portal_maintenance");
    assertThat(notification.message()).isEqualTo("portal_maintenance");
    assertThat(notification.payload()).isEmpty();
  }

  @Test
  void formatMessage_coversEveryEventType() {
    Map<String, Object> payload =
        Map.of(
            "rfpId", "rfp-9",
            "portal", "gsa-ebuy",
            "error", "422 missing SF1449",
            "hoursRemaining", 5L);

    assertThat(SubmissionNotificationDispatcher.formatMessage(SubmissionEventType.QUEUED, payload))
        .isEqualTo("Bid for RFP rfp-9 queued for submission to gsa-ebuy");
    assertThat(
            SubmissionNotificationDispatcher.formatMessage(
                SubmissionEventType.SUBMISSION_FAILED, payload))
        .isEqualTo("Bid for RFP rfp-9 failed to submit to gsa-ebuy. Error: 422 missing SF1449");
    assertThat(
            SubmissionNotificationDispatcher.formatMessage(
                SubmissionEventType.DEADLINE_WARNING, payload))
        .isEqualTo("RFP rfp-9 is due in 5 hour(s) and has not been submitted");
  }
}
