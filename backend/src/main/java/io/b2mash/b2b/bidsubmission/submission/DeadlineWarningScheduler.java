package io.b2mash.b2b.bidsubmission.submission;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.b2mash.b2b.bidsubmission.notification.NotificationSink;
import io.b2mash.b2b.bidsubmission.notification.SubmissionEventType;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically warns operators about queued submissions whose RFP deadline is near. Each job is
 * warned about at most once per warning window.
 */
@Component
public class DeadlineWarningScheduler {

  private static final Logger log = LoggerFactory.getLogger(DeadlineWarningScheduler.class);

  private final SubmissionOrchestrator orchestrator;
  private final NotificationSink notificationSink;
  private final Clock clock;
  private final Duration warningWindow;

  // jobId -> marker; present while a warning for that job is still current
  private final Cache<String, Boolean> warnedJobs;

  @Autowired
  public DeadlineWarningScheduler(
      SubmissionOrchestrator orchestrator,
      NotificationSink notificationSink,
      SubmissionProperties properties,
      Clock clock) {
    this(orchestrator, notificationSink, properties, clock, Ticker.systemTicker());
  }

  DeadlineWarningScheduler(
      SubmissionOrchestrator orchestrator,
      NotificationSink notificationSink,
      SubmissionProperties properties,
      Clock clock,
      Ticker ticker) {
    this.orchestrator = orchestrator;
    this.notificationSink = notificationSink;
    this.clock = clock;
    this.warningWindow = properties.deadlineWarningWindow();
    this.warnedJobs =
        Caffeine.newBuilder()
            .expireAfterWrite(warningWindow)
            .maximumSize(10_000)
            .ticker(ticker)
            .build();
  }

  @Scheduled(
      fixedDelayString = "${submission.deadline-warning.check-interval-ms:900000}",
      initialDelayString = "${submission.deadline-warning.initial-delay-ms:60000}")
  public void checkDeadlines() {
    var approaching = orchestrator.findDeadlineWarnings(warningWindow);
    int warned = 0;
    for (var job : approaching) {
      if (warnedJobs.asMap().putIfAbsent(job.jobId(), Boolean.TRUE) != null) {
        continue;
      }
      try {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("jobId", job.jobId());
        payload.put("rfpId", job.rfpId());
        payload.put("portal", job.portal());
        payload.put("deadline", job.deadline().toString());
        payload.put("hoursRemaining", Duration.between(clock.instant(), job.deadline()).toHours());
        notificationSink.notify(SubmissionEventType.DEADLINE_WARNING.getEventType(), payload);
        warned++;
      } catch (Exception e) {
        warnedJobs.invalidate(job.jobId());
        log.error("Failed to send deadline warning for submission {}", job.jobId(), e);
      }
    }
    if (warned > 0) {
      log.info("Deadline warning check sent {} warning(s)", warned);
    }
  }
}
