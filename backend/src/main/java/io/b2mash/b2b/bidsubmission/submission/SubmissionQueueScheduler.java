package io.b2mash.b2b.bidsubmission.submission;

import io.b2mash.b2b.bidsubmission.audit.AuditLogWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Drives {@link SubmissionOrchestrator#processQueue()} on a fixed delay. */
@Component
@ConditionalOnProperty(
    name = "submission.queue.scheduler-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SubmissionQueueScheduler {

  private static final Logger log = LoggerFactory.getLogger(SubmissionQueueScheduler.class);

  private final SubmissionOrchestrator orchestrator;

  public SubmissionQueueScheduler(SubmissionOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @Scheduled(
      fixedDelayString = "${submission.queue.poll-interval-ms:5000}",
      initialDelayString = "${submission.queue.initial-delay-ms:5000}")
  public void processQueue() {
    try {
      var tick = orchestrator.processQueue();
      if (!tick.admittedJobIds().isEmpty()) {
        log.info("Queue tick admitted {} submission(s)", tick.admittedJobIds().size());
      }
    } catch (AuditLogWriteException | SubmissionStoreException e) {
      log.error("Submission queue halted: {}", e.getBody().getDetail());
    } catch (RuntimeException e) {
      log.error("Submission queue tick failed", e);
    }
  }
}
