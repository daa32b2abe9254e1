package io.b2mash.b2b.bidsubmission.audit;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Database-backed implementation of {@link SubmissionAuditLog}. Each append runs in its own
 * transaction and is flushed before returning, so an entry is durable before the state change it
 * describes becomes visible.
 *
 * <p>Both data access and transaction failures (for example no connection to begin the
 * transaction with) surface as {@link AuditLogWriteException}.
 */
@Service
public class DatabaseSubmissionAuditLog implements SubmissionAuditLog {

  private static final Logger log = LoggerFactory.getLogger(DatabaseSubmissionAuditLog.class);

  private final SubmissionAuditEventRepository repository;
  private final TransactionTemplate transactionTemplate;

  public DatabaseSubmissionAuditLog(
      SubmissionAuditEventRepository repository, PlatformTransactionManager transactionManager) {
    this.repository = repository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  @Override
  public void append(AuditLogEntry entry) {
    try {
      transactionTemplate.executeWithoutResult(
          status -> repository.saveAndFlush(new SubmissionAuditEvent(entry)));
    } catch (DataAccessException | TransactionException e) {
      throw new AuditLogWriteException(
          "Failed to record "
              + entry.eventType()
              + " (sequence "
              + entry.sequence()
              + ") for submission "
              + entry.jobId(),
          e);
    }
    log.debug(
        "Recorded audit entry: job={}, seq={}, type={}, success={}",
        entry.jobId(),
        entry.sequence(),
        entry.eventType(),
        entry.success());
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditLogEntry> findByJobId(String jobId) {
    return repository.findByJobIdOrderBySequenceAsc(jobId).stream()
        .map(SubmissionAuditEvent::toEntry)
        .toList();
  }
}
