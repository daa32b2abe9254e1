package io.b2mash.b2b.bidsubmission.submission;

import java.util.List;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/** Keeps {@code submission_jobs} in step with the orchestrator's job table. */
@Component
class DatabaseSubmissionJobStore implements SubmissionJobStore {

  private final SubmissionJobRecordRepository repository;
  private final TransactionTemplate transactionTemplate;

  DatabaseSubmissionJobStore(
      SubmissionJobRecordRepository repository, PlatformTransactionManager transactionManager) {
    this.repository = repository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  @Override
  public void save(SubmissionJob job) {
    try {
      transactionTemplate.executeWithoutResult(
          status -> {
            var existing = repository.findById(job.getId());
            if (existing.isPresent()) {
              existing.get().update(job);
              repository.save(existing.get());
            } else {
              repository.save(new SubmissionJobRecord(job));
            }
          });
    } catch (DataAccessException | TransactionException e) {
      throw new SubmissionStoreException(
          "Failed to persist submission " + job.getId() + " in state " + job.getStatus(), e);
    }
  }

  @Override
  public List<SubmissionJob> loadAll() {
    return transactionTemplate.execute(
        status -> repository.findAll().stream().map(SubmissionJobRecord::toJob).toList());
  }
}
