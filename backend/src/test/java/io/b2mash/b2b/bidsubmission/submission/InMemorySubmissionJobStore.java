package io.b2mash.b2b.bidsubmission.submission;

import io.b2mash.b2b.bidsubmission.document.BidDocument;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Job store that keeps copies of saved state, so jobs loaded back are new objects as they would
 * be after a restart.
 */
class InMemorySubmissionJobStore implements SubmissionJobStore {

  record SavedJob(
      SubmissionJobSnapshot state,
      BidDocument bidDocument,
      long auditSequence,
      boolean deadlinePassedRecorded) {}

  private final Map<String, SavedJob> saved = new LinkedHashMap<>();
  private volatile Supplier<? extends RuntimeException> failure;

  @Override
  public synchronized void save(SubmissionJob job) {
    var currentFailure = failure;
    if (currentFailure != null) {
      throw currentFailure.get();
    }
    saved.put(
        job.getId(),
        new SavedJob(
            job.snapshot(),
            job.getBidDocument(),
            job.getAuditSequence(),
            job.isDeadlinePassedRecorded()));
  }

  @Override
  public synchronized List<SubmissionJob> loadAll() {
    var jobs = new ArrayList<SubmissionJob>();
    for (var job : saved.values()) {
      jobs.add(
          SubmissionJob.restore(
              job.state(), job.bidDocument(), job.auditSequence(), job.deadlinePassedRecorded()));
    }
    return jobs;
  }

  synchronized SubmissionJobSnapshot savedState(String jobId) {
    var job = saved.get(jobId);
    return job != null ? job.state() : null;
  }

  void failWith(Supplier<? extends RuntimeException> failure) {
    this.failure = failure;
  }
}
