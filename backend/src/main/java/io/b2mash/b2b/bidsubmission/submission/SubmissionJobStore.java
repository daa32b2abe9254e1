package io.b2mash.b2b.bidsubmission.submission;

import java.util.List;

/**
 * Durable copy of the job table. The orchestrator writes a job through after each transition and
 * reads the whole table back on startup.
 *
 * <p>Implementations report write failures as {@link SubmissionStoreException}.
 */
interface SubmissionJobStore {

  void save(SubmissionJob job);

  List<SubmissionJob> loadAll();
}
