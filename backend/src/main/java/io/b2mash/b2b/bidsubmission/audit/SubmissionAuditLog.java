package io.b2mash.b2b.bidsubmission.audit;

import java.util.List;

/** Append-only history of submission jobs. */
public interface SubmissionAuditLog {

  /**
   * Durably records an entry. Returns only once the entry is stored.
   *
   * @throws AuditLogWriteException if the entry could not be stored
   */
  void append(AuditLogEntry entry);

  /** Returns the entries for a job in sequence order. */
  List<AuditLogEntry> findByJobId(String jobId);
}
