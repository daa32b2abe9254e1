package io.b2mash.b2b.bidsubmission.submission;

/**
 * Lifecycle of a submission job.
 *
 * <pre>
 * QUEUED -> VALIDATING -> SUBMITTED -> CONFIRMED | QUEUED | FAILED
 *           VALIDATING -> QUEUED | FAILED          (assembly failure)
 * FAILED -> QUEUED                                 (operator retry only)
 * </pre>
 */
public enum SubmissionStatus {
  QUEUED,
  /** Admitted; the package is being assembled and validated. */
  VALIDATING,
  /** The package is with the portal adapter. */
  SUBMITTED,
  CONFIRMED,
  FAILED;

  public boolean isInFlight() {
    return this == VALIDATING || this == SUBMITTED;
  }
}
