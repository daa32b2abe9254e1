package io.b2mash.b2b.bidsubmission.audit;

/** Event types recorded in a submission's audit trail. */
public final class SubmissionAuditEvents {

  public static final String CREATED = "created";
  public static final String DEADLINE_PASSED = "deadline_passed";
  public static final String ATTEMPT_STARTED = "attempt_started";
  public static final String ASSEMBLY_FAILED = "assembly_failed";
  public static final String ATTEMPT_SUCCEEDED = "attempt_succeeded";
  public static final String ATTEMPT_FAILED = "attempt_failed";
  public static final String RETRY_SCHEDULED = "retry_scheduled";
  public static final String ABANDONED = "abandoned";
  public static final String SUBMISSION_RETRY = "submission_retry";
  public static final String RECOVERED = "recovered_after_restart";

  private SubmissionAuditEvents() {}
}
