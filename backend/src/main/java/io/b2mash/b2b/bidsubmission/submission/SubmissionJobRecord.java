package io.b2mash.b2b.bidsubmission.submission;

import io.b2mash.b2b.bidsubmission.document.BidDocument;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** Persisted state of a submission job, one row per job in {@code submission_jobs}. */
@Entity
@Table(name = "submission_jobs")
public class SubmissionJobRecord {

  @Id
  @Column(name = "job_id", length = 36, updatable = false)
  private String jobId;

  @Column(name = "rfp_id", nullable = false, updatable = false)
  private String rfpId;

  @Column(name = "portal", nullable = false, length = 50, updatable = false)
  private String portal;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "bid_document", columnDefinition = "jsonb", nullable = false, updatable = false)
  private BidDocument bidDocument;

  @Column(name = "deadline", nullable = false, updatable = false)
  private Instant deadline;

  @Column(name = "priority", nullable = false, updatable = false)
  private int priority;

  @Column(name = "max_retries", nullable = false, updatable = false)
  private int maxRetries;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private SubmissionStatus status;

  @Column(name = "scheduled_time")
  private Instant scheduledTime;

  @Column(name = "attempts", nullable = false)
  private int attempts;

  @Column(name = "assembly_failures", nullable = false)
  private int assemblyFailures;

  @Column(name = "confirmation_number")
  private String confirmationNumber;

  @Column(name = "submitted_at")
  private Instant submittedAt;

  @Column(name = "confirmed_at")
  private Instant confirmedAt;

  @Column(name = "last_error", columnDefinition = "text")
  private String lastError;

  @Column(name = "audit_sequence", nullable = false)
  private long auditSequence;

  @Column(name = "deadline_passed_recorded", nullable = false)
  private boolean deadlinePassedRecorded;

  /** Protected no-arg constructor required by JPA. */
  protected SubmissionJobRecord() {}

  SubmissionJobRecord(SubmissionJob job) {
    var state = job.snapshot();
    this.jobId = state.jobId();
    this.rfpId = state.rfpId();
    this.portal = state.portal();
    this.bidDocument = job.getBidDocument();
    this.deadline = state.deadline();
    this.priority = state.priority();
    this.maxRetries = state.maxRetries();
    this.createdAt = state.createdAt();
    update(job);
  }

  /** Copies the job's mutable state. Called while holding the job's monitor. */
  void update(SubmissionJob job) {
    var state = job.snapshot();
    this.status = state.status();
    this.scheduledTime = state.scheduledTime();
    this.attempts = state.attempts();
    this.assemblyFailures = state.assemblyFailures();
    this.confirmationNumber = state.confirmationNumber();
    this.submittedAt = state.submittedAt();
    this.confirmedAt = state.confirmedAt();
    this.lastError = state.lastError();
    this.auditSequence = job.getAuditSequence();
    this.deadlinePassedRecorded = job.isDeadlinePassedRecorded();
  }

  SubmissionJob toJob() {
    return SubmissionJob.restore(
        new SubmissionJobSnapshot(
            jobId,
            rfpId,
            portal,
            status,
            priority,
            deadline,
            scheduledTime,
            attempts,
            maxRetries,
            assemblyFailures,
            confirmationNumber,
            submittedAt,
            confirmedAt,
            createdAt,
            lastError),
        bidDocument,
        auditSequence,
        deadlinePassedRecorded);
  }

  public String getJobId() {
    return jobId;
  }

  public SubmissionStatus getStatus() {
    return status;
  }

  public int getAttempts() {
    return attempts;
  }

  public long getAuditSequence() {
    return auditSequence;
  }
}
