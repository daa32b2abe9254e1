package io.b2mash.b2b.bidsubmission.submission;

import io.b2mash.b2b.bidsubmission.document.BidDocument;
import java.time.Instant;

/**
 * Mutable job state owned by {@link SubmissionOrchestrator}. Identity, RFP, portal, document,
 * deadline and priority never change. Every other field is guarded by the job's own monitor, and
 * multi-field transitions happen in a single synchronized call.
 *
 * <p>Each transition ends by publishing an immutable snapshot to a volatile field. {@link
 * #snapshot()} reads that field without taking the monitor, so status queries never wait on a
 * worker that holds the monitor across audit or store I/O.
 */
class SubmissionJob {

  private final String id;
  private final String rfpId;
  private final String portal;
  private final BidDocument bidDocument;
  private final Instant deadline;
  private final int priority;
  private final int maxRetries;
  private final Instant createdAt;

  private SubmissionStatus status = SubmissionStatus.QUEUED;
  private Instant scheduledTime;
  private int attempts;
  private int assemblyFailures;
  private String confirmationNumber;
  private Instant submittedAt;
  private Instant confirmedAt;
  private String lastError;
  private long auditSequence;
  private boolean deadlinePassedRecorded;

  private volatile SubmissionJobSnapshot published;

  SubmissionJob(
      String id,
      String rfpId,
      String portal,
      BidDocument bidDocument,
      Instant deadline,
      int priority,
      Instant scheduledTime,
      int maxRetries,
      Instant createdAt) {
    this.id = id;
    this.rfpId = rfpId;
    this.portal = portal;
    this.bidDocument = bidDocument;
    this.deadline = deadline;
    this.priority = priority;
    this.scheduledTime = scheduledTime;
    this.maxRetries = maxRetries;
    this.createdAt = createdAt;
    publish();
  }

  /** Rebuilds a job from persisted state. */
  static SubmissionJob restore(
      SubmissionJobSnapshot state,
      BidDocument bidDocument,
      long auditSequence,
      boolean deadlinePassedRecorded) {
    var job =
        new SubmissionJob(
            state.jobId(),
            state.rfpId(),
            state.portal(),
            bidDocument,
            state.deadline(),
            state.priority(),
            state.scheduledTime(),
            state.maxRetries(),
            state.createdAt());
    synchronized (job) {
      job.status = state.status();
      job.attempts = state.attempts();
      job.assemblyFailures = state.assemblyFailures();
      job.confirmationNumber = state.confirmationNumber();
      job.submittedAt = state.submittedAt();
      job.confirmedAt = state.confirmedAt();
      job.lastError = state.lastError();
      job.auditSequence = auditSequence;
      job.deadlinePassedRecorded = deadlinePassedRecorded;
      job.publish();
    }
    return job;
  }

  String getId() {
    return id;
  }

  String getRfpId() {
    return rfpId;
  }

  String getPortal() {
    return portal;
  }

  BidDocument getBidDocument() {
    return bidDocument;
  }

  Instant getDeadline() {
    return deadline;
  }

  int getPriority() {
    return priority;
  }

  int getMaxRetries() {
    return maxRetries;
  }

  Instant getCreatedAt() {
    return createdAt;
  }

  synchronized SubmissionStatus getStatus() {
    return status;
  }

  synchronized int getAttempts() {
    return attempts;
  }

  synchronized int getAssemblyFailures() {
    return assemblyFailures;
  }

  synchronized String getConfirmationNumber() {
    return confirmationNumber;
  }

  synchronized String getLastError() {
    return lastError;
  }

  synchronized long getAuditSequence() {
    return auditSequence;
  }

  synchronized boolean isDeadlinePassedRecorded() {
    return deadlinePassedRecorded;
  }

  /** Queued, due, and within both the delivery and the assembly budget. */
  synchronized boolean isEligible(Instant now) {
    return status == SubmissionStatus.QUEUED
        && (scheduledTime == null || !scheduledTime.isAfter(now))
        && attempts <= maxRetries
        && assemblyFailures <= maxRetries;
  }

  synchronized long nextAuditSequence() {
    return ++auditSequence;
  }

  /** Moves the audit sequence past entries recorded before the last persisted state. */
  synchronized void advanceAuditSequence(long lastRecorded) {
    auditSequence = Math.max(auditSequence, lastRecorded);
  }

  /** Returns true the first time it is called; used to record a missed deadline once. */
  synchronized boolean markDeadlinePassedRecorded() {
    if (deadlinePassedRecorded) {
      return false;
    }
    deadlinePassedRecorded = true;
    return true;
  }

  /** QUEUED to VALIDATING. Returns false if the job was no longer queued. */
  synchronized boolean admit() {
    if (status != SubmissionStatus.QUEUED) {
      return false;
    }
    status = SubmissionStatus.VALIDATING;
    publish();
    return true;
  }

  /** Undoes an admission whose attempt never started. */
  synchronized void revertAdmission() {
    if (status == SubmissionStatus.VALIDATING) {
      status = SubmissionStatus.QUEUED;
      publish();
    }
  }

  synchronized void markSubmitted(Instant now) {
    attempts++;
    status = SubmissionStatus.SUBMITTED;
    if (submittedAt == null) {
      submittedAt = now;
    }
    publish();
  }

  synchronized void markConfirmed(String confirmation, Instant now) {
    status = SubmissionStatus.CONFIRMED;
    if (confirmationNumber == null) {
      confirmationNumber = confirmation;
    }
    if (confirmedAt == null) {
      confirmedAt = now;
    }
    lastError = null;
    publish();
  }

  synchronized void recordAssemblyFailure(String error) {
    assemblyFailures++;
    lastError = error;
    publish();
  }

  synchronized void recordDeliveryFailure(String error) {
    lastError = error;
    publish();
  }

  synchronized void requeue(Instant notBefore) {
    status = SubmissionStatus.QUEUED;
    scheduledTime = notBefore;
    publish();
  }

  synchronized void markFailed() {
    status = SubmissionStatus.FAILED;
    publish();
  }

  /** FAILED to QUEUED on operator request: clears the assembly budget and any backoff. */
  synchronized void requeueByOperator() {
    status = SubmissionStatus.QUEUED;
    assemblyFailures = 0;
    scheduledTime = null;
    publish();
  }

  SubmissionJobSnapshot snapshot() {
    return published;
  }

  private void publish() {
    published =
        new SubmissionJobSnapshot(
            id,
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
            lastError);
  }
}
