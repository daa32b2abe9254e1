package io.b2mash.b2b.bidsubmission.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Immutable audit entry persisted to {@code submission_audit_events}. No setters; the table has a
 * unique constraint on {@code (job_id, sequence)}.
 */
@Entity
@Table(name = "submission_audit_events")
public class SubmissionAuditEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "job_id", nullable = false, length = 36, updatable = false)
  private String jobId;

  @Column(name = "sequence", nullable = false, updatable = false)
  private long sequence;

  @Column(name = "event_type", nullable = false, length = 50, updatable = false)
  private String eventType;

  @Column(name = "success", nullable = false, updatable = false)
  private boolean success;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "details", columnDefinition = "jsonb", updatable = false)
  private Map<String, Object> details;

  @Column(name = "error_message", columnDefinition = "text", updatable = false)
  private String errorMessage;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  /** Protected no-arg constructor required by JPA. */
  protected SubmissionAuditEvent() {}

  public SubmissionAuditEvent(AuditLogEntry entry) {
    this.jobId = entry.jobId();
    this.sequence = entry.sequence();
    this.eventType = entry.eventType();
    this.success = entry.success();
    this.details = entry.details();
    this.errorMessage = entry.errorMessage();
    this.occurredAt = entry.timestamp();
  }

  public AuditLogEntry toEntry() {
    return new AuditLogEntry(
        jobId, sequence, eventType, success, details, errorMessage, occurredAt);
  }

  public UUID getId() {
    return id;
  }

  public String getJobId() {
    return jobId;
  }

  public long getSequence() {
    return sequence;
  }

  public String getEventType() {
    return eventType;
  }

  public boolean isSuccess() {
    return success;
  }

  public Map<String, Object> getDetails() {
    return details;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }
}
