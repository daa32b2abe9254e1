package io.b2mash.b2b.bidsubmission.audit;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builder for {@link AuditLogEntry}. Required fields: {@code jobId}, {@code sequence}, {@code
 * eventType}, {@code timestamp}. Detail values that are {@code null} are dropped.
 *
 * <pre>{@code
 * AuditLogEntry entry = AuditLogEntryBuilder.builder()
 *     .jobId(job.getId())
 *     .sequence(job.nextAuditSequence())
 *     .eventType(SubmissionAuditEvents.ATTEMPT_STARTED)
 *     .detail("attempt", 1)
 *     .timestamp(clock.instant())
 *     .build();
 * }</pre>
 */
public class AuditLogEntryBuilder {

  private String jobId;
  private Long sequence;
  private String eventType;
  private boolean success = true;
  private final Map<String, Object> details = new LinkedHashMap<>();
  private String errorMessage;
  private Instant timestamp;

  private AuditLogEntryBuilder() {}

  public static AuditLogEntryBuilder builder() {
    return new AuditLogEntryBuilder();
  }

  public AuditLogEntryBuilder jobId(String jobId) {
    this.jobId = jobId;
    return this;
  }

  public AuditLogEntryBuilder sequence(long sequence) {
    this.sequence = sequence;
    return this;
  }

  public AuditLogEntryBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditLogEntryBuilder detail(String key, Object value) {
    if (value != null) {
      this.details.put(key, value);
    }
    return this;
  }

  /** Marks the entry as a failure carrying the given message. */
  public AuditLogEntryBuilder failure(String errorMessage) {
    this.success = false;
    this.errorMessage = errorMessage;
    return this;
  }

  public AuditLogEntryBuilder timestamp(Instant timestamp) {
    this.timestamp = timestamp;
    return this;
  }

  public AuditLogEntry build() {
    if (jobId == null || sequence == null || eventType == null || timestamp == null) {
      throw new IllegalStateException(
          "jobId, sequence, eventType and timestamp are required, got jobId="
              + jobId
              + " sequence="
              + sequence
              + " eventType="
              + eventType);
    }
    return new AuditLogEntry(
        jobId, sequence, eventType, success, details, errorMessage, timestamp);
  }
}
