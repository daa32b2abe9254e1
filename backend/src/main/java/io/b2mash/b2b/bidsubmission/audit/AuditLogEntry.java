package io.b2mash.b2b.bidsubmission.audit;

import java.time.Instant;
import java.util.Map;

/**
 * One immutable entry in a submission's history. {@code sequence} increases strictly per job and
 * gives the authoritative order of entries.
 *
 * @see AuditLogEntryBuilder
 */
public record AuditLogEntry(
    String jobId,
    long sequence,
    String eventType,
    boolean success,
    Map<String, Object> details,
    String errorMessage,
    Instant timestamp) {

  public AuditLogEntry {
    details = details != null ? Map.copyOf(details) : Map.of();
  }
}
