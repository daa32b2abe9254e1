package io.b2mash.b2b.bidsubmission.submission;

import io.b2mash.b2b.bidsubmission.document.BidDocument;
import java.time.Instant;
import java.util.Objects;

/**
 * A request to deliver a bid to a portal.
 *
 * @param priority higher values are admitted first
 * @param scheduledTime earliest time the job may be admitted; {@code null} for immediately
 * @param maxRetries retry budget; {@code null} uses the portal's or the global default
 */
public record SubmissionRequest(
    String rfpId,
    BidDocument bidDocument,
    String portal,
    int priority,
    Instant scheduledTime,
    Integer maxRetries) {

  public SubmissionRequest {
    Objects.requireNonNull(rfpId, "rfpId must not be null");
    Objects.requireNonNull(bidDocument, "bidDocument must not be null");
    Objects.requireNonNull(portal, "portal must not be null");
    if (maxRetries != null && maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative, got " + maxRetries);
    }
  }

  public static SubmissionRequest of(
      String rfpId, BidDocument bidDocument, String portal, int priority) {
    return new SubmissionRequest(rfpId, bidDocument, portal, priority, null, null);
  }

  public SubmissionRequest withMaxRetries(int maxRetries) {
    return new SubmissionRequest(rfpId, bidDocument, portal, priority, scheduledTime, maxRetries);
  }

  public SubmissionRequest withScheduledTime(Instant scheduledTime) {
    return new SubmissionRequest(rfpId, bidDocument, portal, priority, scheduledTime, maxRetries);
  }
}
