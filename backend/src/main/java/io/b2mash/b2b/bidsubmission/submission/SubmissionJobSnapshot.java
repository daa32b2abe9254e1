package io.b2mash.b2b.bidsubmission.submission;

import java.time.Instant;

/** Immutable, internally consistent view of a submission job at one point in time. */
public record SubmissionJobSnapshot(
    String jobId,
    String rfpId,
    String portal,
    SubmissionStatus status,
    int priority,
    Instant deadline,
    Instant scheduledTime,
    int attempts,
    int maxRetries,
    int assemblyFailures,
    String confirmationNumber,
    Instant submittedAt,
    Instant confirmedAt,
    Instant createdAt,
    String lastError) {}
