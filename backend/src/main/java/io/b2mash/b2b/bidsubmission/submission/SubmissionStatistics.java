package io.b2mash.b2b.bidsubmission.submission;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts of jobs by status. The per-status counts always sum to {@code total}.
 *
 * @param successRate CONFIRMED jobs as a fraction of all jobs, 0.0 when there are none
 */
public record SubmissionStatistics(
    long total, Map<SubmissionStatus, Long> countsByStatus, double successRate) {

  public SubmissionStatistics {
    countsByStatus = Collections.unmodifiableMap(new EnumMap<>(countsByStatus));
  }

  public long count(SubmissionStatus status) {
    return countsByStatus.getOrDefault(status, 0L);
  }
}
