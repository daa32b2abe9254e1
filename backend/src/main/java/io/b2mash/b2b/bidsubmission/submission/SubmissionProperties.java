package io.b2mash.b2b.bidsubmission.submission;

import io.b2mash.b2b.bidsubmission.portal.PortalRequirements;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Orchestrator settings bound from {@code submission.*}.
 *
 * @param maxConcurrentSubmissions upper bound on jobs in flight at once
 * @param defaultMaxRetries retry budget for portals without their own
 * @param retryBackoff delay before the first retry; doubles per failure
 * @param maxRetryBackoff cap on the retry delay
 * @param deadlineWarningWindow how far ahead of a deadline queued jobs trigger a warning
 * @param portals requirements per portal id
 */
@ConfigurationProperties(prefix = "submission")
public record SubmissionProperties(
    @DefaultValue("5") int maxConcurrentSubmissions,
    @DefaultValue("3") int defaultMaxRetries,
    @DefaultValue("30s") Duration retryBackoff,
    @DefaultValue("15m") Duration maxRetryBackoff,
    @DefaultValue("24h") Duration deadlineWarningWindow,
    Map<String, PortalRequirements> portals) {

  public SubmissionProperties {
    if (maxConcurrentSubmissions < 1) {
      throw new IllegalArgumentException(
          "submission.max-concurrent-submissions must be at least 1, got "
              + maxConcurrentSubmissions);
    }
    if (defaultMaxRetries < 0) {
      throw new IllegalArgumentException(
          "submission.default-max-retries must not be negative, got " + defaultMaxRetries);
    }
    retryBackoff = retryBackoff != null ? retryBackoff : Duration.ZERO;
    maxRetryBackoff = maxRetryBackoff != null ? maxRetryBackoff : Duration.ofMinutes(15);
    deadlineWarningWindow =
        deadlineWarningWindow != null ? deadlineWarningWindow : Duration.ofHours(24);
    portals = portals != null ? Map.copyOf(portals) : Map.of();
  }

  public Optional<PortalRequirements> requirementsFor(String portalId) {
    return Optional.ofNullable(portals.get(portalId));
  }
}
