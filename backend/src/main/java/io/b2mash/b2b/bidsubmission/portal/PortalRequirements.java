package io.b2mash.b2b.bidsubmission.portal;

import io.b2mash.b2b.bidsubmission.document.DocumentFormat;
import java.time.Duration;
import java.util.List;
import org.springframework.util.unit.DataSize;

/**
 * What a portal demands of a package, bound from {@code submission.portals.<portal-id>}.
 *
 * @param format the document format the portal accepts
 * @param requiredForms form names that must be generated and attached
 * @param requiredCertifications certification names that must be attached
 * @param maxPackageSize upper bound on the primary document size
 * @param averageLatency typical portal response time, informational
 * @param submitTimeout how long a delivery attempt may wait for the portal
 * @param maxRetries per-portal retry budget; {@code null} falls back to the global default
 */
public record PortalRequirements(
    DocumentFormat format,
    List<String> requiredForms,
    List<String> requiredCertifications,
    DataSize maxPackageSize,
    Duration averageLatency,
    Duration submitTimeout,
    Integer maxRetries) {

  public PortalRequirements {
    format = format != null ? format : DocumentFormat.PDF;
    requiredForms = requiredForms != null ? List.copyOf(requiredForms) : List.of();
    requiredCertifications =
        requiredCertifications != null ? List.copyOf(requiredCertifications) : List.of();
    maxPackageSize = maxPackageSize != null ? maxPackageSize : DataSize.ofMegabytes(100);
    averageLatency = averageLatency != null ? averageLatency : Duration.ofSeconds(1);
    submitTimeout = submitTimeout != null ? submitTimeout : Duration.ofSeconds(30);
    if (maxRetries != null && maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative");
    }
  }
}
