package io.b2mash.b2b.bidsubmission.portal;

import io.b2mash.b2b.bidsubmission.packaging.BidDocumentPackage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * In-process stand-in for a procurement portal, used in development and tests. Outcomes can be
 * scripted per call; once the script runs out every delivery is confirmed.
 *
 * <p>Confirmed deliveries are remembered by idempotency key: a package resent under a key that was
 * already confirmed gets the original confirmation number back and is not filed again.
 */
@Component
@ConditionalOnProperty(
    name = "submission.mock-portal.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class MockPortalAdapter implements PortalAdapter {

  private static final Logger log = LoggerFactory.getLogger(MockPortalAdapter.class);

  public static final String PORTAL_ID = "mock";

  private final Queue<DeliveryOutcome> scriptedOutcomes = new ConcurrentLinkedQueue<>();
  private final Map<String, String> confirmationsByKey = new ConcurrentHashMap<>();
  private final List<BidDocumentPackage> filedPackages = new CopyOnWriteArrayList<>();
  private final AtomicInteger deliveryCount = new AtomicInteger();
  private volatile Duration latency;

  public MockPortalAdapter(@Value("${submission.mock-portal.latency:PT0.1S}") Duration latency) {
    this.latency = latency;
  }

  @Override
  public String portalId() {
    return PORTAL_ID;
  }

  @Override
  public DeliveryOutcome submit(BidDocumentPackage bidPackage) {
    deliveryCount.incrementAndGet();
    if (!simulateLatency()) {
      return DeliveryOutcome.retryable("Mock portal call interrupted");
    }

    var key = bidPackage.idempotencyKey();
    if (key != null) {
      var previous = confirmationsByKey.get(key);
      if (previous != null) {
        log.info("Mock portal: duplicate delivery for key={}, returning {}", key, previous);
        return DeliveryOutcome.confirmed(previous);
      }
    }

    var scripted = scriptedOutcomes.poll();
    if (scripted != null && !scripted.success()) {
      log.info(
          "Mock portal: scripted {} failure for key={}: {}",
          scripted.errorClass(),
          key,
          scripted.errorMessage());
      return scripted;
    }

    var confirmation =
        scripted != null && scripted.confirmationNumber() != null
            ? scripted.confirmationNumber()
            : generateConfirmationNumber();
    if (key != null) {
      var raced = confirmationsByKey.putIfAbsent(key, confirmation);
      if (raced != null) {
        return DeliveryOutcome.confirmed(raced);
      }
    }
    filedPackages.add(bidPackage);
    log.info("Mock portal: filed package key={} confirmation={}", key, confirmation);
    return DeliveryOutcome.confirmed(confirmation);
  }

  /** Queues outcomes to be returned by the next calls, in order. */
  public void scriptOutcomes(DeliveryOutcome... outcomes) {
    scriptedOutcomes.addAll(List.of(outcomes));
  }

  public void setLatency(Duration latency) {
    this.latency = latency;
  }

  /** Number of {@link #submit} calls received, including duplicates and failures. */
  public int deliveryCount() {
    return deliveryCount.get();
  }

  /** Packages that were actually filed, one per confirmation issued. */
  public List<BidDocumentPackage> filedPackages() {
    return new ArrayList<>(filedPackages);
  }

  public void reset() {
    scriptedOutcomes.clear();
    confirmationsByKey.clear();
    filedPackages.clear();
    deliveryCount.set(0);
  }

  private boolean simulateLatency() {
    var current = latency;
    if (current == null || current.isZero() || current.isNegative()) {
      return true;
    }
    try {
      Thread.sleep(current.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static String generateConfirmationNumber() {
    return "MOCK-"
        + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
  }
}
