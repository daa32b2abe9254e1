package io.b2mash.b2b.bidsubmission.portal;

import io.b2mash.b2b.bidsubmission.packaging.BidDocumentPackage;

/**
 * Port for delivering a validated package to one procurement portal. Adapters report failures
 * through the returned {@link DeliveryOutcome} rather than by throwing.
 */
public interface PortalAdapter {

  /** Identifier used in submission requests and configuration, e.g. "sam-gov". */
  String portalId();

  /**
   * Delivers the package. Implementations must pass {@link BidDocumentPackage#idempotencyKey()}
   * to the portal so a resubmission after a lost response is not filed twice.
   */
  DeliveryOutcome submit(BidDocumentPackage bidPackage);
}
