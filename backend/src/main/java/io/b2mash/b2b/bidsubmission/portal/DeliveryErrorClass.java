package io.b2mash.b2b.bidsubmission.portal;

/** How a delivery failure should be treated by the retry policy. */
public enum DeliveryErrorClass {
  NONE,
  /** Transient: network failure, timeout, portal busy. Worth another attempt. */
  RETRYABLE,
  /** Permanent: the portal rejected the package. Retrying cannot succeed. */
  NON_RETRYABLE
}
