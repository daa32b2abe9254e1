package io.b2mash.b2b.bidsubmission.portal;

import io.b2mash.b2b.bidsubmission.packaging.BidDocumentPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Base for portals reached over HTTP. Subclasses perform the call; this class turns transport
 * errors into classified outcomes. I/O failures, 408, 429 and 5xx responses are retryable; any
 * other 4xx is a rejection.
 */
abstract class RestPortalAdapter implements PortalAdapter {

  private static final Logger log = LoggerFactory.getLogger(RestPortalAdapter.class);

  static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

  protected final RestClient restClient;

  protected RestPortalAdapter(RestClient restClient) {
    this.restClient = restClient;
  }

  @Override
  public final DeliveryOutcome submit(BidDocumentPackage bidPackage) {
    try {
      return send(bidPackage);
    } catch (RestClientResponseException e) {
      var errorClass = classify(e.getStatusCode());
      var message =
          portalId() + " responded " + e.getStatusCode().value() + ": " + e.getStatusText();
      log.warn(
          "Portal {} rejected package key={} status={} class={}",
          portalId(),
          bidPackage.idempotencyKey(),
          e.getStatusCode().value(),
          errorClass);
      return errorClass == DeliveryErrorClass.RETRYABLE
          ? DeliveryOutcome.retryable(message)
          : DeliveryOutcome.nonRetryable(message);
    } catch (ResourceAccessException e) {
      log.warn(
          "Portal {} unreachable for package key={}: {}",
          portalId(),
          bidPackage.idempotencyKey(),
          e.getMessage());
      return DeliveryOutcome.retryable(portalId() + " unreachable: " + e.getMessage());
    } catch (RestClientException e) {
      log.warn(
          "Portal {} call failed for package key={}: {}",
          portalId(),
          bidPackage.idempotencyKey(),
          e.getMessage());
      return DeliveryOutcome.retryable(portalId() + " call failed: " + e.getMessage());
    }
  }

  /** Sends the package. Transport exceptions may propagate; they are classified by the caller. */
  protected abstract DeliveryOutcome send(BidDocumentPackage bidPackage);

  static DeliveryErrorClass classify(HttpStatusCode status) {
    int code = status.value();
    if (status.is5xxServerError() || code == 408 || code == 429) {
      return DeliveryErrorClass.RETRYABLE;
    }
    return DeliveryErrorClass.NON_RETRYABLE;
  }

  /** A success response without a confirmation number is retried under the same key. */
  protected DeliveryOutcome confirmedOrRetry(String confirmationNumber) {
    if (confirmationNumber == null || confirmationNumber.isBlank()) {
      return DeliveryOutcome.retryable(
          portalId() + " accepted the package without a confirmation number");
    }
    return DeliveryOutcome.confirmed(confirmationNumber);
  }
}
