package io.b2mash.b2b.bidsubmission.portal;

import io.b2mash.b2b.bidsubmission.packaging.BidDocumentPackage;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/** SAM.gov contract opportunities submission API. Only active when an API key is configured. */
@Component
@ConditionalOnProperty(name = "submission.sam-gov.api-key")
public class SamGovPortalAdapter extends RestPortalAdapter {

  public static final String PORTAL_ID = "sam-gov";

  static final String SUBMISSIONS_PATH = "/opportunities/v1/submissions";

  @Autowired
  public SamGovPortalAdapter(
      @Value("${submission.sam-gov.base-url:https://api.sam.gov}") String baseUrl,
      @Value("${submission.sam-gov.api-key}") String apiKey) {
    this(RestClient.builder(), baseUrl, apiKey);
  }

  /** Package-private constructor for testing with a mock server bound to the builder. */
  SamGovPortalAdapter(RestClient.Builder builder, String baseUrl, String apiKey) {
    super(builder.baseUrl(baseUrl).defaultHeader("X-Api-Key", apiKey).build());
  }

  @Override
  public String portalId() {
    return PORTAL_ID;
  }

  @Override
  protected DeliveryOutcome send(BidDocumentPackage bidPackage) {
    var receipt =
        restClient
            .post()
            .uri(SUBMISSIONS_PATH)
            .header(IDEMPOTENCY_KEY_HEADER, bidPackage.idempotencyKey())
            .contentType(MediaType.APPLICATION_JSON)
            .body(requestBody(bidPackage))
            .retrieve()
            .body(SamSubmissionReceipt.class);
    return confirmedOrRetry(receipt != null ? receipt.confirmationNumber() : null);
  }

  private static Map<String, Object> requestBody(BidDocumentPackage bidPackage) {
    var document = bidPackage.primaryDocument();
    var body = new LinkedHashMap<String, Object>();
    body.put("submissionReference", bidPackage.idempotencyKey());
    body.put(
        "document",
        Map.of(
            "fileName", document.fileName(),
            "contentType", document.format().getContentType(),
            "sizeBytes", document.sizeBytes(),
            "content", document.contentBase64()));
    body.put("forms", bidPackage.forms());
    body.put("certifications", bidPackage.certifications());
    return body;
  }

  record SamSubmissionReceipt(String confirmationNumber, String status) {}
}
