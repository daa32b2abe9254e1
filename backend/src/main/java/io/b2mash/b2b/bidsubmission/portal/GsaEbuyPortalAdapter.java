package io.b2mash.b2b.bidsubmission.portal;

import io.b2mash.b2b.bidsubmission.packaging.BidDocumentPackage;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/** GSA eBuy quote submission. Only active when an access token is configured. */
@Component
@ConditionalOnProperty(name = "submission.gsa-ebuy.access-token")
public class GsaEbuyPortalAdapter extends RestPortalAdapter {

  public static final String PORTAL_ID = "gsa-ebuy";

  static final String QUOTES_PATH = "/ebuy/api/v1/quotes";

  @Autowired
  public GsaEbuyPortalAdapter(
      @Value("${submission.gsa-ebuy.base-url:https://www.ebuy.gsa.gov}") String baseUrl,
      @Value("${submission.gsa-ebuy.access-token}") String accessToken) {
    this(RestClient.builder(), baseUrl, accessToken);
  }

  GsaEbuyPortalAdapter(RestClient.Builder builder, String baseUrl, String accessToken) {
    super(
        builder
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
            .build());
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
            .uri(QUOTES_PATH)
            .header(IDEMPOTENCY_KEY_HEADER, bidPackage.idempotencyKey())
            .contentType(MediaType.APPLICATION_JSON)
            .body(requestBody(bidPackage))
            .retrieve()
            .body(EbuyQuoteReceipt.class);
    return confirmedOrRetry(receipt != null ? receipt.quoteNumber() : null);
  }

  private static Map<String, Object> requestBody(BidDocumentPackage bidPackage) {
    var document = bidPackage.primaryDocument();
    var body = new LinkedHashMap<String, Object>();
    body.put("rfqReference", bidPackage.idempotencyKey());
    body.put(
        "attachments",
        List.of(
            Map.of(
                "name", document.fileName(),
                "mimeType", document.format().getContentType(),
                "data", document.contentBase64())));
    body.put("forms", bidPackage.forms());
    body.put("certifications", bidPackage.certifications());
    return body;
  }

  record EbuyQuoteReceipt(String quoteNumber, String status) {}
}
