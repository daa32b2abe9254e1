package io.b2mash.b2b.bidsubmission.packaging;

import java.util.List;
import java.util.Map;

/**
 * Everything delivered to a portal in one attempt. Built fresh for every attempt and never
 * reused.
 *
 * @param idempotencyKey stable per submission job; portals use it to recognise a resubmission
 */
public record BidDocumentPackage(
    String idempotencyKey,
    PrimaryDocument primaryDocument,
    Map<String, GeneratedForm> forms,
    List<Certification> certifications) {

  public BidDocumentPackage {
    forms = forms != null ? Map.copyOf(forms) : Map.of();
    certifications = certifications != null ? List.copyOf(certifications) : List.of();
  }

  public BidDocumentPackage withIdempotencyKey(String key) {
    return new BidDocumentPackage(key, primaryDocument, forms, certifications);
  }
}
