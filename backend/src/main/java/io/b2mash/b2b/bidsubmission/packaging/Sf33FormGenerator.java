package io.b2mash.b2b.bidsubmission.packaging;

import io.b2mash.b2b.bidsubmission.document.BidDocument;
import java.util.Map;
import org.springframework.stereotype.Component;

/** SF 33, Solicitation, Offer and Award. */
@Component
public class Sf33FormGenerator extends VendorFormGenerator {

  @Override
  public String formName() {
    return "SF33";
  }

  @Override
  protected void addFormFields(BidDocument document, Map<String, String> fields) {
    fields.put("offerTitle", document.title());
    fields.put("offerReference", document.documentId());
  }
}
