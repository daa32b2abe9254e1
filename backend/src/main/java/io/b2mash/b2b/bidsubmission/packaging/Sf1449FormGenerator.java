package io.b2mash.b2b.bidsubmission.packaging;

import io.b2mash.b2b.bidsubmission.document.BidDocument;
import java.util.Map;
import org.springframework.stereotype.Component;

/** SF 1449, Solicitation/Contract/Order for Commercial Products and Commercial Services. */
@Component
public class Sf1449FormGenerator extends VendorFormGenerator {

  @Override
  public String formName() {
    return "SF1449";
  }

  @Override
  protected void addFormFields(BidDocument document, Map<String, String> fields) {
    var vendor = document.vendor();
    fields.put("offerorAddress", vendor != null ? blankIfNull(vendor.address()) : "");
    fields.put("offerReference", document.documentId());
  }
}
