package io.b2mash.b2b.bidsubmission.packaging;

import io.b2mash.b2b.bidsubmission.document.BidDocument;
import java.util.LinkedHashMap;
import java.util.Map;

/** Base for forms whose fields are drawn from the vendor block. Absent values become blank. */
abstract class VendorFormGenerator implements FormGenerator {

  @Override
  public GeneratedForm generate(BidDocument document) {
    var fields = new LinkedHashMap<String, String>();
    var vendor = document.vendor();
    fields.put("vendorName", vendor != null ? blankIfNull(vendor.name()) : "");
    fields.put("cageCode", vendor != null ? blankIfNull(vendor.cageCode()) : "");
    fields.put("dunsNumber", vendor != null ? blankIfNull(vendor.dunsNumber()) : "");
    fields.put("solicitationNumber", blankIfNull(document.solicitationNumber()));
    addFormFields(document, fields);
    return new GeneratedForm(formName(), fields);
  }

  protected abstract void addFormFields(BidDocument document, Map<String, String> fields);

  protected static String blankIfNull(String value) {
    return value != null ? value : "";
  }
}
