package io.b2mash.b2b.bidsubmission.packaging;

import io.b2mash.b2b.bidsubmission.document.BidDocument;

/** Produces one standard government form from the vendor and contract fields of a bid. */
public interface FormGenerator {

  /** The form name as it appears in portal requirements, e.g. {@code SF1449}. */
  String formName();

  GeneratedForm generate(BidDocument document);
}
