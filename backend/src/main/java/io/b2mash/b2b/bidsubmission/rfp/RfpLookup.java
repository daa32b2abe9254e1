package io.b2mash.b2b.bidsubmission.rfp;

import java.util.Optional;

/** Read access to the RFPs the bid system knows about. */
public interface RfpLookup {

  Optional<RfpRecord> findByRfpId(String rfpId);
}
