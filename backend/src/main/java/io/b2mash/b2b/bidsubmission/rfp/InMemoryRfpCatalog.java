package io.b2mash.b2b.bidsubmission.rfp;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** {@link RfpLookup} holding the RFPs registered by the surrounding bid system. */
@Component
public class InMemoryRfpCatalog implements RfpLookup {

  private static final Logger log = LoggerFactory.getLogger(InMemoryRfpCatalog.class);

  private final Map<String, RfpRecord> rfps = new ConcurrentHashMap<>();

  @Override
  public Optional<RfpRecord> findByRfpId(String rfpId) {
    return rfpId == null ? Optional.empty() : Optional.ofNullable(rfps.get(rfpId));
  }

  /** Registers or replaces an RFP. */
  public void register(RfpRecord rfp) {
    Objects.requireNonNull(rfp.rfpId(), "rfpId must not be null");
    var previous = rfps.put(rfp.rfpId(), rfp);
    if (previous != null && !Objects.equals(previous.responseDeadline(), rfp.responseDeadline())) {
      log.info(
          "RFP {} deadline changed from {} to {}",
          rfp.rfpId(),
          previous.responseDeadline(),
          rfp.responseDeadline());
    }
  }

  public boolean remove(String rfpId) {
    return rfps.remove(rfpId) != null;
  }
}
