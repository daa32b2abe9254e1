package io.b2mash.b2b.bidsubmission.rfp;

import java.time.Instant;

public record RfpRecord(
    String rfpId,
    String solicitationNumber,
    String title,
    String agency,
    Instant responseDeadline) {}
