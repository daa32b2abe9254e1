package io.b2mash.b2b.bidsubmission.packaging;

public record Certification(String name, String status, String reference) {

  public static final String STATUS_INCLUDED = "included";
}
