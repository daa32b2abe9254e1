package io.b2mash.b2b.bidsubmission.document;

public record VendorInfo(String name, String cageCode, String dunsNumber, String address) {}
