package io.b2mash.b2b.bidsubmission.packaging;

import java.util.Map;

public record GeneratedForm(String formName, Map<String, String> fields) {

  public GeneratedForm {
    fields = fields != null ? Map.copyOf(fields) : Map.of();
  }
}
