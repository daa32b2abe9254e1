package io.b2mash.b2b.bidsubmission.document;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A finished bid response ready for delivery. {@code content} holds plain text with paragraphs
 * separated by blank lines; {@code contentHtml}, when present, is a pre-rendered body that takes
 * precedence in HTML-based renderings.
 */
public record BidDocument(
    String documentId,
    String title,
    String content,
    String contentHtml,
    String solicitationNumber,
    VendorInfo vendor) {

  public BidDocument {
    Objects.requireNonNull(documentId, "documentId must not be null");
    Objects.requireNonNull(title, "title must not be null");
    content = content != null ? content : "";
  }

  public List<String> paragraphs() {
    return Arrays.stream(content.split("\\R\\s*\\R"))
        .map(String::strip)
        .filter(paragraph -> !paragraph.isEmpty())
        .toList();
  }

  public boolean hasHtmlContent() {
    return contentHtml != null && !contentHtml.isBlank();
  }
}
