package io.b2mash.b2b.bidsubmission.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.LinkedHashMap;
import org.springframework.stereotype.Component;

@Component
public class JsonDocumentRenderer implements DocumentRenderer {

  private final ObjectMapper objectMapper =
      JsonMapper.builder()
          .enable(SerializationFeature.INDENT_OUTPUT)
          .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
          .build();

  @Override
  public DocumentFormat format() {
    return DocumentFormat.JSON;
  }

  @Override
  public byte[] render(BidDocument document) {
    var body = new LinkedHashMap<String, Object>();
    body.put("documentId", document.documentId());
    body.put("title", document.title());
    if (document.solicitationNumber() != null) {
      body.put("solicitationNumber", document.solicitationNumber());
    }
    body.put("paragraphs", document.paragraphs());
    if (document.hasHtmlContent()) {
      body.put("contentHtml", document.contentHtml());
    }
    if (document.vendor() != null) {
      body.put("vendor", document.vendor());
    }
    try {
      return objectMapper.writeValueAsBytes(body);
    } catch (JsonProcessingException e) {
      throw new DocumentRenderingException(
          "Failed to serialise document " + document.documentId() + " as JSON", e);
    }
  }
}
