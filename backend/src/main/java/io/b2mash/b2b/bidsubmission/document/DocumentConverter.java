package io.b2mash.b2b.bidsubmission.document;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Routes a conversion request to the renderer registered for the target format. */
@Component
public class DocumentConverter {

  private static final Logger log = LoggerFactory.getLogger(DocumentConverter.class);

  private final Map<DocumentFormat, DocumentRenderer> renderers =
      new EnumMap<>(DocumentFormat.class);

  public DocumentConverter(List<DocumentRenderer> rendererBeans) {
    for (var renderer : rendererBeans) {
      var existing = renderers.putIfAbsent(renderer.format(), renderer);
      if (existing != null) {
        throw new IllegalStateException(
            "Duplicate DocumentRenderer for format "
                + renderer.format()
                + " registered by both "
                + existing.getClass().getName()
                + " and "
                + renderer.getClass().getName());
      }
    }
    log.info("Document renderers available for formats {}", renderers.keySet());
  }

  public byte[] convert(BidDocument document, DocumentFormat format) {
    var renderer = renderers.get(format);
    if (renderer == null) {
      throw new UnsupportedFormatException(format, supportedFormats());
    }
    byte[] output = renderer.render(document);
    log.debug(
        "Rendered document {} as {} ({} bytes)", document.documentId(), format, output.length);
    return output;
  }

  public Set<DocumentFormat> supportedFormats() {
    return Collections.unmodifiableSet(renderers.keySet());
  }
}
