package io.b2mash.b2b.bidsubmission.document;

/**
 * Renders a bid document into one output format. Implementations are discovered as Spring beans;
 * a format is supported in a deployment exactly when a renderer for it is registered.
 */
public interface DocumentRenderer {

  DocumentFormat format();

  /**
   * Renders the document. Output must be deterministic for identical input.
   *
   * @throws DocumentRenderingException if the underlying engine fails
   */
  byte[] render(BidDocument document);
}
