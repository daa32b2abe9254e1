package io.b2mash.b2b.bidsubmission.document;

import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import org.jsoup.Jsoup;
import org.jsoup.helper.W3CDom;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.stereotype.Component;

/**
 * Converts the HTML rendering to PDF via OpenHTMLToPDF. The HTML is re-parsed with jsoup so that
 * markup which is valid HTML but not well-formed XML still renders.
 */
@Component
@ConditionalOnClass(name = "com.openhtmltopdf.pdfboxout.PdfRendererBuilder")
public class PdfDocumentRenderer implements DocumentRenderer {

  private final HtmlDocumentRenderer htmlRenderer;

  public PdfDocumentRenderer(HtmlDocumentRenderer htmlRenderer) {
    this.htmlRenderer = htmlRenderer;
  }

  @Override
  public DocumentFormat format() {
    return DocumentFormat.PDF;
  }

  @Override
  public byte[] render(BidDocument document) {
    var html = htmlRenderer.renderHtml(document);
    var w3cDocument = new W3CDom().fromJsoup(Jsoup.parse(html));
    try (var outputStream = new ByteArrayOutputStream()) {
      var builder = new PdfRendererBuilder();
      builder.withW3cDocument(w3cDocument, "/");
      builder.toStream(outputStream);
      builder.run();
      return outputStream.toByteArray();
    } catch (IOException e) {
      throw new DocumentRenderingException(
          "Failed to generate PDF for document " + document.documentId(), e);
    }
  }
}
