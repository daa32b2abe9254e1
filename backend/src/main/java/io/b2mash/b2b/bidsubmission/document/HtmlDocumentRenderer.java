package io.b2mash.b2b.bidsubmission.document;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jsoup.Jsoup;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

/**
 * Renders bid documents through the {@code templates/submission/bid-document.html} Thymeleaf
 * template. Uses a dedicated engine rather than Spring's autoconfigured one so the renderer works
 * the same inside and outside an application context.
 *
 * <p>Pre-rendered HTML bodies are sanitised with jsoup's relaxed safelist before being inlined.
 */
@Component
public class HtmlDocumentRenderer implements DocumentRenderer {

  static final String TEMPLATE_NAME = "bid-document";

  private final TemplateEngine templateEngine;

  public HtmlDocumentRenderer() {
    this.templateEngine = createTemplateEngine();
  }

  @Override
  public DocumentFormat format() {
    return DocumentFormat.HTML;
  }

  @Override
  public byte[] render(BidDocument document) {
    return renderHtml(document).getBytes(StandardCharsets.UTF_8);
  }

  /** Renders the complete XHTML document as a string. Shared with the PDF renderer. */
  public String renderHtml(BidDocument document) {
    var ctx = new Context();
    buildContext(document).forEach(ctx::setVariable);
    try {
      return templateEngine.process(TEMPLATE_NAME, ctx);
    } catch (RuntimeException e) {
      throw new DocumentRenderingException(
          "Failed to render HTML for document " + document.documentId(), e);
    }
  }

  private Map<String, Object> buildContext(BidDocument document) {
    var context = new LinkedHashMap<String, Object>();
    context.put("title", document.title());
    context.put("solicitationNumber", document.solicitationNumber());
    context.put("paragraphs", document.paragraphs());
    context.put(
        "bodyHtml",
        document.hasHtmlContent() ? Jsoup.clean(document.contentHtml(), Safelist.relaxed()) : null);
    if (document.vendor() != null) {
      var vendor = new LinkedHashMap<String, Object>();
      vendor.put("name", document.vendor().name());
      vendor.put("cageCode", document.vendor().cageCode());
      vendor.put("dunsNumber", document.vendor().dunsNumber());
      vendor.put("address", document.vendor().address());
      context.put("vendor", vendor);
    } else {
      context.put("vendor", null);
    }
    return context;
  }

  private static TemplateEngine createTemplateEngine() {
    var resolver = new ClassLoaderTemplateResolver();
    resolver.setPrefix("templates/submission/");
    resolver.setSuffix(".html");
    resolver.setTemplateMode(TemplateMode.HTML);
    resolver.setCharacterEncoding(StandardCharsets.UTF_8.name());
    resolver.setCacheable(true);
    var engine = new TemplateEngine();
    engine.setTemplateResolver(resolver);
    return engine;
  }
}
