package io.b2mash.b2b.bidsubmission.document;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.jsoup.Jsoup;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Writes a minimal WordprocessingML package: content types, the package relationship and a single
 * {@code word/document.xml} part. Headings come from the title and vendor block; body paragraphs
 * from the plain content, or from the text of the HTML body when only HTML was supplied.
 *
 * <p>Zip entries carry a fixed timestamp so identical documents produce identical bytes.
 */
@Component
@ConditionalOnProperty(
    name = "submission.documents.docx.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class DocxDocumentRenderer implements DocumentRenderer {

  private static final long FIXED_ENTRY_TIME = 946684800000L; // 2000-01-01T00:00:00Z

  private static final String CONTENT_TYPES =
      """
      <?xml version="1.0" encoding="UTF-8" standalone="yes"?>
      <Types xmlns="http://schemas.openxmlformats.org/package/2006/content-types">
      <Default Extension="rels" \
      ContentType="application/vnd.openxmlformats-package.relationships+xml"/>
      <Default Extension="xml" ContentType="application/xml"/>
      <Override PartName="/word/document.xml" \
      ContentType="application/vnd.openxmlformats-officedocument.wordprocessingml.document.main+xml"/>
      </Types>
      """;

  private static final String PACKAGE_RELATIONSHIPS =
      """
      <?xml version="1.0" encoding="UTF-8" standalone="yes"?>
      <Relationships xmlns="http://schemas.openxmlformats.org/package/2006/relationships">
      <Relationship Id="rId1" \
      Type="http://schemas.openxmlformats.org/officeDocument/2006/relationships/officeDocument" \
      Target="word/document.xml"/>
      </Relationships>
      """;

  @Override
  public DocumentFormat format() {
    return DocumentFormat.DOCX;
  }

  @Override
  public byte[] render(BidDocument document) {
    try (var bytes = new ByteArrayOutputStream();
        var zip = new ZipOutputStream(bytes)) {
      writeEntry(zip, "[Content_Types].xml", CONTENT_TYPES);
      writeEntry(zip, "_rels/.rels", PACKAGE_RELATIONSHIPS);
      writeEntry(zip, "word/document.xml", documentXml(document));
      zip.finish();
      return bytes.toByteArray();
    } catch (IOException e) {
      throw new DocumentRenderingException(
          "Failed to write DOCX package for document " + document.documentId(), e);
    }
  }

  String documentXml(BidDocument document) {
    var body = new StringBuilder();
    body.append(paragraph(document.title(), true));
    if (document.solicitationNumber() != null) {
      body.append(paragraph("Solicitation " + document.solicitationNumber(), false));
    }
    if (document.vendor() != null) {
      var vendor = document.vendor();
      body.append(paragraph(vendor.name(), true));
      if (vendor.cageCode() != null) {
        body.append(paragraph("CAGE Code: " + vendor.cageCode(), false));
      }
      if (vendor.dunsNumber() != null) {
        body.append(paragraph("DUNS: " + vendor.dunsNumber(), false));
      }
      if (vendor.address() != null) {
        body.append(paragraph(vendor.address(), false));
      }
    }
    for (var text : bodyParagraphs(document)) {
      body.append(paragraph(text, false));
    }
    return "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\n"
        + "<w:document xmlns:w=\"http://schemas.openxmlformats.org/wordprocessingml/2006/main\">"
        + "<w:body>"
        + body
        + "</w:body></w:document>";
  }

  private static List<String> bodyParagraphs(BidDocument document) {
    if (!document.paragraphs().isEmpty() || !document.hasHtmlContent()) {
      return document.paragraphs();
    }
    var paragraphs = new ArrayList<String>();
    for (var element : Jsoup.parse(document.contentHtml()).select("h1, h2, h3, p, li")) {
      var text = element.text().strip();
      if (!text.isEmpty()) {
        paragraphs.add(text);
      }
    }
    return paragraphs;
  }

  private static String paragraph(String text, boolean bold) {
    var run = bold ? "<w:r><w:rPr><w:b/></w:rPr>" : "<w:r>";
    return "<w:p>" + run + "<w:t xml:space=\"preserve\">" + escapeXml(text) + "</w:t></w:r></w:p>";
  }

  private static String escapeXml(String text) {
    if (text == null) {
      return "";
    }
    return text.replace("&", "&amp;")
        .replace("<", "&lt;")
        .replace(">", "&gt;")
        .replace("\"", "&quot;")
        .replace("'", "&apos;");
  }

  private static void writeEntry(ZipOutputStream zip, String name, String content)
      throws IOException {
    var entry = new ZipEntry(name);
    entry.setTime(FIXED_ENTRY_TIME);
    zip.putNextEntry(entry);
    zip.write(content.getBytes(StandardCharsets.UTF_8));
    zip.closeEntry();
  }
}
