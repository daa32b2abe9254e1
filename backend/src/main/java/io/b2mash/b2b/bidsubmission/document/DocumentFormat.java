package io.b2mash.b2b.bidsubmission.document;

/** Output formats a bid document can be rendered into. */
public enum DocumentFormat {
  HTML("text/html", "html"),
  DOCX("application/vnd.openxmlformats-officedocument.wordprocessingml.document", "docx"),
  PDF("application/pdf", "pdf"),
  JSON("application/json", "json");

  private final String contentType;
  private final String fileExtension;

  DocumentFormat(String contentType, String fileExtension) {
    this.contentType = contentType;
    this.fileExtension = fileExtension;
  }

  public String getContentType() {
    return contentType;
  }

  public String getFileExtension() {
    return fileExtension;
  }
}
