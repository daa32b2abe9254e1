package io.b2mash.b2b.bidsubmission.packaging;

import io.b2mash.b2b.bidsubmission.document.DocumentFormat;

/** The converted bid document, carried as base64 so packages serialise cleanly. */
public record PrimaryDocument(
    String fileName, DocumentFormat format, long sizeBytes, String contentBase64) {}
