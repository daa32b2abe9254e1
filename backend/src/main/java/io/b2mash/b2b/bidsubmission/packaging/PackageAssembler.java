package io.b2mash.b2b.bidsubmission.packaging;

import io.b2mash.b2b.bidsubmission.document.BidDocument;
import io.b2mash.b2b.bidsubmission.document.DocumentConverter;
import io.b2mash.b2b.bidsubmission.portal.PortalRequirements;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the deliverable package for one portal and checks it against that portal's requirements.
 * Assembly is deterministic: the same document and requirements always yield an equal package.
 */
@Component
public class PackageAssembler {

  private static final Logger log = LoggerFactory.getLogger(PackageAssembler.class);

  private final DocumentConverter documentConverter;
  private final Map<String, FormGenerator> formGenerators;

  public PackageAssembler(
      DocumentConverter documentConverter, List<FormGenerator> formGeneratorBeans) {
    this.documentConverter = documentConverter;
    this.formGenerators =
        formGeneratorBeans.stream()
            .collect(Collectors.toMap(FormGenerator::formName, Function.identity()));
  }

  /**
   * Converts the document into the portal's format and attaches every required form and
   * certification. The returned package has no idempotency key; callers attach one.
   *
   * @throws PackageAssemblyException if a required form has no registered generator
   * @throws io.b2mash.b2b.bidsubmission.document.UnsupportedFormatException if the portal's
   *     format cannot be rendered in this deployment
   */
  public BidDocumentPackage assemble(BidDocument document, PortalRequirements requirements) {
    byte[] content = documentConverter.convert(document, requirements.format());
    var primaryDocument =
        new PrimaryDocument(
            document.documentId() + "." + requirements.format().getFileExtension(),
            requirements.format(),
            content.length,
            Base64.getEncoder().encodeToString(content));

    var forms = new LinkedHashMap<String, GeneratedForm>();
    for (var formName : requirements.requiredForms()) {
      var generator = formGenerators.get(formName);
      if (generator == null) {
        throw new PackageAssemblyException("No generator registered for required form " + formName);
      }
      forms.put(formName, generator.generate(document));
    }

    var certifications =
        requirements.requiredCertifications().stream()
            .map(
                name ->
                    new Certification(
                        name, Certification.STATUS_INCLUDED, certificationReference(name)))
            .toList();

    log.debug(
        "Assembled package for document {}: format={}, size={}bytes, forms={}, certifications={}",
        document.documentId(),
        requirements.format(),
        content.length,
        forms.keySet(),
        certifications.size());
    return new BidDocumentPackage(null, primaryDocument, forms, certifications);
  }

  /**
   * Checks a package against the portal's requirements, in order: size, required forms, required
   * certifications. Returns every violation found; an empty list means the package may be sent.
   */
  public List<String> validate(BidDocumentPackage bidPackage, PortalRequirements requirements) {
    var violations = new ArrayList<String>();

    long maxBytes = requirements.maxPackageSize().toBytes();
    if (bidPackage.primaryDocument() == null) {
      violations.add("Primary document is missing");
    } else if (bidPackage.primaryDocument().sizeBytes() > maxBytes) {
      violations.add(
          "Primary document is "
              + bidPackage.primaryDocument().sizeBytes()
              + " bytes, exceeding the portal limit of "
              + maxBytes
              + " bytes");
    }

    for (var formName : requirements.requiredForms()) {
      if (!bidPackage.forms().containsKey(formName)) {
        violations.add("Missing required form: " + formName);
      }
    }

    for (var certificationName : requirements.requiredCertifications()) {
      boolean present =
          bidPackage.certifications().stream()
              .anyMatch(certification -> certificationName.equals(certification.name()));
      if (!present) {
        violations.add("Missing required certification: " + certificationName);
      }
    }
    return violations;
  }

  static String certificationReference(String certificationName) {
    return certificationName.replaceAll("[^A-Za-z0-9]+", "_").toLowerCase() + "_cert";
  }
}
