package io.b2mash.b2b.bidsubmission.packaging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.bidsubmission.document.BidDocument;
import io.b2mash.b2b.bidsubmission.document.DocumentConverter;
import io.b2mash.b2b.bidsubmission.document.DocumentFormat;
import io.b2mash.b2b.bidsubmission.document.HtmlDocumentRenderer;
import io.b2mash.b2b.bidsubmission.document.JsonDocumentRenderer;
import io.b2mash.b2b.bidsubmission.testutil.BidFixtures;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;

class PackageAssemblerTest {

  private PackageAssembler assembler;

  @BeforeEach
  void setUp() {
    var converter =
        new DocumentConverter(List.of(new HtmlDocumentRenderer(), new JsonDocumentRenderer()));
    assembler =
        new PackageAssembler(
            converter, List.of(new Sf1449FormGenerator(), new Sf33FormGenerator()));
  }

  @Nested
  class Assemble {

    @Test
    void buildsPrimaryDocumentFormsAndCertifications() {
      var requirements =
          BidFixtures.requirements(
              DocumentFormat.JSON,
              List.of("SF1449"),
              List.of("FAR 52.204-24", "FAR 52.209-5"),
              DataSize.ofMegabytes(1));

      var bidPackage = assembler.assemble(BidFixtures.bidDocument("doc-1"), requirements);

      assertThat(bidPackage.idempotencyKey()).isNull();
      var primary = bidPackage.primaryDocument();
      assertThat(primary.fileName()).isEqualTo("doc-1.json");
      assertThat(primary.format()).isEqualTo(DocumentFormat.JSON);
      assertThat(Base64.getDecoder().decode(primary.contentBase64()))
          .hasSize((int) primary.sizeBytes());

      assertThat(bidPackage.forms()).containsOnlyKeys("SF1449");
      assertThat(bidPackage.forms().get("SF1449").fields())
          .containsEntry("vendorName", "Acme Federal LLC")
          .containsEntry("cageCode", "1ABC2")
          .containsEntry("solicitationNumber", "W912DY-26-R-0001")
          .containsEntry("offerorAddress", "1 Main St, Arlington VA")
          .containsEntry("offerReference", "doc-1");

      assertThat(bidPackage.certifications())
          .containsExactly(
              new Certification("FAR 52.204-24", "included", "far_52_204_24_cert"),
              new Certification("FAR 52.209-5", "included", "far_52_209_5_cert"));
    }

    @Test
    void isDeterministic() {
      var requirements =
          BidFixtures.requirements(
              DocumentFormat.HTML,
              List.of("SF33"),
              List.of("FAR 52.204-24"),
              DataSize.ofMegabytes(1));

      var first = assembler.assemble(BidFixtures.bidDocument("doc-1"), requirements);
      var second = assembler.assemble(BidFixtures.bidDocument("doc-1"), requirements);

      assertThat(first).isEqualTo(second);
    }

    @Test
    void missingVendorLeavesFormFieldsBlank() {
      var document = new BidDocument("doc-2", "Volume II", "Body.", null, null, null);
      var requirements =
          BidFixtures.requirements(
              DocumentFormat.HTML, List.of("SF33"), List.of(), DataSize.ofMegabytes(1));

      var form = assembler.assemble(document, requirements).forms().get("SF33");

      assertThat(form.fields())
          .containsEntry("vendorName", "")
          .containsEntry("solicitationNumber", "")
          .containsEntry("offerTitle", "Volume II");
    }

    @Test
    void requiredFormWithoutGenerator_throws() {
      var requirements =
          BidFixtures.requirements(
              DocumentFormat.HTML, List.of("DD1155"), List.of(), DataSize.ofMegabytes(1));

      assertThatThrownBy(() -> assembler.assemble(BidFixtures.bidDocument("doc-1"), requirements))
          .isInstanceOfSatisfying(
              PackageAssemblyException.class,
              e ->
                  assertThat(e.getBody().getDetail())
                      .isEqualTo("No generator registered for required form DD1155"));
    }
  }

  @Nested
  class Validate {

    @Test
    void completePackageWithinLimit_hasNoViolations() {
      var requirements =
          BidFixtures.requirements(
              DocumentFormat.HTML,
              List.of("SF33"),
              List.of("FAR 52.204-24"),
              DataSize.ofMegabytes(1));
      var bidPackage = assembler.assemble(BidFixtures.bidDocument("doc-1"), requirements);

      assertThat(assembler.validate(bidPackage, requirements)).isEmpty();
    }

    @Test
    void reportsEverySizeFormAndCertificationViolationInOrder() {
      var bidPackage =
          new BidDocumentPackage(
              "job-1",
              new PrimaryDocument("doc-1.html", DocumentFormat.HTML, 2048, "AAAA"),
              Map.of(),
              List.of());
      var requirements =
          BidFixtures.requirements(
              DocumentFormat.HTML,
              List.of("SF1449"),
              List.of("FAR 52.204-24"),
              DataSize.ofKilobytes(1));

      assertThat(assembler.validate(bidPackage, requirements))
          .containsExactly(
              "Primary document is 2048 bytes, exceeding the portal limit of 1024 bytes",
              "Missing required form: SF1449",
              "Missing required certification: FAR 52.204-24");
    }

    @Test
    void twoOfThreeFormsMissingAndOversizedDocument_reportsExactlyThreeViolations() {
      var bidPackage =
          new BidDocumentPackage(
              "job-1",
              new PrimaryDocument("doc-1.html", DocumentFormat.HTML, 4096, "AAAA"),
              Map.of("SF33", new GeneratedForm("SF33", Map.of("offerTitle", "Volume I"))),
              List.of());
      var requirements =
          BidFixtures.requirements(
              DocumentFormat.HTML,
              List.of("SF1449", "SF33", "SF30"),
              List.of(),
              DataSize.ofKilobytes(2));

      assertThat(assembler.validate(bidPackage, requirements))
          .containsExactly(
              "Primary document is 4096 bytes, exceeding the portal limit of 2048 bytes",
              "Missing required form: SF1449",
              "Missing required form: SF30");
    }

    @Test
    void documentExactlyAtLimit_isAccepted() {
      var bidPackage =
          new BidDocumentPackage(
              null,
              new PrimaryDocument("doc-1.html", DocumentFormat.HTML, 1024, "AAAA"),
              Map.of(),
              List.of());
      var requirements =
          BidFixtures.requirements(
              DocumentFormat.HTML, List.of(), List.of(), DataSize.ofKilobytes(1));

      assertThat(assembler.validate(bidPackage, requirements)).isEmpty();
    }

    @Test
    void missingPrimaryDocument_isAViolation() {
      var bidPackage = new BidDocumentPackage(null, null, Map.of(), List.of());
      var requirements =
          BidFixtures.requirements(
              DocumentFormat.HTML, List.of(), List.of(), DataSize.ofKilobytes(1));

      assertThat(assembler.validate(bidPackage, requirements))
          .containsExactly("Primary document is missing");
    }
  }
}
