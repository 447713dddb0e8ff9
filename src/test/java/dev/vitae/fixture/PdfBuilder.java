package dev.vitae.fixture;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.jspecify.annotations.Nullable;

/**
 * Builds small PDFs in memory, one text line per call, top to bottom. {@link #newPage()} starts
 * the next page; a page that receives no lines stays blank, as a scanned page looks to a text
 * stripper.
 *
 * <pre>{@code
 * byte[] pdf = new PdfBuilder().bold("Jane Doe", 20).bold("EXPERIENCE", 12).text("Engineer", 12)
 *     .build();
 * }</pre>
 */
public final class PdfBuilder {

  private static final float LEFT_MARGIN = 50f;
  private static final float TOP = 780f;

  private record Line(String text, float size, boolean bold) {}

  private final List<List<Line>> pages = new ArrayList<>(List.of(new ArrayList<>()));
  private @Nullable String userPassword;

  public PdfBuilder text(String text, float size) {
    currentPage().add(new Line(text, size, false));
    return this;
  }

  public PdfBuilder bold(String text, float size) {
    currentPage().add(new Line(text, size, true));
    return this;
  }

  public PdfBuilder newPage() {
    pages.add(new ArrayList<>());
    return this;
  }

  private List<Line> currentPage() {
    return pages.get(pages.size() - 1);
  }

  /** Encrypts the document so it can only be opened with this password. */
  public PdfBuilder userPassword(String userPassword) {
    this.userPassword = userPassword;
    return this;
  }

  public byte[] build() {
    try (PDDocument document = new PDDocument()) {
      PDType1Font regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
      PDType1Font bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
      for (List<Line> lines : pages) {
        PDPage page = new PDPage(PDRectangle.A4);
        document.addPage(page);
        if (lines.isEmpty()) {
          continue;
        }
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
          float y = TOP;
          for (Line line : lines) {
            content.beginText();
            content.setFont(line.bold() ? bold : regular, line.size());
            content.newLineAtOffset(LEFT_MARGIN, y);
            content.showText(line.text());
            content.endText();
            y -= line.size() * 1.8f;
          }
        }
      }
      if (userPassword != null) {
        StandardProtectionPolicy policy =
            new StandardProtectionPolicy(
                "owner-" + userPassword, userPassword, new AccessPermission());
        policy.setEncryptionKeyLength(128);
        document.protect(policy);
      }
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      document.save(out);
      return out.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
