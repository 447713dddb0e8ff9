package dev.vitae.document;

import dev.vitae.document.UnreadableDocumentException.Reason;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * PDFBox-backed {@link DocumentLoader}.
 *
 * <p>Runs a position-aware {@link PDFTextStripper} over every page, collects each emitted text run
 * with its coordinates, font size and weight, and hands the runs to {@link BlockAssembler} to form
 * line blocks in reading order. Image-only pages emit no runs and therefore no blocks.
 */
@Component
public class PdfDocumentLoader implements DocumentLoader {

  private static final Logger log = LoggerFactory.getLogger(PdfDocumentLoader.class);

  private static final int BOLD_WEIGHT = 700;

  @Override
  public List<TextBlock> load(byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      throw new UnreadableDocumentException(Reason.NOT_A_PDF, "Document byte stream is empty");
    }
    try (PDDocument document = Loader.loadPDF(bytes)) {
      if (document.isEncrypted() && !document.getCurrentAccessPermission().canExtractContent()) {
        throw new UnreadableDocumentException(
            Reason.ENCRYPTED, "Document is encrypted and forbids text extraction");
      }
      FragmentCollector collector = new FragmentCollector();
      collector.setSortByPosition(true);
      collector.writeText(document, Writer.nullWriter());

      List<TextBlock> blocks = BlockAssembler.assemble(collector.fragments);
      if (blocks.isEmpty()) {
        throw new UnreadableDocumentException(
            Reason.NO_EXTRACTABLE_TEXT,
            "No extractable text across %d page(s)".formatted(document.getNumberOfPages()));
      }
      log.debug(
          "Loaded {} blocks from {} page(s)", blocks.size(), document.getNumberOfPages());
      return blocks;
    } catch (InvalidPasswordException e) {
      throw new UnreadableDocumentException(
          Reason.ENCRYPTED, "Document is password protected", e);
    } catch (IOException e) {
      throw new UnreadableDocumentException(
          Reason.NOT_A_PDF, "Byte stream is not a valid PDF: " + e.getMessage(), e);
    }
  }

  static boolean isBold(PDFont font) {
    if (font == null) {
      return false;
    }
    String name = font.getName();
    if (name != null) {
      String lower = name.toLowerCase(Locale.ROOT);
      if (lower.contains("bold") || lower.contains("black") || lower.contains("heavy")) {
        return true;
      }
    }
    PDFontDescriptor descriptor = font.getFontDescriptor();
    return descriptor != null
        && (descriptor.getFontWeight() >= BOLD_WEIGHT || descriptor.isForceBold());
  }

  /** Stripper that records every text run with its position instead of writing plain text. */
  private static final class FragmentCollector extends PDFTextStripper {

    private final List<TextFragment> fragments = new ArrayList<>();

    FragmentCollector() throws IOException {
      super();
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
      if (text.isBlank() || textPositions.isEmpty()) {
        return;
      }
      float left = Float.MAX_VALUE;
      float top = Float.MAX_VALUE;
      float right = -Float.MAX_VALUE;
      float bottom = -Float.MAX_VALUE;
      float fontSize = 0f;
      int boldGlyphs = 0;
      for (TextPosition position : textPositions) {
        float glyphTop = position.getYDirAdj() - position.getHeightDir();
        left = Math.min(left, position.getXDirAdj());
        top = Math.min(top, glyphTop);
        right = Math.max(right, position.getXDirAdj() + position.getWidthDirAdj());
        bottom = Math.max(bottom, position.getYDirAdj());
        fontSize = Math.max(fontSize, position.getFontSizeInPt());
        if (isBold(position.getFont())) {
          boldGlyphs++;
        }
      }
      boolean bold = boldGlyphs * 2 > textPositions.size();
      fragments.add(
          new TextFragment(
              getCurrentPageNo(), left, top, right - left, bottom - top, fontSize, bold, text));
    }
  }
}
