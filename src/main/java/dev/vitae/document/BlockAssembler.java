package dev.vitae.document;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Groups positioned text fragments into line blocks in reading order.
 *
 * <p>Fragments on the same page whose vertical centres lie within half a line height of each other
 * form one line band; inside a band fragments are ordered left to right and joined by a single
 * space. Bands are ordered page by page, top to bottom. Each resulting line becomes one {@link
 * TextBlock} whose style is taken from the fragments carrying most of its characters.
 *
 * <p>Pure and stateless.
 */
final class BlockAssembler {

  private static final Comparator<TextFragment> READING_ORDER =
      Comparator.comparingInt(TextFragment::page)
          .thenComparingDouble(TextFragment::centerY)
          .thenComparingDouble(TextFragment::x);

  private BlockAssembler() {}

  static List<TextBlock> assemble(List<TextFragment> fragments) {
    List<TextFragment> visible =
        fragments.stream().filter(f -> !f.text().isBlank()).sorted(READING_ORDER).toList();
    if (visible.isEmpty()) {
      return List.of();
    }
    double medianSize = medianFontSize(visible);

    List<List<TextFragment>> lines = new ArrayList<>();
    List<TextFragment> current = new ArrayList<>();
    for (TextFragment fragment : visible) {
      if (!current.isEmpty() && !sameLine(current, fragment)) {
        lines.add(current);
        current = new ArrayList<>();
      }
      current.add(fragment);
    }
    lines.add(current);

    List<TextBlock> blocks = new ArrayList<>(lines.size());
    for (List<TextFragment> line : lines) {
      blocks.add(toBlock(blocks.size(), line, medianSize));
    }
    return List.copyOf(blocks);
  }

  private static boolean sameLine(List<TextFragment> line, TextFragment candidate) {
    TextFragment first = line.get(0);
    if (first.page() != candidate.page()) {
      return false;
    }
    float lineCenter = (float) line.stream().mapToDouble(TextFragment::centerY).average().orElse(0);
    float lineHeight = (float) line.stream().mapToDouble(TextFragment::height).max().orElse(0);
    float tolerance = Math.max(lineHeight, candidate.height()) / 2f;
    return Math.abs(candidate.centerY() - lineCenter) <= tolerance;
  }

  private static TextBlock toBlock(int index, List<TextFragment> line, double medianSize) {
    List<TextFragment> ordered =
        line.stream().sorted(Comparator.comparingDouble(TextFragment::x)).toList();

    StringBuilder text = new StringBuilder();
    BoundingBox bbox = ordered.get(0).bbox();
    int boldChars = 0;
    int totalChars = 0;
    TextFragment dominant = ordered.get(0);
    for (TextFragment fragment : ordered) {
      String fragmentText = fragment.text().strip();
      if (fragmentText.isEmpty()) {
        continue;
      }
      if (text.length() > 0) {
        text.append(' ');
      }
      text.append(fragmentText);
      bbox = bbox.union(fragment.bbox());
      totalChars += fragmentText.length();
      if (fragment.bold()) {
        boldChars += fragmentText.length();
      }
      if (fragmentText.length() > dominant.text().strip().length()) {
        dominant = fragment;
      }
    }

    boolean bold = boldChars * 2 > totalChars;
    FontSizeBucket bucket = FontSizeBucket.classify(dominant.fontSize(), medianSize);
    String normalizedText = text.toString().replaceAll("\\s+", " ").strip();
    return new TextBlock(
        index, normalizedText, dominant.page(), bbox, new BlockStyle(bucket, bold));
  }

  /** Median font size weighted by character count, so a long body dominates a short title. */
  static double medianFontSize(List<TextFragment> fragments) {
    List<TextFragment> bySize =
        fragments.stream().sorted(Comparator.comparingDouble(TextFragment::fontSize)).toList();
    long totalChars = bySize.stream().mapToLong(f -> f.text().strip().length()).sum();
    if (totalChars == 0) {
      return 0;
    }
    long seen = 0;
    for (TextFragment fragment : bySize) {
      seen += fragment.text().strip().length();
      if (seen * 2 >= totalChars) {
        return fragment.fontSize();
      }
    }
    return bySize.get(bySize.size() - 1).fontSize();
  }
}
