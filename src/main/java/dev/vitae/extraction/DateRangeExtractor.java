package dev.vitae.extraction;

import dev.vitae.document.TextBlock;
import dev.vitae.segment.Section;
import dev.vitae.segment.SectionKind;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Extracts start and end dates from education and experience sections.
 *
 * <p>The first date range of a block yields a {@code DATE_START} and a {@code DATE_END} span.
 * Ranges whose ends both name a month (or end open, as in "Present") score {@link #PRECISE_RANGE};
 * ranges with a year-only end score {@link #YEAR_RANGE}. In education sections a block holding a
 * single date and no range is read as a graduation date.
 */
@Component
@Order(2)
public class DateRangeExtractor implements EntityExtractor {

  public static final String ID = "date-range";

  static final double PRECISE_RANGE = 0.95;
  static final double YEAR_RANGE = 0.75;
  static final double PRECISE_GRADUATION = 0.7;
  static final double YEAR_GRADUATION = 0.6;

  @Override
  public String id() {
    return ID;
  }

  @Override
  public Set<SectionKind> supportedKinds() {
    return EnumSet.of(SectionKind.EDUCATION, SectionKind.EXPERIENCE);
  }

  @Override
  public Set<FieldType> emittedFields() {
    return EnumSet.of(FieldType.DATE_START, FieldType.DATE_END);
  }

  @Override
  public List<CandidateSpan> extract(Section section) {
    SpanCollector spans = new SpanCollector(ID, section);
    for (TextBlock block : section.bodyBlocks()) {
      String line = block.text();
      if (!extractRange(spans, block, line) && section.kind() == SectionKind.EDUCATION) {
        extractGraduation(spans, block, line);
      }
    }
    return spans.spans();
  }

  private boolean extractRange(SpanCollector spans, TextBlock block, String line) {
    Matcher range = DatePatterns.RANGE.matcher(line);
    while (range.find()) {
      String rawStart = range.group(1);
      String rawEnd = range.group(2);
      Optional<String> start = DateNormalizer.normalize(rawStart, false);
      Optional<String> end = DateNormalizer.normalize(rawEnd, true);
      if (start.isEmpty() || end.isEmpty()) {
        continue;
      }
      boolean precise = isPrecise(rawStart, start.get()) && isPrecise(rawEnd, end.get());
      double confidence = precise ? PRECISE_RANGE : YEAR_RANGE;
      spans.add(FieldType.DATE_START, start.get(), block, confidence, rawStart);
      spans.add(FieldType.DATE_END, end.get(), block, confidence, rawEnd);
      return true;
    }
    return false;
  }

  private void extractGraduation(SpanCollector spans, TextBlock block, String line) {
    Matcher single = DatePatterns.SINGLE.matcher(line);
    String lastRaw = null;
    String lastValue = null;
    while (single.find()) {
      Optional<String> value = DateNormalizer.normalize(single.group(), true);
      if (value.isPresent()) {
        lastRaw = single.group();
        lastValue = value.get();
      }
    }
    if (lastValue != null) {
      double confidence =
          DateNormalizer.hasMonthPrecision(lastRaw) ? PRECISE_GRADUATION : YEAR_GRADUATION;
      spans.add(FieldType.DATE_END, lastValue, block, confidence, lastRaw);
    }
  }

  private static boolean isPrecise(String raw, String canonical) {
    return DateNormalizer.PRESENT.equals(canonical) || DateNormalizer.hasMonthPrecision(raw);
  }
}
