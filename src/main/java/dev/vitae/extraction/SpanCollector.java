package dev.vitae.extraction;

import dev.vitae.document.TextBlock;
import dev.vitae.segment.Section;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the spans one extractor emits for one section and assigns their ids in emission
 * order, so ids are stable across runs.
 */
final class SpanCollector {

  private final String extractorId;
  private final Section section;
  private final List<CandidateSpan> spans = new ArrayList<>();

  SpanCollector(String extractorId, Section section) {
    this.extractorId = extractorId;
    this.section = section;
  }

  /**
   * Adds a span unless its value is blank after normalization.
   *
   * @param field the field proposed
   * @param value the normalized value
   * @param block the block the value was read from
   * @param confidence match strength, clamped to [0, 1]
   * @param rawText the matched text before normalization
   */
  void add(FieldType field, String value, TextBlock block, double confidence, String rawText) {
    if (value == null || value.isBlank()) {
      return;
    }
    String id = "%s:%d:%d".formatted(extractorId, section.id(), spans.size());
    double bounded = Math.max(0.0, Math.min(1.0, confidence));
    spans.add(
        new CandidateSpan(
            id, field, value, section.id(), block.index(), bounded, extractorId, rawText.strip()));
  }

  int size() {
    return spans.size();
  }

  List<CandidateSpan> spans() {
    return List.copyOf(spans);
  }
}
