package dev.vitae.extraction;

import java.util.Comparator;
import java.util.Objects;

/**
 * One extractor's proposal for the value of a field. Never mutated after creation; owned by the
 * document's {@link CandidatePool} and referenced elsewhere by {@link #id()}.
 *
 * @param id identifier unique within the document's pool ({@code extractorId:sectionId:seq})
 * @param field the field proposed
 * @param value normalized value
 * @param sourceSection id of the section the span was found in
 * @param sourceBlock document index of the block the span was found in
 * @param confidence pattern-match strength in [0, 1]
 * @param extractorId id of the extractor that produced the span
 * @param rawText the text the value was read from, before normalization
 */
public record CandidateSpan(
    String id,
    FieldType field,
    String value,
    int sourceSection,
    int sourceBlock,
    double confidence,
    String extractorId,
    String rawText) {

  /** Document order: section, then block, then id. Used for every tie-break. */
  public static final Comparator<CandidateSpan> DOCUMENT_ORDER =
      Comparator.comparingInt(CandidateSpan::sourceSection)
          .thenComparingInt(CandidateSpan::sourceBlock)
          .thenComparing(CandidateSpan::id);

  public CandidateSpan {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(field, "field must not be null");
    Objects.requireNonNull(value, "value must not be null");
    Objects.requireNonNull(extractorId, "extractorId must not be null");
    Objects.requireNonNull(rawText, "rawText must not be null");
    if (value.isBlank()) {
      throw new IllegalArgumentException("value must not be blank");
    }
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
    }
  }
}
