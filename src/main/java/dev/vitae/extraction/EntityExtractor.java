package dev.vitae.extraction;

import dev.vitae.segment.Section;
import dev.vitae.segment.SectionKind;
import java.util.List;
import java.util.Set;

/**
 * Pluggable extraction strategy: consumes a section of a supported kind and proposes values for a
 * fixed set of fields.
 *
 * <p>Implementations are pure functions of the section. They must be thread-safe, must normalize
 * values before emitting them, and must never throw on malformed text; no match means an empty
 * result.
 */
public interface EntityExtractor {

  /** Stable identifier recorded on every span this extractor emits. */
  String id();

  /** Section kinds this extractor runs against. */
  Set<SectionKind> supportedKinds();

  /** Fields this extractor may emit. */
  Set<FieldType> emittedFields();

  /**
   * Extracts candidate spans from a section.
   *
   * @param section a section whose kind is in {@link #supportedKinds()}
   * @return spans in emission order, possibly empty
   */
  List<CandidateSpan> extract(Section section);

  default boolean supports(Section section) {
    return supportedKinds().contains(section.kind());
  }
}
