package dev.vitae.synthesis;

import dev.vitae.extraction.CandidateSpan;
import dev.vitae.extraction.DateNormalizer;
import dev.vitae.extraction.FieldType;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Groups the spans of education or experience sections into discrete entries.
 *
 * <p>Within a section, blocks are read in order and a new entry starts at a block that carries a
 * headline field or a start date the current entry already holds from an earlier block. Across
 * sections, the last entry of a section and the first entry of the next section merge when their
 * date ranges overlap, or when the first has no dates and the second has no headline.
 */
final class EntryClusterer {

  private final Set<FieldType> headlineFields;
  private final YearMonth asOf;

  EntryClusterer(Set<FieldType> headlineFields, YearMonth asOf) {
    this.headlineFields = EnumSet.copyOf(headlineFields);
    this.asOf = asOf;
  }

  static EntryClusterer forEducation(YearMonth asOf) {
    return new EntryClusterer(EnumSet.of(FieldType.INSTITUTION, FieldType.DEGREE), asOf);
  }

  static EntryClusterer forExperience(YearMonth asOf) {
    return new EntryClusterer(EnumSet.of(FieldType.ORG, FieldType.TITLE), asOf);
  }

  /** Spans of one entry, in document order. */
  record Draft(List<CandidateSpan> spans) {

    Draft {
      spans = spans.stream().sorted(CandidateSpan.DOCUMENT_ORDER).toList();
    }

    List<CandidateSpan> forField(FieldType field) {
      return spans.stream().filter(span -> span.field() == field).toList();
    }

    boolean holds(FieldType field) {
      return spans.stream().anyMatch(span -> span.field() == field);
    }

    int firstSection() {
      return spans.get(0).sourceSection();
    }

    int lastSection() {
      return spans.get(spans.size() - 1).sourceSection();
    }

    Draft merge(Draft other) {
      List<CandidateSpan> all = new ArrayList<>(spans);
      all.addAll(other.spans);
      return new Draft(all);
    }
  }

  /**
   * Clusters spans into entries.
   *
   * @param spans spans of entry fields, from any number of sections
   * @return entries in document order
   */
  List<Draft> cluster(Collection<CandidateSpan> spans) {
    Map<Integer, Map<Integer, List<CandidateSpan>>> bySectionAndBlock = new TreeMap<>();
    spans.stream()
        .sorted(CandidateSpan.DOCUMENT_ORDER)
        .forEach(
            span ->
                bySectionAndBlock
                    .computeIfAbsent(span.sourceSection(), key -> new TreeMap<>())
                    .computeIfAbsent(span.sourceBlock(), key -> new ArrayList<>())
                    .add(span));

    List<Draft> drafts = new ArrayList<>();
    for (Map<Integer, List<CandidateSpan>> blocks : bySectionAndBlock.values()) {
      List<Draft> sectionDrafts = clusterSection(blocks);
      if (!drafts.isEmpty() && !sectionDrafts.isEmpty()) {
        Draft previous = drafts.get(drafts.size() - 1);
        Draft next = sectionDrafts.get(0);
        if (next.firstSection() - previous.lastSection() == 1 && belongTogether(previous, next)) {
          drafts.set(drafts.size() - 1, previous.merge(next));
          sectionDrafts = sectionDrafts.subList(1, sectionDrafts.size());
        }
      }
      drafts.addAll(sectionDrafts);
    }
    return drafts;
  }

  private List<Draft> clusterSection(Map<Integer, List<CandidateSpan>> blocks) {
    List<Draft> drafts = new ArrayList<>();
    List<CandidateSpan> current = new ArrayList<>();
    Set<FieldType> held = EnumSet.noneOf(FieldType.class);
    for (List<CandidateSpan> blockSpans : blocks.values()) {
      boolean repeats =
          blockSpans.stream()
              .map(CandidateSpan::field)
              .anyMatch(field -> isBoundaryField(field) && held.contains(field));
      if (repeats) {
        drafts.add(new Draft(current));
        current = new ArrayList<>();
        held.clear();
      }
      current.addAll(blockSpans);
      blockSpans.forEach(span -> held.add(span.field()));
    }
    if (!current.isEmpty()) {
      drafts.add(new Draft(current));
    }
    return drafts;
  }

  private boolean isBoundaryField(FieldType field) {
    return headlineFields.contains(field) || field == FieldType.DATE_START;
  }

  private boolean belongTogether(Draft previous, Draft next) {
    Optional<Range> previousRange = range(previous);
    Optional<Range> nextRange = range(next);
    if (previousRange.isPresent() && nextRange.isPresent()) {
      return previousRange.get().overlaps(nextRange.get());
    }
    boolean nextHasHeadline = headlineFields.stream().anyMatch(next::holds);
    return previousRange.isEmpty() && nextRange.isPresent() && !nextHasHeadline;
  }

  /** The strongest start and end of a draft, as months. */
  private Optional<Range> range(Draft draft) {
    Optional<YearMonth> start = strongest(draft.forField(FieldType.DATE_START));
    if (start.isEmpty()) {
      return Optional.empty();
    }
    YearMonth end = strongest(draft.forField(FieldType.DATE_END)).orElse(start.get());
    return Optional.of(
        end.isBefore(start.get()) ? new Range(end, start.get()) : new Range(start.get(), end));
  }

  private Optional<YearMonth> strongest(List<CandidateSpan> spans) {
    return spans.stream()
        .max(Comparator.comparingDouble(CandidateSpan::confidence))
        .flatMap(span -> DateNormalizer.toYearMonth(span.value(), asOf));
  }

  private record Range(YearMonth start, YearMonth end) {

    boolean overlaps(Range other) {
      return !start.isAfter(other.end) && !other.start.isAfter(end);
    }
  }
}
