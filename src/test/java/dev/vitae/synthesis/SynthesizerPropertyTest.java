package dev.vitae.synthesis;

import static org.assertj.core.api.Assertions.assertThat;

import dev.vitae.extraction.CandidateSpan;
import dev.vitae.extraction.DateNormalizer;
import dev.vitae.extraction.FieldType;
import java.time.Clock;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Properties of {@link Synthesizer} that must hold for any candidate pool: the record does not
 * depend on span arrival order, every resolved value is backed by a candidate or a note, and
 * resolved dates never form an inverted range.
 */
class SynthesizerPropertyTest {

  private static final YearMonth AS_OF = YearMonth.of(2024, 6);

  private static final Map<FieldType, List<String>> VALUES =
      Map.ofEntries(
          Map.entry(FieldType.NAME, List.of("Jane Doe", "Janet Doe")),
          Map.entry(FieldType.EMAIL, List.of("jane@x.com", "J.ANE@X.COM", "jd@y.org")),
          Map.entry(FieldType.PHONE, List.of("+1 555 123 4567", "+44 20 7946 0958")),
          Map.entry(FieldType.ORG, List.of("Acme", "Initech", "Google")),
          Map.entry(FieldType.TITLE, List.of("Engineer", "Analyst")),
          Map.entry(FieldType.DESCRIPTION, List.of("Built things", "Ran things")),
          Map.entry(FieldType.INSTITUTION, List.of("Stanford University", "MIT")),
          Map.entry(FieldType.DEGREE, List.of("BSc", "MBA")),
          Map.entry(FieldType.DATE_START, List.of("2015-01", "2018-06", "2021-03")),
          Map.entry(FieldType.DATE_END, List.of("2017-12", "2020-01", "PRESENT")),
          Map.entry(FieldType.SKILL, List.of("Java", "java", "Kafka", "Go")));

  private final Synthesizer synthesizer = new Synthesizer(0.5, Clock.systemUTC());

  @Provide
  Arbitrary<List<CandidateSpan>> pools() {
    Arbitrary<FieldType> fields = Arbitraries.of(VALUES.keySet());
    Arbitrary<SpanShape> shapes =
        Combinators.combine(
                fields,
                Arbitraries.integers().between(0, 2),
                Arbitraries.integers().between(0, 3),
                Arbitraries.integers().between(0, 10),
                Arbitraries.doubles().between(0.1, 1.0).ofScale(2))
            .as(SpanShape::new);
    return shapes
        .list()
        .ofMaxSize(25)
        .map(
            list -> {
              List<CandidateSpan> spans = new ArrayList<>();
              for (int i = 0; i < list.size(); i++) {
                spans.add(list.get(i).toSpan(i));
              }
              return spans;
            });
  }

  private record SpanShape(
      FieldType field, int valueIndex, int section, int blockOffset, double confidence) {

    CandidateSpan toSpan(int sequence) {
      List<String> values = VALUES.get(field);
      String value = values.get(valueIndex % values.size());
      int block = section * 100 + blockOffset;
      return new CandidateSpan(
          "gen:%d:%d".formatted(section, sequence),
          field,
          value,
          section,
          block,
          confidence,
          "gen",
          value);
    }
  }

  @Property
  void recordIgnoresArrivalOrder(@ForAll("pools") List<CandidateSpan> spans, @ForAll Random rnd) {
    ProfileRecord expected = synthesizer.synthesize(spans, AS_OF);
    List<CandidateSpan> shuffled = new ArrayList<>(spans);
    Collections.shuffle(shuffled, rnd);

    assertThat(synthesizer.synthesize(shuffled, AS_OF)).isEqualTo(expected);
  }

  @Property
  void notesOnlyReferenceKnownCandidates(@ForAll("pools") List<CandidateSpan> spans) {
    Set<String> ids = spans.stream().map(CandidateSpan::id).collect(Collectors.toSet());

    ProfileRecord record = synthesizer.synthesize(spans, AS_OF);

    for (ConflictNote note : record.conflicts()) {
      assertThat(ids).containsAll(note.candidateIds());
      if (note.chosenId() != null) {
        assertThat(note.candidateIds()).contains(note.chosenId());
      }
    }
  }

  @Property
  void resolvedRangesAreNeverInverted(@ForAll("pools") List<CandidateSpan> spans) {
    ProfileRecord record = synthesizer.synthesize(spans, AS_OF);

    List<ProfileEntry> entries = new ArrayList<>(record.experience());
    entries.addAll(record.education());
    for (ProfileEntry entry : entries) {
      if (entry.start() != null && entry.end() != null) {
        assertThat(DateNormalizer.CHRONOLOGICAL.compare(entry.start().value(), entry.end().value()))
            .isLessThanOrEqualTo(0);
      }
    }
  }

  @Property
  void needsReviewMatchesUnresolvedNotes(@ForAll("pools") List<CandidateSpan> spans) {
    ProfileRecord record = synthesizer.synthesize(spans, AS_OF);

    assertThat(record.needsReview()).isEqualTo(!record.unresolvedConflicts().isEmpty());
    assertThat(record.version()).isEqualTo(1);
  }
}
