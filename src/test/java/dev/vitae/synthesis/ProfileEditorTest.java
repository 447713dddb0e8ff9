package dev.vitae.synthesis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import dev.vitae.extraction.CandidateSpan;
import dev.vitae.extraction.FieldType;
import dev.vitae.fixture.SpanBuilder;
import java.time.Clock;
import java.time.YearMonth;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ProfileEditorTest {

  private static final YearMonth AS_OF = YearMonth.of(2024, 6);

  private ProfileRecord record;

  private static CandidateSpan span(
      String id, FieldType field, String value, int section, int block, double confidence) {
    return new SpanBuilder()
        .id(id)
        .field(field)
        .value(value)
        .section(section)
        .block(block)
        .confidence(confidence)
        .build();
  }

  @BeforeEach
  void setUp() {
    record =
        new Synthesizer(0.5, Clock.systemUTC())
            .synthesize(
                List.of(
                    span("contact:0:0", FieldType.NAME, "Jane Doe", 0, 0, 0.3),
                    span("contact:0:1", FieldType.EMAIL, "a@x.com", 0, 1, 0.9),
                    span("contact:0:2", FieldType.EMAIL, "b@x.com", 0, 1, 0.6),
                    span("org-title:1:0", FieldType.ORG, "Acme", 1, 101, 0.7),
                    span("org-title:1:1", FieldType.TITLE, "Engineer", 1, 101, 0.8),
                    span("date-range:1:0", FieldType.DATE_START, "2020-01", 1, 101, 0.95),
                    span("date-range:1:1", FieldType.DATE_END, "2021-12", 1, 101, 0.95),
                    span("org-title:2:0", FieldType.INSTITUTION, "MIT", 2, 201, 0.99),
                    span("skill-term:3:0", FieldType.SKILL, "Java", 3, 301, 0.95)),
                AS_OF);
  }

  @Test
  void editedFieldBecomesManualAndVersionIncrements() {
    ProfileRecord edited = ProfileEditor.applyEdit(record, "contact.phone", "+1 (555) 000-1111");

    assertThat(edited.contact().phone()).isEqualTo(FieldValue.manual("+15550001111"));
    assertThat(edited.contact().phone().provenance()).isEqualTo(Provenance.MANUAL);
    assertThat(edited.version()).isEqualTo(2);
    assertThat(edited.contact().email()).isEqualTo(record.contact().email());
    assertThat(record.contact().phone()).isNull();
    assertThat(record.version()).isEqualTo(1);
  }

  @Test
  void typedEmailKeepsDotsInLocalPart() {
    ProfileRecord edited = ProfileEditor.applyEdit(record, "contact.email", " John.Doe@Acme.com ");

    assertThat(edited.contact().email()).isEqualTo(FieldValue.manual("john.doe@acme.com"));
  }

  @Test
  void editSupersedesNotesWithoutRemovingThem() {
    ProfileRecord edited = ProfileEditor.applyEdit(record, "contact.email", "B@X.com");

    assertThat(edited.conflicts()).hasSameSizeAs(record.conflicts());
    ConflictNote email =
        edited.conflicts().stream()
            .filter(note -> note.path().equals("contact.email"))
            .findFirst()
            .orElseThrow();
    assertThat(email.isSuperseded()).isTrue();
    assertThat(email.manualOverride()).isEqualTo(new ConflictNote.ManualOverride("b@x.com", 2));
    assertThat(email.chosenValue()).isEqualTo("a@x.com");
  }

  @Test
  void editingAnUnresolvedFieldClearsReviewFlag() {
    assertThat(record.needsReview()).isTrue();

    ProfileRecord edited = ProfileEditor.applyEdit(record, "Contact.Name", "Jane  Doe");

    assertThat(edited.contact().name().value()).isEqualTo("Jane Doe");
    assertThat(edited.needsReview()).isFalse();
    assertThat(edited.unresolvedConflicts()).isEmpty();
  }

  @Test
  void dateEditIsNormalizedAndExperienceRecomputed() {
    assertThat(record.experienceSummary().totalMonths()).isEqualTo(24);

    ProfileRecord edited = ProfileEditor.applyEdit(record, "experience[0].start", "Jan 2019");

    ExperienceEntry entry = edited.experience().get(0);
    assertThat(entry.start()).isEqualTo(FieldValue.manual("2019-01"));
    assertThat(entry.title()).isEqualTo(record.experience().get(0).title());
    assertThat(edited.experienceSummary().totalMonths()).isEqualTo(36);
  }

  @Test
  void entryConfidenceIsRecomputedAfterEdit() {
    ProfileRecord edited = ProfileEditor.applyEdit(record, "education[0].degree", "MSc");

    EducationEntry entry = edited.education().get(0);
    assertThat(entry.degree()).isEqualTo(FieldValue.manual("MSc"));
    assertThat(entry.confidence()).isEqualTo((0.99 + 1.0) / 2);
  }

  @Test
  void skillsEditReplacesTheWholeSet() {
    ProfileRecord edited = ProfileEditor.applyEdit(record, "skills", "Kafka, java , Java, ");

    assertThat(edited.skills())
        .extracting(SkillEntry::term, SkillEntry::confidence, SkillEntry::provenance)
        .containsExactly(
            tuple("Kafka", 1.0, Provenance.MANUAL), tuple("java", 1.0, Provenance.MANUAL));
  }

  @Test
  void rejectsEditThatWouldInvertTheRange() {
    assertThatThrownBy(() -> ProfileEditor.applyEdit(record, "experience[0].start", "2022-03"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("after it ends");
  }

  @Test
  void rejectsMalformedDate() {
    assertThatThrownBy(() -> ProfileEditor.applyEdit(record, "experience[0].end", "soon"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Malformed date");
  }

  @Test
  void rejectsIndexOutOfRange() {
    assertThatThrownBy(() -> ProfileEditor.applyEdit(record, "experience[3].title", "CTO"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("out of range");
  }

  @ParameterizedTest
  @ValueSource(strings = {"contact.address", "education[0].title", "experience.title", "age", " "})
  void rejectsUnknownPaths(String path) {
    assertThatThrownBy(() -> ProfileEditor.applyEdit(record, path, "value"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsBlankValue() {
    assertThatThrownBy(() -> ProfileEditor.applyEdit(record, "contact.name", "  "))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ProfileEditor.applyEdit(record, "skills", " , , "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void editsChainAndKeepEarlierOverrides() {
    ProfileRecord once = ProfileEditor.applyEdit(record, "contact.email", "c@x.com");
    ProfileRecord twice = ProfileEditor.applyEdit(once, "contact.phone", "555 000 1111");

    assertThat(twice.version()).isEqualTo(3);
    assertThat(twice.contact().email()).isEqualTo(FieldValue.manual("c@x.com"));
    assertThat(twice.conflicts())
        .filteredOn(ConflictNote::isSuperseded)
        .extracting(note -> note.manualOverride().version())
        .containsExactly(2);
  }
}
