package dev.vitae.synthesis;

import dev.vitae.extraction.CandidatePool;
import dev.vitae.extraction.CandidateSpan;
import dev.vitae.extraction.DateNormalizer;
import dev.vitae.extraction.FieldNormalizer;
import dev.vitae.extraction.FieldType;
import java.time.Clock;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges a document's candidate spans into one {@link ProfileRecord}.
 *
 * <p>Contact fields are resolved across the whole document; education and experience spans are
 * first clustered into entries and resolved per entry; each distinct skill is resolved on its own.
 * Synthesis never fails: weak or contradictory evidence yields empty fields and conflict notes.
 * The result depends only on the spans and the as-of month, never on the order the spans arrive
 * in.
 */
public class Synthesizer {

  private static final Logger log = LoggerFactory.getLogger(Synthesizer.class);

  /** Confidence multiplier applied to both dates of a range that had to be swapped. */
  static final double SWAP_PENALTY = 0.8;

  private static final Set<FieldType> EDUCATION_ONLY =
      EnumSet.of(FieldType.INSTITUTION, FieldType.DEGREE);
  private static final Set<FieldType> EXPERIENCE_ONLY =
      EnumSet.of(FieldType.ORG, FieldType.TITLE, FieldType.DESCRIPTION);
  private static final Map<FieldType, String> ATTRIBUTES =
      Map.of(
          FieldType.NAME, "name",
          FieldType.EMAIL, "email",
          FieldType.PHONE, "phone",
          FieldType.LINKEDIN, "linkedin",
          FieldType.WEBSITE, "website",
          FieldType.INSTITUTION, "institution",
          FieldType.DEGREE, "degree",
          FieldType.ORG, "organization",
          FieldType.TITLE, "title",
          FieldType.DESCRIPTION, "description");

  private final FieldResolver resolver;
  private final Clock clock;

  public Synthesizer(double resolutionThreshold, Clock clock) {
    if (resolutionThreshold <= 0.0 || resolutionThreshold > 1.0) {
      throw new IllegalArgumentException(
          "resolutionThreshold must be in (0, 1], got: " + resolutionThreshold);
    }
    this.resolver = new FieldResolver(resolutionThreshold);
    this.clock = clock;
  }

  public ProfileRecord synthesize(CandidatePool pool) {
    return synthesize(pool.spans());
  }

  /** Synthesizes against the current month of the configured clock. */
  public ProfileRecord synthesize(Collection<CandidateSpan> spans) {
    return synthesize(spans, YearMonth.now(clock));
  }

  /**
   * Synthesizes a profile.
   *
   * @param spans every candidate span of one document
   * @param asOf the month {@code PRESENT} resolves to when computing experience
   * @return the profile, version 1
   */
  public ProfileRecord synthesize(Collection<CandidateSpan> spans, YearMonth asOf) {
    List<CandidateSpan> ordered = spans.stream().sorted(CandidateSpan.DOCUMENT_ORDER).toList();
    List<ConflictNote> notes = new ArrayList<>();

    ContactInfo contact = ContactInfo.EMPTY;
    for (FieldType field : FieldType.CONTACT_FIELDS) {
      FieldResolver.Outcome outcome =
          resolver.resolve(field, "contact." + attribute(field), ofField(ordered, field));
      contact = contact.with(field, outcome.value());
      addNote(notes, outcome.note());
    }

    Map<Integer, Role> roles = sectionRoles(ordered);
    List<CandidateSpan> educationSpans = entrySpans(ordered, roles, Role.EDUCATION);
    List<CandidateSpan> experienceSpans = entrySpans(ordered, roles, Role.EXPERIENCE);

    List<EducationEntry> education = new ArrayList<>();
    for (Resolved resolved :
        order(
            EntryClusterer.forEducation(asOf).cluster(educationSpans).stream()
                .map(this::resolveEducation)
                .toList())) {
      String prefix = "education[" + education.size() + "].";
      education.add((EducationEntry) resolved.entry());
      resolved.notes().forEach(note -> notes.add(note.withPath(prefix + note.path())));
    }

    List<ExperienceEntry> experience = new ArrayList<>();
    for (Resolved resolved :
        order(
            EntryClusterer.forExperience(asOf).cluster(experienceSpans).stream()
                .map(this::resolveExperience)
                .toList())) {
      String prefix = "experience[" + experience.size() + "].";
      experience.add((ExperienceEntry) resolved.entry());
      resolved.notes().forEach(note -> notes.add(note.withPath(prefix + note.path())));
    }

    List<SkillEntry> skills = resolveSkills(ofField(ordered, FieldType.SKILL), notes);
    ExperienceSummary summary = ExperienceCalculator.summarize(experience, asOf);
    boolean needsReview = notes.stream().anyMatch(ConflictNote::needsReview);

    ProfileRecord record =
        new ProfileRecord(
            contact, education, experience, skills, notes, needsReview, summary, asOf, 1);
    log.info(
        "Synthesized profile from {} candidates: {} education, {} experience, {} skills, "
            + "{} conflict notes",
        ordered.size(),
        education.size(),
        experience.size(),
        skills.size(),
        notes.size());
    if (needsReview) {
      log.warn(
          "Profile needs review: {} unresolved fields",
          notes.stream().filter(ConflictNote::needsReview).count());
    }
    return record;
  }

  /** Attribute name of a field inside its entry, as used in edit paths. */
  static String attribute(FieldType field) {
    if (field == FieldType.DATE_START) {
      return "start";
    }
    if (field == FieldType.DATE_END) {
      return "end";
    }
    return ATTRIBUTES.get(field);
  }

  private enum Role {
    EDUCATION,
    EXPERIENCE
  }

  private record Resolved(ProfileEntry entry, List<ConflictNote> notes, CandidateSpan first) {}

  /**
   * Sections with institution or degree spans hold education, sections with organization, title
   * or description spans hold experience; a section with dates only takes the role of the closest
   * preceding section, or experience when there is none.
   */
  private static Map<Integer, Role> sectionRoles(List<CandidateSpan> ordered) {
    Map<Integer, Role> roles = new TreeMap<>();
    Map<Integer, List<CandidateSpan>> bySection =
        ordered.stream()
            .collect(
                Collectors.groupingBy(
                    CandidateSpan::sourceSection, TreeMap::new, Collectors.toList()));
    Role previous = Role.EXPERIENCE;
    for (Map.Entry<Integer, List<CandidateSpan>> section : bySection.entrySet()) {
      List<CandidateSpan> sectionSpans = section.getValue();
      boolean education = sectionSpans.stream().anyMatch(s -> EDUCATION_ONLY.contains(s.field()));
      boolean experience =
          sectionSpans.stream().anyMatch(s -> EXPERIENCE_ONLY.contains(s.field()));
      boolean dated = sectionSpans.stream().anyMatch(s -> s.field().isDate());
      Role role = education ? Role.EDUCATION : experience ? Role.EXPERIENCE : previous;
      if (education || experience || dated) {
        roles.put(section.getKey(), role);
        previous = role;
      }
    }
    return roles;
  }

  private static List<CandidateSpan> entrySpans(
      List<CandidateSpan> ordered, Map<Integer, Role> roles, Role role) {
    Set<FieldType> fields =
        role == Role.EDUCATION ? FieldType.EDUCATION_FIELDS : FieldType.EXPERIENCE_FIELDS;
    return ordered.stream()
        .filter(span -> fields.contains(span.field()))
        .filter(span -> roles.get(span.sourceSection()) == role)
        .toList();
  }

  private Resolved resolveEducation(EntryClusterer.Draft draft) {
    List<ConflictNote> notes = new ArrayList<>();
    FieldValue institution = resolveField(draft, FieldType.INSTITUTION, notes);
    FieldValue degree = resolveField(draft, FieldType.DEGREE, notes);
    FieldValue[] dates = resolveDates(draft, notes);
    EducationEntry entry =
        new EducationEntry(
            institution,
            degree,
            dates[0],
            dates[1],
            ProfileEntry.meanConfidence(institution, degree, dates[0], dates[1]));
    return new Resolved(entry, notes, draft.spans().get(0));
  }

  private Resolved resolveExperience(EntryClusterer.Draft draft) {
    List<ConflictNote> notes = new ArrayList<>();
    FieldValue organization = resolveField(draft, FieldType.ORG, notes);
    FieldValue title = resolveField(draft, FieldType.TITLE, notes);
    FieldValue[] dates = resolveDates(draft, notes);
    FieldValue description = description(draft.forField(FieldType.DESCRIPTION));
    ExperienceEntry entry =
        new ExperienceEntry(
            organization,
            title,
            dates[0],
            dates[1],
            description,
            ProfileEntry.meanConfidence(organization, title, dates[0], dates[1], description));
    return new Resolved(entry, notes, draft.spans().get(0));
  }

  private @Nullable FieldValue resolveField(
      EntryClusterer.Draft draft, FieldType field, List<ConflictNote> notes) {
    FieldResolver.Outcome outcome =
        resolver.resolve(field, attribute(field), draft.forField(field));
    addNote(notes, outcome.note());
    return outcome.value();
  }

  /**
   * Resolves start and end, then repairs an inverted range: the dates are swapped at a confidence
   * penalty when the penalized mean confidence still reaches the threshold, otherwise both are
   * left unresolved.
   */
  private FieldValue[] resolveDates(EntryClusterer.Draft draft, List<ConflictNote> notes) {
    List<CandidateSpan> startSpans = draft.forField(FieldType.DATE_START);
    List<CandidateSpan> endSpans = draft.forField(FieldType.DATE_END);
    FieldResolver.Outcome start = resolver.resolve(FieldType.DATE_START, "start", startSpans);
    FieldResolver.Outcome end = resolver.resolve(FieldType.DATE_END, "end", endSpans);
    addNote(notes, start.note());
    addNote(notes, end.note());
    FieldValue startValue = start.value();
    FieldValue endValue = end.value();
    if (startValue == null
        || endValue == null
        || DateNormalizer.CHRONOLOGICAL.compare(startValue.value(), endValue.value()) <= 0) {
      return new FieldValue[] {startValue, endValue};
    }

    List<String> ids =
        Stream.concat(startSpans.stream(), endSpans.stream())
            .sorted(CandidateSpan.DOCUMENT_ORDER)
            .map(CandidateSpan::id)
            .toList();
    double penalized = (startValue.confidence() + endValue.confidence()) / 2 * SWAP_PENALTY;
    if (penalized >= resolver.threshold()) {
      FieldValue swappedStart =
          FieldValue.extracted(endValue.value(), endValue.confidence() * SWAP_PENALTY);
      FieldValue swappedEnd =
          FieldValue.extracted(startValue.value(), startValue.confidence() * SWAP_PENALTY);
      notes.add(swapNote(FieldType.DATE_START, "start", ids, end.chosen(), swappedStart));
      notes.add(swapNote(FieldType.DATE_END, "end", ids, start.chosen(), swappedEnd));
      log.debug(
          "Swapped inverted date range {} > {}", startValue.value(), endValue.value());
      return new FieldValue[] {swappedStart, swappedEnd};
    }
    notes.add(unresolvedDate(FieldType.DATE_START, "start", ids, penalized));
    notes.add(unresolvedDate(FieldType.DATE_END, "end", ids, penalized));
    return new FieldValue[] {null, null};
  }

  private static ConflictNote swapNote(
      FieldType field,
      String attribute,
      List<String> ids,
      @Nullable CandidateSpan chosen,
      FieldValue value) {
    return new ConflictNote(
        field,
        attribute,
        ids,
        ConflictNote.Resolution.AUTO_RESOLVED,
        chosen == null ? null : chosen.id(),
        value.value(),
        value.confidence(),
        null);
  }

  private static ConflictNote unresolvedDate(
      FieldType field, String attribute, List<String> ids, double confidence) {
    return new ConflictNote(
        field,
        attribute,
        ids,
        ConflictNote.Resolution.LEFT_UNRESOLVED,
        null,
        null,
        confidence,
        null);
  }

  /** Description lines in document order, without repeats; confidence is their mean. */
  private static @Nullable FieldValue description(List<CandidateSpan> spans) {
    if (spans.isEmpty()) {
      return null;
    }
    Map<String, String> lines = new LinkedHashMap<>();
    double sum = 0.0;
    for (CandidateSpan span : spans) {
      lines.putIfAbsent(
          FieldNormalizer.comparisonKey(FieldType.DESCRIPTION, span.value()),
          FieldNormalizer.canonical(FieldType.DESCRIPTION, span.value()));
      sum += span.confidence();
    }
    String text = String.join("\n", lines.values()).strip();
    return text.isEmpty() ? null : FieldValue.extracted(text, sum / spans.size());
  }

  /** Most recent first by start date (end date when there is no start); undated entries last. */
  private static List<Resolved> order(List<Resolved> entries) {
    Comparator<Resolved> byDocument =
        Comparator.comparing(Resolved::first, CandidateSpan.DOCUMENT_ORDER);
    List<Resolved> dated = new ArrayList<>();
    List<Resolved> undated = new ArrayList<>();
    for (Resolved entry : entries) {
      (sortKey(entry.entry()) == null ? undated : dated).add(entry);
    }
    dated.sort(
        Comparator.comparing(
                (Resolved entry) -> sortKey(entry.entry()), DateNormalizer.CHRONOLOGICAL.reversed())
            .thenComparing(byDocument));
    undated.sort(byDocument);
    List<Resolved> ordered = new ArrayList<>(dated);
    ordered.addAll(undated);
    return ordered;
  }

  private static @Nullable String sortKey(ProfileEntry entry) {
    if (entry.start() != null) {
      return entry.start().value();
    }
    return entry.end() == null ? null : entry.end().value();
  }

  private List<SkillEntry> resolveSkills(List<CandidateSpan> spans, List<ConflictNote> notes) {
    Map<String, List<CandidateSpan>> byTerm = new LinkedHashMap<>();
    for (CandidateSpan span : spans) {
      byTerm
          .computeIfAbsent(
              FieldNormalizer.comparisonKey(FieldType.SKILL, span.value()),
              key -> new ArrayList<>())
          .add(span);
    }
    List<SkillEntry> skills = new ArrayList<>();
    for (List<CandidateSpan> termSpans : byTerm.values()) {
      FieldResolver.Outcome outcome = resolver.resolve(FieldType.SKILL, "skills", termSpans);
      addNote(notes, outcome.note());
      if (outcome.value() != null) {
        skills.add(
            new SkillEntry(
                outcome.value().value(), outcome.value().confidence(), Provenance.EXTRACTED));
      }
    }
    return skills;
  }

  private static List<CandidateSpan> ofField(List<CandidateSpan> ordered, FieldType field) {
    return ordered.stream().filter(span -> span.field() == field).toList();
  }

  private static void addNote(List<ConflictNote> notes, @Nullable ConflictNote note) {
    if (note != null) {
      notes.add(note);
    }
  }
}
