package dev.vitae.synthesis;

import dev.vitae.extraction.DateNormalizer;
import dev.vitae.extraction.FieldNormalizer;
import dev.vitae.extraction.FieldType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies manual edits to a synthesized profile.
 *
 * <p>Edits are pure: the input record is never modified. The edited field gets confidence 1.0 and
 * provenance {@code manual}; every other field is carried over unchanged. Conflict notes about the
 * edited field are superseded, never removed, and the record version is incremented.
 *
 * <p>Supported paths: {@code contact.name}, {@code contact.email}, {@code contact.phone}, {@code
 * contact.linkedin}, {@code contact.website}, {@code experience[i].organization|title|start|end|
 * description}, {@code education[i].institution|degree|start|end}, and {@code skills}, whose value
 * is a comma-separated list replacing the whole skill set.
 */
public final class ProfileEditor {

  private static final Pattern CONTACT_PATH =
      Pattern.compile("contact\\.(name|email|phone|linkedin|website)");
  private static final Pattern ENTRY_PATH =
      Pattern.compile("(experience|education)\\[(\\d+)]\\.([a-z]+)");
  private static final String SKILLS_PATH = "skills";

  private static final Map<String, FieldType> CONTACT_FIELDS =
      Map.of(
          "name", FieldType.NAME,
          "email", FieldType.EMAIL,
          "phone", FieldType.PHONE,
          "linkedin", FieldType.LINKEDIN,
          "website", FieldType.WEBSITE);
  private static final Map<String, FieldType> EXPERIENCE_FIELDS =
      Map.of(
          "organization", FieldType.ORG,
          "title", FieldType.TITLE,
          "start", FieldType.DATE_START,
          "end", FieldType.DATE_END,
          "description", FieldType.DESCRIPTION);
  private static final Map<String, FieldType> EDUCATION_FIELDS =
      Map.of(
          "institution", FieldType.INSTITUTION,
          "degree", FieldType.DEGREE,
          "start", FieldType.DATE_START,
          "end", FieldType.DATE_END);

  private ProfileEditor() {
    // static utility
  }

  /**
   * Returns a copy of the record with one field replaced by a manual value.
   *
   * @param record the record to edit
   * @param path the field to edit, e.g. {@code experience[0].title}
   * @param value the new value as entered
   * @return the edited record, with version incremented
   * @throws IllegalArgumentException if the path is unknown, the index is out of range, the value
   *     is blank, a date cannot be parsed, or a date edit would invert the entry's range
   */
  public static ProfileRecord applyEdit(ProfileRecord record, String path, String value) {
    if (path == null || path.isBlank()) {
      throw new IllegalArgumentException("path must not be blank");
    }
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("value must not be blank for " + path);
    }
    String normalizedPath = path.strip().toLowerCase(Locale.ROOT);
    int version = record.version() + 1;

    if (SKILLS_PATH.equals(normalizedPath)) {
      return editSkills(record, value, version);
    }
    Matcher contact = CONTACT_PATH.matcher(normalizedPath);
    if (contact.matches()) {
      FieldType field = CONTACT_FIELDS.get(contact.group(1));
      FieldValue edited = FieldValue.manual(canonical(field, value, path));
      return rebuild(
          record,
          record.contact().with(field, edited),
          record.education(),
          record.experience(),
          record.skills(),
          normalizedPath,
          edited.value(),
          version);
    }
    Matcher entry = ENTRY_PATH.matcher(normalizedPath);
    if (entry.matches()) {
      boolean experience = entry.group(1).equals("experience");
      int index = Integer.parseInt(entry.group(2));
      Map<String, FieldType> fields = experience ? EXPERIENCE_FIELDS : EDUCATION_FIELDS;
      FieldType field = fields.get(entry.group(3));
      if (field == null) {
        throw new IllegalArgumentException("Unknown field in path: " + path);
      }
      List<? extends ProfileEntry> entries =
          experience ? record.experience() : record.education();
      if (index >= entries.size()) {
        throw new IllegalArgumentException(
            "Index %d out of range for %s (size %d)"
                .formatted(index, entry.group(1), entries.size()));
      }
      FieldValue edited = FieldValue.manual(canonical(field, value, path));
      ProfileEntry updated = entries.get(index).with(field, edited);
      checkRange(updated, path);
      if (experience) {
        List<ExperienceEntry> experienceEntries = new ArrayList<>(record.experience());
        experienceEntries.set(index, (ExperienceEntry) updated);
        return rebuild(
            record,
            record.contact(),
            record.education(),
            experienceEntries,
            record.skills(),
            normalizedPath,
            edited.value(),
            version);
      }
      List<EducationEntry> educationEntries = new ArrayList<>(record.education());
      educationEntries.set(index, (EducationEntry) updated);
      return rebuild(
          record,
          record.contact(),
          educationEntries,
          record.experience(),
          record.skills(),
          normalizedPath,
          edited.value(),
          version);
    }
    throw new IllegalArgumentException("Unknown field path: " + path);
  }

  private static ProfileRecord editSkills(ProfileRecord record, String value, int version) {
    Map<String, SkillEntry> skills = new LinkedHashMap<>();
    for (String item : value.split(",")) {
      String term = FieldNormalizer.canonical(FieldType.SKILL, item);
      if (!term.isEmpty()) {
        skills.putIfAbsent(
            FieldNormalizer.comparisonKey(FieldType.SKILL, term),
            new SkillEntry(term, 1.0, Provenance.MANUAL));
      }
    }
    if (skills.isEmpty()) {
      throw new IllegalArgumentException("skills must list at least one skill");
    }
    String joined = String.join(", ", skills.values().stream().map(SkillEntry::term).toList());
    return rebuild(
        record,
        record.contact(),
        record.education(),
        record.experience(),
        List.copyOf(skills.values()),
        SKILLS_PATH,
        joined,
        version);
  }

  private static String canonical(FieldType field, String value, String path) {
    if (field.isDate()) {
      return DateNormalizer.normalize(value, field == FieldType.DATE_END)
          .orElseThrow(
              () -> new IllegalArgumentException("Malformed date for " + path + ": " + value));
    }
    // a typed address is kept as entered, dots included
    String canonical =
        field == FieldType.EMAIL
            ? value.strip().toLowerCase(Locale.ROOT)
            : FieldNormalizer.canonical(field, value);
    if (canonical.isBlank()) {
      throw new IllegalArgumentException("value has no content for " + path);
    }
    return canonical;
  }

  private static void checkRange(ProfileEntry entry, String path) {
    FieldValue start = entry.start();
    FieldValue end = entry.end();
    if (start != null
        && end != null
        && DateNormalizer.CHRONOLOGICAL.compare(start.value(), end.value()) > 0) {
      throw new IllegalArgumentException(
          "Edit of %s would start the entry (%s) after it ends (%s)"
              .formatted(path, start.value(), end.value()));
    }
  }

  private static ProfileRecord rebuild(
      ProfileRecord record,
      ContactInfo contact,
      List<EducationEntry> education,
      List<ExperienceEntry> experience,
      List<SkillEntry> skills,
      String path,
      String value,
      int version) {
    List<ConflictNote> conflicts = new ArrayList<>();
    for (ConflictNote note : record.conflicts()) {
      conflicts.add(
          note.path().equals(path) && !note.isSuperseded() ? note.supersede(value, version) : note);
    }
    ExperienceSummary summary =
        experience.equals(record.experience())
            ? record.experienceSummary()
            : ExperienceCalculator.summarize(experience, record.asOf());
    return new ProfileRecord(
        contact,
        education,
        experience,
        skills,
        conflicts,
        conflicts.stream().anyMatch(ConflictNote::needsReview),
        summary,
        record.asOf(),
        version);
  }
}
