package dev.vitae.synthesis;

import java.time.YearMonth;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The synthesized profile of one candidate.
 *
 * @param contact contact details
 * @param education education entries, most recent first
 * @param experience positions held, most recent first
 * @param skills skills in order of first mention
 * @param conflicts every conflict note raised during synthesis, in field order
 * @param needsReview whether an unresolved note still awaits a manual edit
 * @param experienceSummary total experience; null when no position has a start date
 * @param asOf the month {@code PRESENT} was resolved against
 * @param version 1 after synthesis, incremented by every manual edit
 */
public record ProfileRecord(
    ContactInfo contact,
    List<EducationEntry> education,
    List<ExperienceEntry> experience,
    List<SkillEntry> skills,
    List<ConflictNote> conflicts,
    boolean needsReview,
    @Nullable ExperienceSummary experienceSummary,
    YearMonth asOf,
    int version) {

  public ProfileRecord {
    Objects.requireNonNull(contact, "contact must not be null");
    Objects.requireNonNull(asOf, "asOf must not be null");
    education = List.copyOf(education);
    experience = List.copyOf(experience);
    skills = List.copyOf(skills);
    conflicts = List.copyOf(conflicts);
  }

  /** Unresolved notes not yet superseded by a manual edit. */
  public List<ConflictNote> unresolvedConflicts() {
    return conflicts.stream().filter(ConflictNote::needsReview).toList();
  }
}
