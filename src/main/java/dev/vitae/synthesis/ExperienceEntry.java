package dev.vitae.synthesis;

import dev.vitae.extraction.FieldType;
import org.jspecify.annotations.Nullable;

/**
 * One position held.
 *
 * @param organization employer
 * @param title job title
 * @param start {@code YYYY-MM}
 * @param end {@code YYYY-MM} or {@code PRESENT}
 * @param description description lines joined by newlines
 * @param confidence mean confidence of the resolved fields; 0 when none resolved
 */
public record ExperienceEntry(
    @Nullable FieldValue organization,
    @Nullable FieldValue title,
    @Nullable FieldValue start,
    @Nullable FieldValue end,
    @Nullable FieldValue description,
    double confidence)
    implements ProfileEntry {

  @Override
  public @Nullable FieldValue get(FieldType field) {
    return switch (field) {
      case ORG -> organization;
      case TITLE -> title;
      case DATE_START -> start;
      case DATE_END -> end;
      case DESCRIPTION -> description;
      default -> throw new IllegalArgumentException("Not an experience field: " + field);
    };
  }

  @Override
  public ExperienceEntry with(FieldType field, @Nullable FieldValue value) {
    if (!FieldType.EXPERIENCE_FIELDS.contains(field)) {
      throw new IllegalArgumentException("Not an experience field: " + field);
    }
    FieldValue org = field == FieldType.ORG ? value : organization;
    FieldValue newTitle = field == FieldType.TITLE ? value : title;
    FieldValue newStart = field == FieldType.DATE_START ? value : start;
    FieldValue newEnd = field == FieldType.DATE_END ? value : end;
    FieldValue newDescription = field == FieldType.DESCRIPTION ? value : description;
    return new ExperienceEntry(
        org,
        newTitle,
        newStart,
        newEnd,
        newDescription,
        ProfileEntry.meanConfidence(org, newTitle, newStart, newEnd, newDescription));
  }
}
