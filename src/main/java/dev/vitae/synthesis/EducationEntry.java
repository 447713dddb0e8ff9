package dev.vitae.synthesis;

import dev.vitae.extraction.FieldType;
import org.jspecify.annotations.Nullable;

/**
 * One education entry.
 *
 * @param institution school or university
 * @param degree degree or qualification
 * @param start {@code YYYY-MM}
 * @param end {@code YYYY-MM} or {@code PRESENT}
 * @param confidence mean confidence of the resolved fields; 0 when none resolved
 */
public record EducationEntry(
    @Nullable FieldValue institution,
    @Nullable FieldValue degree,
    @Nullable FieldValue start,
    @Nullable FieldValue end,
    double confidence)
    implements ProfileEntry {

  @Override
  public @Nullable FieldValue get(FieldType field) {
    return switch (field) {
      case INSTITUTION -> institution;
      case DEGREE -> degree;
      case DATE_START -> start;
      case DATE_END -> end;
      default -> throw new IllegalArgumentException("Not an education field: " + field);
    };
  }

  @Override
  public EducationEntry with(FieldType field, @Nullable FieldValue value) {
    EducationEntry updated =
        switch (field) {
          case INSTITUTION -> new EducationEntry(value, degree, start, end, confidence);
          case DEGREE -> new EducationEntry(institution, value, start, end, confidence);
          case DATE_START -> new EducationEntry(institution, degree, value, end, confidence);
          case DATE_END -> new EducationEntry(institution, degree, start, value, confidence);
          default -> throw new IllegalArgumentException("Not an education field: " + field);
        };
    return new EducationEntry(
        updated.institution,
        updated.degree,
        updated.start,
        updated.end,
        ProfileEntry.meanConfidence(
            updated.institution, updated.degree, updated.start, updated.end));
  }
}
