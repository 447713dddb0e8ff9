package dev.vitae.synthesis;

import dev.vitae.extraction.FieldType;
import org.jspecify.annotations.Nullable;

/** An education or experience entry: a fixed set of fields addressable by type. */
public interface ProfileEntry {

  @Nullable FieldValue get(FieldType field);

  /** Copy with one field replaced and the entry confidence recomputed. */
  ProfileEntry with(FieldType field, @Nullable FieldValue value);

  default @Nullable FieldValue start() {
    return get(FieldType.DATE_START);
  }

  default @Nullable FieldValue end() {
    return get(FieldType.DATE_END);
  }

  static double meanConfidence(@Nullable FieldValue... values) {
    double sum = 0.0;
    int count = 0;
    for (FieldValue value : values) {
      if (value != null) {
        sum += value.confidence();
        count++;
      }
    }
    return count == 0 ? 0.0 : sum / count;
  }
}
