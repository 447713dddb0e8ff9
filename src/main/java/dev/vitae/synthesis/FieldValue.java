package dev.vitae.synthesis;

import java.util.Objects;

/**
 * A resolved field: its value, how sure synthesis is of it, and where it came from.
 *
 * @param value canonical value, never blank
 * @param confidence confidence in [0, 1]; exactly 1.0 for manual values
 * @param provenance extracted or manual
 */
public record FieldValue(String value, double confidence, Provenance provenance) {

  public FieldValue {
    Objects.requireNonNull(value, "value must not be null");
    Objects.requireNonNull(provenance, "provenance must not be null");
    if (value.isBlank()) {
      throw new IllegalArgumentException("value must not be blank");
    }
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
    }
  }

  public static FieldValue extracted(String value, double confidence) {
    return new FieldValue(value, confidence, Provenance.EXTRACTED);
  }

  public static FieldValue manual(String value) {
    return new FieldValue(value, 1.0, Provenance.MANUAL);
  }

  FieldValue withConfidence(double newConfidence) {
    return new FieldValue(value, newConfidence, provenance);
  }
}
