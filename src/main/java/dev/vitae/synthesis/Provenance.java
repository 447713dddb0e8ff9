package dev.vitae.synthesis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Where a field value came from. */
public enum Provenance {
  EXTRACTED("extracted"),
  MANUAL("manual");

  private final String value;

  Provenance(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static Provenance fromValue(String value) {
    for (Provenance provenance : values()) {
      if (provenance.value.equalsIgnoreCase(value)) {
        return provenance;
      }
    }
    throw new IllegalArgumentException("Invalid provenance: " + value);
  }
}
