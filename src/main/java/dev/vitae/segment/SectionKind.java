package dev.vitae.segment;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Label of a contiguous region of a résumé. */
public enum SectionKind {
  CONTACT,
  SUMMARY,
  EDUCATION,
  EXPERIENCE,
  SKILLS,
  OTHER;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
