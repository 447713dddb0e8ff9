package dev.vitae.extraction;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/** Structured field a candidate span proposes a value for. */
public enum FieldType {
  NAME,
  EMAIL,
  PHONE,
  LINKEDIN,
  WEBSITE,
  INSTITUTION,
  DEGREE,
  ORG,
  TITLE,
  DESCRIPTION,
  DATE_START,
  DATE_END,
  SKILL;

  /** Single-valued fields of the contact block. */
  public static final Set<FieldType> CONTACT_FIELDS =
      EnumSet.of(NAME, EMAIL, PHONE, LINKEDIN, WEBSITE);

  /** Fields that make up one education entry. */
  public static final Set<FieldType> EDUCATION_FIELDS =
      EnumSet.of(INSTITUTION, DEGREE, DATE_START, DATE_END);

  /** Fields that make up one experience entry. */
  public static final Set<FieldType> EXPERIENCE_FIELDS =
      EnumSet.of(ORG, TITLE, DESCRIPTION, DATE_START, DATE_END);

  public boolean isDate() {
    return this == DATE_START || this == DATE_END;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
