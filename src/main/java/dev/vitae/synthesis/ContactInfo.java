package dev.vitae.synthesis;

import dev.vitae.extraction.FieldType;
import org.jspecify.annotations.Nullable;

/** Contact block of a profile. Unresolved fields are null. */
public record ContactInfo(
    @Nullable FieldValue name,
    @Nullable FieldValue email,
    @Nullable FieldValue phone,
    @Nullable FieldValue linkedin,
    @Nullable FieldValue website) {

  public static final ContactInfo EMPTY = new ContactInfo(null, null, null, null, null);

  public @Nullable FieldValue get(FieldType field) {
    return switch (field) {
      case NAME -> name;
      case EMAIL -> email;
      case PHONE -> phone;
      case LINKEDIN -> linkedin;
      case WEBSITE -> website;
      default -> throw new IllegalArgumentException("Not a contact field: " + field);
    };
  }

  public ContactInfo with(FieldType field, @Nullable FieldValue value) {
    return switch (field) {
      case NAME -> new ContactInfo(value, email, phone, linkedin, website);
      case EMAIL -> new ContactInfo(name, value, phone, linkedin, website);
      case PHONE -> new ContactInfo(name, email, value, linkedin, website);
      case LINKEDIN -> new ContactInfo(name, email, phone, value, website);
      case WEBSITE -> new ContactInfo(name, email, phone, linkedin, value);
      default -> throw new IllegalArgumentException("Not a contact field: " + field);
    };
  }
}
