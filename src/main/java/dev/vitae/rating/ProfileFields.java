package dev.vitae.rating;

import dev.vitae.synthesis.FieldValue;
import dev.vitae.synthesis.ProfileRecord;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * The profile fields a rubric can require, by name. A field is present when it holds a resolved
 * value; a collection is present when it is non-empty.
 */
public final class ProfileFields {

  public static final String CONTACT_NAME = "contact.name";
  public static final String CONTACT_EMAIL = "contact.email";
  public static final String CONTACT_PHONE = "contact.phone";
  public static final String CONTACT_LINKEDIN = "contact.linkedin";
  public static final String CONTACT_WEBSITE = "contact.website";
  public static final String EDUCATION = "education";
  public static final String EXPERIENCE = "experience";
  public static final String SKILLS = "skills";
  public static final String YEARS_OF_EXPERIENCE = "years_of_experience";

  private static final Map<String, Predicate<ProfileRecord>> PRESENCE =
      Map.of(
          CONTACT_NAME, profile -> isSet(profile.contact().name()),
          CONTACT_EMAIL, profile -> isSet(profile.contact().email()),
          CONTACT_PHONE, profile -> isSet(profile.contact().phone()),
          CONTACT_LINKEDIN, profile -> isSet(profile.contact().linkedin()),
          CONTACT_WEBSITE, profile -> isSet(profile.contact().website()),
          EDUCATION, profile -> !profile.education().isEmpty(),
          EXPERIENCE, profile -> !profile.experience().isEmpty(),
          SKILLS, profile -> !profile.skills().isEmpty(),
          YEARS_OF_EXPERIENCE, profile -> profile.experienceSummary() != null);

  /** Names accepted in {@code required_fields}, in documentation order. */
  public static final List<String> NAMES =
      List.of(
          CONTACT_NAME,
          CONTACT_EMAIL,
          CONTACT_PHONE,
          CONTACT_LINKEDIN,
          CONTACT_WEBSITE,
          EDUCATION,
          EXPERIENCE,
          SKILLS,
          YEARS_OF_EXPERIENCE);

  private ProfileFields() {
    // static utility
  }

  public static boolean isKnown(String name) {
    return PRESENCE.containsKey(name);
  }

  /**
   * Whether a profile holds a value for a field.
   *
   * @throws IllegalArgumentException if the field name is unknown
   */
  public static boolean isPresent(ProfileRecord profile, String name) {
    Predicate<ProfileRecord> presence = PRESENCE.get(name);
    if (presence == null) {
      throw new IllegalArgumentException("Unknown profile field: " + name);
    }
    return presence.test(profile);
  }

  private static boolean isSet(@Nullable FieldValue value) {
    return value != null;
  }
}
