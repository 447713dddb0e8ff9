package dev.vitae.fixture;

import dev.vitae.synthesis.ContactInfo;
import dev.vitae.synthesis.EducationEntry;
import dev.vitae.synthesis.ExperienceCalculator;
import dev.vitae.synthesis.ExperienceEntry;
import dev.vitae.synthesis.FieldValue;
import dev.vitae.synthesis.ProfileRecord;
import dev.vitae.synthesis.Provenance;
import dev.vitae.synthesis.SkillEntry;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Lightweight test builder for {@link ProfileRecord}. Fields default to empty; experience is
 * summarized from the positions added, as synthesis would.
 *
 * <pre>{@code
 * ProfileRecord profile =
 *     new ProfileRecordBuilder().name("Jane Doe").skill("Java").position("2019-01", null).build();
 * }</pre>
 */
public final class ProfileRecordBuilder {

  public static final YearMonth AS_OF = YearMonth.of(2024, 6);

  private ContactInfo contact = ContactInfo.EMPTY;
  private final List<EducationEntry> education = new ArrayList<>();
  private final List<ExperienceEntry> experience = new ArrayList<>();
  private final List<SkillEntry> skills = new ArrayList<>();
  private int version = 1;

  private static FieldValue value(String value) {
    return FieldValue.extracted(value, 0.9);
  }

  public ProfileRecordBuilder name(String name) {
    contact = new ContactInfo(value(name), contact.email(), contact.phone(), null, null);
    return this;
  }

  public ProfileRecordBuilder email(String email) {
    contact = new ContactInfo(contact.name(), value(email), contact.phone(), null, null);
    return this;
  }

  public ProfileRecordBuilder phone(String phone) {
    contact = new ContactInfo(contact.name(), contact.email(), value(phone), null, null);
    return this;
  }

  public ProfileRecordBuilder skill(String term) {
    skills.add(new SkillEntry(term, 0.95, Provenance.EXTRACTED));
    return this;
  }

  public ProfileRecordBuilder degree(String degree) {
    education.add(new EducationEntry(value("Test University"), value(degree), null, null, 0.9));
    return this;
  }

  public ProfileRecordBuilder position(String start, @Nullable String end) {
    experience.add(
        new ExperienceEntry(
            value("Acme"),
            value("Engineer"),
            value(start),
            end == null ? null : value(end),
            null,
            0.9));
    return this;
  }

  public ProfileRecordBuilder version(int version) {
    this.version = version;
    return this;
  }

  public ProfileRecord build() {
    return new ProfileRecord(
        contact,
        education,
        experience,
        skills,
        List.of(),
        false,
        ExperienceCalculator.summarize(experience, AS_OF),
        AS_OF,
        version);
  }
}
