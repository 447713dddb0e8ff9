package dev.vitae.rating;

import dev.vitae.synthesis.ProfileRecord;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Scores the share of name, email and phone the profile holds. */
@Component
public class ContactCompletenessScoring implements ScoringFunction {

  public static final String REF = "contact_completeness";

  private static final List<String> FIELDS =
      List.of(ProfileFields.CONTACT_NAME, ProfileFields.CONTACT_EMAIL, ProfileFields.CONTACT_PHONE);

  @Override
  public String ref() {
    return REF;
  }

  @Override
  public String contributingField() {
    return "contact";
  }

  @Override
  public double score(ProfileRecord profile, Map<String, Object> params) {
    long present = FIELDS.stream().filter(field -> ProfileFields.isPresent(profile, field)).count();
    return (double) present / FIELDS.size();
  }
}
