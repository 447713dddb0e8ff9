package dev.vitae.rating;

import dev.vitae.synthesis.ExperienceSummary;
import dev.vitae.synthesis.ProfileRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Scores total experience against ascending year thresholds: the score is the fraction of
 * thresholds reached. With thresholds {@code [2, 5, 10]}, six years score 2/3.
 */
@Component
public class YearsOfExperienceScoring implements ScoringFunction {

  public static final String REF = "years_of_experience";
  static final String THRESHOLDS = "thresholds";

  @Override
  public String ref() {
    return REF;
  }

  @Override
  public String contributingField() {
    return ProfileFields.YEARS_OF_EXPERIENCE;
  }

  @Override
  public List<String> validate(Map<String, Object> params) {
    List<String> violations = new ArrayList<>();
    ScoringParams.numbers(params, THRESHOLDS)
        .ifPresentOrElse(
            thresholds -> {
              if (thresholds.isEmpty()) {
                violations.add("params.thresholds must not be empty");
              }
              for (int i = 0; i < thresholds.size(); i++) {
                boolean descending = i > 0 && thresholds.get(i) <= thresholds.get(i - 1);
                if (thresholds.get(i) < 0 || descending) {
                  violations.add("params.thresholds must be non-negative and strictly ascending");
                  break;
                }
              }
            },
            () -> violations.add("params.thresholds must be a list of numbers"));
    return violations;
  }

  @Override
  public double score(ProfileRecord profile, Map<String, Object> params) {
    List<Double> thresholds = ScoringParams.numbers(params, THRESHOLDS).orElse(List.of());
    ExperienceSummary summary = profile.experienceSummary();
    if (thresholds.isEmpty() || summary == null) {
      return 0.0;
    }
    double years = summary.totalYears();
    long reached = thresholds.stream().filter(threshold -> years >= threshold).count();
    return (double) reached / thresholds.size();
  }
}
