package dev.vitae.rating;

import dev.vitae.synthesis.ProfileRecord;
import java.util.List;
import java.util.Map;

/**
 * A criterion-specific scoring rule. Implementations are pure: the score depends only on the
 * profile and the parameters.
 */
public interface ScoringFunction {

  /** Name rubrics refer to this function by, e.g. {@code skill_coverage}. */
  String ref();

  /** The profile field the score is derived from, reported in rating explanations. */
  String contributingField();

  /**
   * Checks the criterion parameters.
   *
   * @param params the criterion's {@code params}
   * @return violations, empty when the parameters are usable
   */
  default List<String> validate(Map<String, Object> params) {
    return List.of();
  }

  /**
   * Scores a profile.
   *
   * @param profile the profile to score
   * @param params the criterion's validated parameters
   * @return a score in [0, 1]
   */
  double score(ProfileRecord profile, Map<String, Object> params);
}
