package dev.vitae.rating;

import dev.vitae.synthesis.ProfileRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Scores a profile against a weighted rubric.
 *
 * <p>The rubric is validated before anything is scored. A criterion whose required fields are not
 * all present scores 0 and is marked {@code missing_required_field}; otherwise its scoring
 * function decides, clamped to [0, 1]. The aggregate is the weighted sum of the sub-scores,
 * accumulated in rubric order so equal inputs give bit-identical ratings.
 */
@Service
public class RatingEngine {

  private static final Logger log = LoggerFactory.getLogger(RatingEngine.class);

  private final ScoringFunctionRegistry functions;

  public RatingEngine(ScoringFunctionRegistry functions) {
    this.functions = functions;
  }

  /**
   * Rates a profile.
   *
   * @param profile the profile to rate
   * @param rubric the rubric to rate against
   * @return sub-scores, aggregate and explanation
   * @throws InvalidRubricException if the rubric is invalid; no criterion is scored in that case
   */
  public Rating rate(ProfileRecord profile, Rubric rubric) {
    RubricValidator.validate(rubric, functions);

    Map<String, Double> subScores = new LinkedHashMap<>();
    List<RatingExplanation> explanation = new ArrayList<>();
    double aggregate = 0.0;
    for (Criterion criterion : rubric.criteria()) {
      ScoringFunction function =
          functions
              .find(criterion.scoringFnRef())
              .orElseThrow(() -> new IllegalStateException(criterion.scoringFnRef()));
      String missing = firstMissing(profile, criterion);
      double score;
      @Nullable String note = null;
      if (missing != null) {
        log.debug("Criterion {} failed closed: {} is missing", criterion.name(), missing);
        score = 0.0;
        note = RatingExplanation.MISSING_REQUIRED_FIELD;
      } else {
        score = clamp(function.score(profile, criterion.params()));
      }
      subScores.put(criterion.name(), score);
      explanation.add(
          new RatingExplanation(
              criterion.name(), function.contributingField(), criterion.weight(), score, note));
      aggregate += criterion.weight() * score;
    }
    aggregate = clamp(aggregate);
    log.info(
        "Rated profile version {}: aggregate {} over {} criteria",
        profile.version(),
        String.format("%.3f", aggregate),
        rubric.criteria().size());
    return new Rating(subScores, aggregate, explanation, profile.version());
  }

  private static @Nullable String firstMissing(ProfileRecord profile, Criterion criterion) {
    for (String field : criterion.requiredFields()) {
      if (!ProfileFields.isPresent(profile, field)) {
        return field;
      }
    }
    return null;
  }

  private static double clamp(double score) {
    if (Double.isNaN(score)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, score));
  }
}
