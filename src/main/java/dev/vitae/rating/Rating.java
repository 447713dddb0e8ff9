package dev.vitae.rating;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The result of rating a profile against a rubric. Derived data: it is tied to the profile
 * version it was computed from and recomputed whenever the profile changes.
 *
 * @param subScores sub-score per criterion name, in rubric order
 * @param aggregate weighted sum of the sub-scores
 * @param explanation one entry per criterion, in rubric order
 * @param profileVersion version of the rated profile
 */
public record Rating(
    @JsonProperty("sub_scores") Map<String, Double> subScores,
    double aggregate,
    List<RatingExplanation> explanation,
    @JsonProperty("profile_version") int profileVersion) {

  public Rating {
    subScores = Collections.unmodifiableMap(new LinkedHashMap<>(subScores));
    explanation = List.copyOf(explanation);
  }
}
