package dev.vitae.rating;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One weighted rubric criterion. Missing JSON properties bind to empty values so that validation,
 * not parsing, reports them.
 *
 * @param name unique criterion name, used as the sub-score key
 * @param weight share of the aggregate in [0, 1]
 * @param scoringFnRef reference to a registered {@link ScoringFunction}
 * @param requiredFields profile fields that must be present; any missing one fails the criterion
 *     closed
 * @param params scoring-function specific parameters
 */
public record Criterion(
    String name,
    double weight,
    @JsonProperty("scoring_fn_ref") String scoringFnRef,
    @JsonProperty("required_fields") List<String> requiredFields,
    Map<String, Object> params) {

  public Criterion {
    name = Objects.requireNonNullElse(name, "");
    scoringFnRef = Objects.requireNonNullElse(scoringFnRef, "");
    requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
    params =
        params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }

  public Criterion(String name, double weight, String scoringFnRef, List<String> requiredFields) {
    this(name, weight, scoringFnRef, requiredFields, Map.of());
  }
}
