package dev.vitae.rating;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * How one criterion contributed to a rating.
 *
 * @param criterion criterion name
 * @param contributingField profile field the score was derived from
 * @param weight criterion weight
 * @param score sub-score in [0, 1]
 * @param note {@link #MISSING_REQUIRED_FIELD} when the criterion failed closed, otherwise null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RatingExplanation(
    String criterion,
    @JsonProperty("contributing_field") String contributingField,
    double weight,
    double score,
    @Nullable String note) {

  public static final String MISSING_REQUIRED_FIELD = "missing_required_field";

  public boolean failedClosed() {
    return MISSING_REQUIRED_FIELD.equals(note);
  }
}
