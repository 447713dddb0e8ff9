package dev.vitae.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.vitae.extraction.CandidatePool;
import dev.vitae.rating.Rating;
import dev.vitae.synthesis.ProfileRecord;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The structured output for one document: the profile and, when the rubric was valid, its rating.
 *
 * @param documentId caller-supplied document identifier
 * @param profile the synthesized profile
 * @param rating the rating, or null when the rubric was rejected
 * @param ratingErrors rubric violations that prevented rating, empty when rated
 * @param candidates every candidate span, for audit of conflict notes
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProfileReport(
    @JsonProperty("document_id") String documentId,
    ProfileRecord profile,
    @Nullable Rating rating,
    @JsonProperty("rating_errors") List<String> ratingErrors,
    CandidatePool candidates) {

  public ProfileReport {
    ratingErrors = List.copyOf(ratingErrors);
  }

  public boolean isRated() {
    return rating != null;
  }
}
