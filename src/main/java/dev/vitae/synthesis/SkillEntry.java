package dev.vitae.synthesis;

import java.util.Objects;

/**
 * A skill held by the candidate.
 *
 * @param term canonical skill term
 * @param confidence confidence in [0, 1]
 * @param provenance extracted or manual
 */
public record SkillEntry(String term, double confidence, Provenance provenance) {

  public SkillEntry {
    Objects.requireNonNull(term, "term must not be null");
    Objects.requireNonNull(provenance, "provenance must not be null");
    if (term.isBlank()) {
      throw new IllegalArgumentException("term must not be blank");
    }
  }
}
