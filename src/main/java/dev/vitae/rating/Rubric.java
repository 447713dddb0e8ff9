package dev.vitae.rating;

import java.util.List;

/**
 * Weighted scoring rules a profile is rated against. Validated by {@link RubricValidator} before
 * use; the weights of a valid rubric sum to 1.0.
 *
 * @param criteria criteria in evaluation order
 */
public record Rubric(List<Criterion> criteria) {

  public Rubric {
    criteria = criteria == null ? List.of() : List.copyOf(criteria);
  }

  public double totalWeight() {
    return criteria.stream().mapToDouble(Criterion::weight).sum();
  }
}
