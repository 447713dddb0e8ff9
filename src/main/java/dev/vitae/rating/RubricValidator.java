package dev.vitae.rating;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks a rubric before any profile is scored against it. All violations are collected so a
 * broken rubric can be fixed in one pass.
 */
public final class RubricValidator {

  /** Allowed deviation of the weight sum from 1.0. */
  static final double WEIGHT_TOLERANCE = 1e-9;

  private RubricValidator() {
    // static utility
  }

  /**
   * Validates a rubric.
   *
   * @throws InvalidRubricException listing every violation, if there is any
   */
  public static void validate(Rubric rubric, ScoringFunctionRegistry functions) {
    List<String> violations = violations(rubric, functions);
    if (!violations.isEmpty()) {
      throw new InvalidRubricException(violations);
    }
  }

  static List<String> violations(Rubric rubric, ScoringFunctionRegistry functions) {
    List<String> violations = new ArrayList<>();
    if (rubric.criteria().isEmpty()) {
      violations.add("rubric must define at least one criterion");
      return violations;
    }
    Set<String> names = new HashSet<>();
    boolean weightsFinite = true;
    for (int i = 0; i < rubric.criteria().size(); i++) {
      Criterion criterion = rubric.criteria().get(i);
      String label = criterion.name().isBlank() ? "criteria[" + i + "]" : criterion.name();
      if (criterion.name().isBlank()) {
        violations.add(label + ": name must not be blank");
      } else if (!names.add(criterion.name())) {
        violations.add(label + ": duplicate criterion name");
      }
      if (!Double.isFinite(criterion.weight())) {
        weightsFinite = false;
        violations.add(label + ": weight must be a finite number");
      } else if (criterion.weight() < 0.0 || criterion.weight() > 1.0) {
        violations.add(label + ": weight must be in [0, 1], got " + criterion.weight());
      }
      for (String field : criterion.requiredFields()) {
        if (!ProfileFields.isKnown(field)) {
          violations.add(label + ": unknown required field '" + field + "'");
        }
      }
      Optional<ScoringFunction> function = functions.find(criterion.scoringFnRef());
      if (function.isEmpty()) {
        violations.add(
            label + ": unknown scoring function '" + criterion.scoringFnRef() + "'");
      } else {
        function.get().validate(criterion.params()).forEach(v -> violations.add(label + ": " + v));
      }
    }
    double total = rubric.totalWeight();
    if (weightsFinite && Math.abs(total - 1.0) > WEIGHT_TOLERANCE) {
      violations.add("weights must sum to 1.0, got " + total);
    }
    return violations;
  }
}
