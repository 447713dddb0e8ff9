package dev.vitae.rating;

import java.util.List;

/** Thrown when a rubric fails validation. Carries every violation found, not just the first. */
public class InvalidRubricException extends RuntimeException {

  private final List<String> violations;

  public InvalidRubricException(List<String> violations) {
    super("Invalid rubric: " + String.join("; ", violations));
    this.violations = List.copyOf(violations);
  }

  public InvalidRubricException(String violation, Throwable cause) {
    super("Invalid rubric: " + violation, cause);
    this.violations = List.of(violation);
  }

  public List<String> getViolations() {
    return violations;
  }
}
