package dev.vitae.rating;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Scoring functions by the reference rubrics use for them. */
@Component
public class ScoringFunctionRegistry {

  private final Map<String, ScoringFunction> functions;

  public ScoringFunctionRegistry(List<ScoringFunction> functions) {
    Map<String, ScoringFunction> byRef = new LinkedHashMap<>();
    for (ScoringFunction function : functions) {
      if (byRef.putIfAbsent(function.ref(), function) != null) {
        throw new IllegalStateException("Duplicate scoring function: " + function.ref());
      }
    }
    this.functions = byRef;
  }

  /** Registry holding the built-in scoring functions. */
  public static ScoringFunctionRegistry defaults() {
    return new ScoringFunctionRegistry(
        List.of(
            new YearsOfExperienceScoring(),
            new SkillCoverageScoring(),
            new EducationLevelScoring(),
            new ContactCompletenessScoring()));
  }

  public Optional<ScoringFunction> find(String ref) {
    return Optional.ofNullable(functions.get(ref));
  }

  public Set<String> refs() {
    return functions.keySet();
  }
}
