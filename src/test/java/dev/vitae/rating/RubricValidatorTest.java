package dev.vitae.rating;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RubricValidatorTest {

  private final ScoringFunctionRegistry functions = ScoringFunctionRegistry.defaults();

  @Test
  void acceptsWeightsThatSumToOneWithinRounding() {
    Rubric rubric =
        new Rubric(
            List.of(
                new Criterion("a", 0.1, "contact_completeness", List.of()),
                new Criterion("b", 0.2, "education_level", List.of()),
                new Criterion("c", 0.7, "contact_completeness", List.of())));

    assertThatCode(() -> RubricValidator.validate(rubric, functions)).doesNotThrowAnyException();
  }

  @Test
  void rejectsRubricWithoutCriteria() {
    assertThatThrownBy(() -> RubricValidator.validate(new Rubric(List.of()), functions))
        .isInstanceOf(InvalidRubricException.class)
        .hasMessageContaining("at least one criterion");
  }

  @Test
  void collectsEveryViolation() {
    Rubric rubric =
        new Rubric(
            List.of(
                new Criterion("", 0.2, "contact_completeness", List.of()),
                new Criterion("dup", 0.2, "contact_completeness", List.of("salary")),
                new Criterion("dup", 1.5, "horoscope", List.of()),
                new Criterion(
                    "years",
                    0.1,
                    "years_of_experience",
                    List.of(),
                    Map.of("thresholds", List.of(5, 2)))));

    List<String> violations = RubricValidator.violations(rubric, functions);

    assertThat(violations)
        .containsExactly(
            "criteria[0]: name must not be blank",
            "dup: unknown required field 'salary'",
            "dup: duplicate criterion name",
            "dup: weight must be in [0, 1], got 1.5",
            "dup: unknown scoring function 'horoscope'",
            "years: params.thresholds must be non-negative and strictly ascending",
            "weights must sum to 1.0, got 2.0");
  }

  @Test
  void nonFiniteWeightSkipsTheSumCheck() {
    Rubric rubric =
        new Rubric(List.of(new Criterion("a", Double.NaN, "contact_completeness", List.of())));

    assertThat(RubricValidator.violations(rubric, functions))
        .containsExactly("a: weight must be a finite number");
  }

  @Test
  void exceptionCarriesTheViolations() {
    Rubric rubric =
        new Rubric(List.of(new Criterion("skills", 1.0, "skill_coverage", List.of())));

    assertThatThrownBy(() -> RubricValidator.validate(rubric, functions))
        .isInstanceOfSatisfying(
            InvalidRubricException.class,
            e ->
                assertThat(e.getViolations())
                    .containsExactly(
                        "skills: params.target_skills must be a non-empty list of strings"));
  }
}
