package dev.vitae.rating;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Typed access to the loosely typed parameter maps of rubric criteria. */
final class ScoringParams {

  private ScoringParams() {
    // static utility
  }

  /** Numeric list parameter; empty when absent or not a list of numbers. */
  static Optional<List<Double>> numbers(Map<String, Object> params, String key) {
    if (!(params.get(key) instanceof List<?> values)) {
      return Optional.empty();
    }
    List<Double> numbers = new ArrayList<>();
    for (Object value : values) {
      if (!(value instanceof Number number)) {
        return Optional.empty();
      }
      numbers.add(number.doubleValue());
    }
    return Optional.of(numbers);
  }

  /** String list parameter; empty when absent or not a list of strings. */
  static Optional<List<String>> strings(Map<String, Object> params, String key) {
    if (!(params.get(key) instanceof List<?> values)) {
      return Optional.empty();
    }
    List<String> strings = new ArrayList<>();
    for (Object value : values) {
      if (!(value instanceof String text)) {
        return Optional.empty();
      }
      strings.add(text);
    }
    return Optional.of(strings);
  }
}
