package dev.vitae.extraction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Catalogue of canonical organization (or institution) names with aliases, matched fuzzily.
 *
 * <p>Similarity is a hybrid of token containment and Jaccard overlap computed on de-accented,
 * lower-cased tokens. An exact match scores {@link #MAX_SIMILARITY}; a fuzzy match never reaches
 * 1.0, so a lexicon hit is always distinguishable from a strict pattern match.
 */
public final class NameLexicon {

  static final double MAX_SIMILARITY = 0.99;
  static final double DEFAULT_MIN_SIMILARITY = 0.5;

  private static final Set<String> STOP_WORDS = Set.of("of", "the", "and", "for", "at", "de");

  private final Map<String, List<String>> namesByCanonical;
  private final double minSimilarity;

  /** A lexicon hit. */
  public record Match(String canonical, double similarity) {}

  public NameLexicon(Map<String, List<String>> namesWithAliases, double minSimilarity) {
    Map<String, List<String>> copy = new LinkedHashMap<>();
    namesWithAliases.forEach((name, aliases) -> copy.put(name, List.copyOf(aliases)));
    this.namesByCanonical = copy;
    this.minSimilarity = minSimilarity;
  }

  public static NameLexicon of(Collection<String> canonicalNames) {
    Map<String, List<String>> names = new LinkedHashMap<>();
    canonicalNames.forEach(name -> names.put(name, List.of()));
    return new NameLexicon(names, DEFAULT_MIN_SIMILARITY);
  }

  /** Returns a lexicon containing this lexicon's names plus the given ones. */
  public NameLexicon with(Collection<String> additionalNames) {
    Map<String, List<String>> names = new LinkedHashMap<>(namesByCanonical);
    for (String name : additionalNames) {
      if (name != null && !name.isBlank()) {
        names.putIfAbsent(name.strip(), List.of());
      }
    }
    return new NameLexicon(names, minSimilarity);
  }

  public boolean isEmpty() {
    return namesByCanonical.isEmpty();
  }

  /**
   * Finds the best matching canonical name.
   *
   * @param text candidate organization text
   * @return the best match at or above the minimum similarity, or empty
   */
  public Optional<Match> match(String text) {
    if (text == null || text.isBlank() || namesByCanonical.isEmpty()) {
      return Optional.empty();
    }
    String query = fold(text);
    Set<String> queryTokens = tokenize(query);
    Match best = null;
    for (Map.Entry<String, List<String>> entry : namesByCanonical.entrySet()) {
      List<String> names = new ArrayList<>();
      names.add(entry.getKey());
      names.addAll(entry.getValue());
      for (String name : names) {
        String candidate = fold(name);
        double similarity = similarity(queryTokens, tokenize(candidate), query, candidate);
        if (best == null || similarity > best.similarity()) {
          best = new Match(entry.getKey(), similarity);
        }
      }
    }
    return best != null && best.similarity() >= minSimilarity
        ? Optional.of(best)
        : Optional.empty();
  }

  /**
   * Exact token equality scores the maximum. Containment of one token sequence in the other scores
   * in [0.8, 0.95) by how much of the longer side is covered; otherwise Jaccard overlap.
   */
  static double similarity(
      Set<String> queryTokens, Set<String> nameTokens, String query, String name) {
    if (queryTokens.isEmpty() || nameTokens.isEmpty()) {
      return 0.0;
    }
    if (queryTokens.equals(nameTokens)) {
      return MAX_SIMILARITY;
    }
    Set<String> intersection =
        queryTokens.stream().filter(nameTokens::contains).collect(Collectors.toSet());
    Set<String> union = new LinkedHashSet<>(queryTokens);
    union.addAll(nameTokens);
    double jaccard = (double) intersection.size() / union.size();
    boolean contained =
        containsPhrase(query, name) || containsPhrase(name, query);
    if (contained) {
      return 0.8 + 0.15 * jaccard;
    }
    return jaccard;
  }

  private static boolean containsPhrase(String haystack, String needle) {
    return (" " + haystack + " ").contains(" " + needle + " ");
  }

  private static String fold(String text) {
    return FieldNormalizer.deaccent(text)
        .toLowerCase(Locale.ROOT)
        .replaceAll("[^\\p{L}\\p{Nd}]+", " ")
        .strip();
  }

  private static Set<String> tokenize(String folded) {
    if (folded.isBlank()) {
      return Set.of();
    }
    return Arrays.stream(folded.split(" "))
        .filter(token -> !token.isBlank() && !STOP_WORDS.contains(token))
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }
}
