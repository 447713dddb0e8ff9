package dev.vitae.synthesis;

import dev.vitae.extraction.CandidateSpan;
import dev.vitae.extraction.FieldNormalizer;
import dev.vitae.extraction.FieldType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Resolves the candidates proposed for one field to a single value.
 *
 * <p>Candidates are grouped by comparison key. When every candidate agrees, the value takes the
 * highest candidate confidence. When they disagree, the cluster with the highest summed confidence
 * wins (ties go to the cluster seen first in document order), its confidence is discounted by the
 * cluster's share of the total, and an {@code AUTO_RESOLVED} note records all candidates. In both
 * cases a winning cluster whose summed confidence is below the threshold leaves the field empty
 * with a {@code LEFT_UNRESOLVED} note.
 */
final class FieldResolver {

  /** Summed confidences closer than this are equal; accumulation order must not decide a tie. */
  static final double SUM_TOLERANCE = 1e-9;

  private final double threshold;

  FieldResolver(double threshold) {
    this.threshold = threshold;
  }

  double threshold() {
    return threshold;
  }

  /**
   * The outcome for one field.
   *
   * @param value resolved value; null when there were no candidates or the field stays unresolved
   * @param chosen span whose value was taken
   * @param note conflict note, or null when candidates agreed above the threshold
   */
  record Outcome(
      @Nullable FieldValue value, @Nullable CandidateSpan chosen, @Nullable ConflictNote note) {

    static final Outcome NONE = new Outcome(null, null, null);
  }

  private static final class Cluster {
    private final List<CandidateSpan> spans = new ArrayList<>();
    private double sum;

    void add(CandidateSpan span) {
      spans.add(span);
      sum += span.confidence();
    }

    CandidateSpan strongest() {
      CandidateSpan best = spans.get(0);
      for (CandidateSpan span : spans) {
        if (span.confidence() > best.confidence()) {
          best = span;
        }
      }
      return best;
    }
  }

  Outcome resolve(FieldType field, String path, Collection<CandidateSpan> candidates) {
    if (candidates.isEmpty()) {
      return Outcome.NONE;
    }
    List<CandidateSpan> ordered =
        candidates.stream().sorted(CandidateSpan.DOCUMENT_ORDER).toList();
    Map<String, Cluster> clusters = new LinkedHashMap<>();
    double total = 0.0;
    for (CandidateSpan span : ordered) {
      clusters
          .computeIfAbsent(FieldNormalizer.comparisonKey(field, span.value()), key -> new Cluster())
          .add(span);
      total += span.confidence();
    }

    Cluster winner = null;
    for (Cluster cluster : clusters.values()) {
      if (winner == null || cluster.sum > winner.sum + SUM_TOLERANCE) {
        winner = cluster;
      }
    }
    CandidateSpan chosen = winner.strongest();
    String value = FieldNormalizer.canonical(field, chosen.value());
    boolean agreed = clusters.size() == 1;
    double confidence =
        agreed ? chosen.confidence() : chosen.confidence() * (winner.sum / total);
    List<String> ids = ordered.stream().map(CandidateSpan::id).toList();

    if (winner.sum < threshold - SUM_TOLERANCE || value.isBlank()) {
      ConflictNote note =
          new ConflictNote(
              field,
              path,
              ids,
              ConflictNote.Resolution.LEFT_UNRESOLVED,
              null,
              null,
              confidence,
              null);
      return new Outcome(null, null, note);
    }
    FieldValue resolved = FieldValue.extracted(value, confidence);
    if (agreed) {
      return new Outcome(resolved, chosen, null);
    }
    ConflictNote note =
        new ConflictNote(
            field,
            path,
            ids,
            ConflictNote.Resolution.AUTO_RESOLVED,
            chosen.id(),
            value,
            confidence,
            null);
    return new Outcome(resolved, chosen, note);
  }
}
