package dev.vitae.extraction;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The append-only set of candidate spans extracted from one document. Built once when extraction
 * completes and read-only afterwards, so it can be shared freely between threads and retained for
 * audit after synthesis.
 */
public final class CandidatePool {

  private static final CandidatePool EMPTY = new CandidatePool(List.of());

  private final Map<String, CandidateSpan> byId;

  private CandidatePool(Collection<CandidateSpan> spans) {
    Map<String, CandidateSpan> index = new LinkedHashMap<>();
    for (CandidateSpan span : spans) {
      if (index.putIfAbsent(span.id(), span) != null) {
        throw new IllegalArgumentException("Duplicate candidate span id: " + span.id());
      }
    }
    this.byId = index;
  }

  public static CandidatePool of(Collection<CandidateSpan> spans) {
    return spans.isEmpty() ? EMPTY : new CandidatePool(spans);
  }

  public static CandidatePool empty() {
    return EMPTY;
  }

  /** All spans in the order they were appended. */
  @JsonProperty("spans")
  public List<CandidateSpan> spans() {
    return List.copyOf(byId.values());
  }

  public Optional<CandidateSpan> lookup(String id) {
    return Optional.ofNullable(byId.get(id));
  }

  public List<CandidateSpan> forField(FieldType field) {
    return byId.values().stream().filter(span -> span.field() == field).toList();
  }

  public int size() {
    return byId.size();
  }
}
