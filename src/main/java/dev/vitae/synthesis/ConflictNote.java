package dev.vitae.synthesis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.vitae.extraction.FieldType;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Audit record of a field whose candidates disagreed or whose evidence was too weak. Candidates
 * are referenced by span id; the spans themselves stay in the document's candidate pool.
 *
 * <p>Notes are never removed. A manual edit of the field supersedes the note by attaching a
 * {@link ManualOverride}.
 *
 * @param field the field the note is about
 * @param path edit path of the field, e.g. {@code contact.email} or {@code experience[0].start}
 * @param candidateIds ids of every candidate considered, in document order
 * @param resolution how synthesis settled the field
 * @param chosenId id of the winning span; null when left unresolved
 * @param chosenValue value taken by the field; null when left unresolved
 * @param confidence confidence of the chosen value, or of the best rejected cluster
 * @param manualOverride the manual edit that superseded this note, if any
 */
public record ConflictNote(
    FieldType field,
    String path,
    List<String> candidateIds,
    Resolution resolution,
    @Nullable String chosenId,
    @Nullable String chosenValue,
    double confidence,
    @Nullable ManualOverride manualOverride) {

  /** Outcome of conflict resolution. */
  public enum Resolution {
    AUTO_RESOLVED("auto_resolved"),
    LEFT_UNRESOLVED("left_unresolved");

    private final String value;

    Resolution(String value) {
      this.value = value;
    }

    @JsonValue
    public String value() {
      return value;
    }

    @JsonCreator
    public static Resolution fromValue(String value) {
      for (Resolution resolution : values()) {
        if (resolution.value.equalsIgnoreCase(value)) {
          return resolution;
        }
      }
      throw new IllegalArgumentException("Invalid resolution: " + value);
    }
  }

  /**
   * A manual edit that replaced the field's value after synthesis.
   *
   * @param value the value entered
   * @param version record version that carried the edit
   */
  public record ManualOverride(String value, int version) {}

  public ConflictNote {
    Objects.requireNonNull(field, "field must not be null");
    Objects.requireNonNull(path, "path must not be null");
    Objects.requireNonNull(resolution, "resolution must not be null");
    candidateIds = List.copyOf(candidateIds);
  }

  public boolean isSuperseded() {
    return manualOverride != null;
  }

  /** True for an unresolved note no manual edit has addressed yet. */
  public boolean needsReview() {
    return resolution == Resolution.LEFT_UNRESOLVED && manualOverride == null;
  }

  ConflictNote withPath(String newPath) {
    return new ConflictNote(
        field,
        newPath,
        candidateIds,
        resolution,
        chosenId,
        chosenValue,
        confidence,
        manualOverride);
  }

  ConflictNote supersede(String value, int version) {
    return new ConflictNote(
        field,
        path,
        candidateIds,
        resolution,
        chosenId,
        chosenValue,
        confidence,
        new ManualOverride(value, version));
  }
}
