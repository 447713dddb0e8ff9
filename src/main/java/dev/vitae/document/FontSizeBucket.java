package dev.vitae.document;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Font size of a block relative to the median glyph size of its document. */
public enum FontSizeBucket {
  SMALL,
  BODY,
  LARGE,
  TITLE;

  static final double TITLE_RATIO = 1.5;
  static final double LARGE_RATIO = 1.15;
  static final double SMALL_RATIO = 0.85;

  /**
   * Classifies a font size against the document's median size.
   *
   * @param size the block's dominant font size
   * @param medianSize the median font size across the document; non-positive means unknown
   * @return the matching bucket, {@link #BODY} when the median is unknown
   */
  public static FontSizeBucket classify(double size, double medianSize) {
    if (medianSize <= 0) {
      return BODY;
    }
    double ratio = size / medianSize;
    if (ratio >= TITLE_RATIO) {
      return TITLE;
    }
    if (ratio >= LARGE_RATIO) {
      return LARGE;
    }
    if (ratio <= SMALL_RATIO) {
      return SMALL;
    }
    return BODY;
  }

  public boolean isEmphasized() {
    return this == LARGE || this == TITLE;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
