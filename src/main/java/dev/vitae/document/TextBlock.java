package dev.vitae.document;

import java.util.Objects;

/**
 * A line of text extracted from a document, with its layout metadata. Immutable once produced by
 * a {@link DocumentLoader}.
 *
 * @param index zero-based position in document reading order
 * @param text the block's text, trimmed and never blank
 * @param page one-based page number
 * @param bbox region the block occupies on its page
 * @param style typographic style
 */
public record TextBlock(int index, String text, int page, BoundingBox bbox, BlockStyle style) {

  public TextBlock {
    Objects.requireNonNull(text, "text must not be null");
    Objects.requireNonNull(bbox, "bbox must not be null");
    Objects.requireNonNull(style, "style must not be null");
    if (index < 0) {
      throw new IllegalArgumentException("index must not be negative");
    }
    if (page < 1) {
      throw new IllegalArgumentException("page must be 1-based");
    }
    if (text.isBlank()) {
      throw new IllegalArgumentException("text must not be blank");
    }
  }
}
