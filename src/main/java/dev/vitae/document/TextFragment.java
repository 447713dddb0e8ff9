package dev.vitae.document;

/**
 * A run of text emitted by the PDF text stripper before it is grouped into lines.
 *
 * @param page one-based page number
 * @param x left edge
 * @param y top edge (origin at the top of the page)
 * @param width horizontal extent
 * @param height glyph height
 * @param fontSize font size in points
 * @param bold whether the run's font is bold
 * @param text the run's text
 */
record TextFragment(
    int page,
    float x,
    float y,
    float width,
    float height,
    float fontSize,
    boolean bold,
    String text) {

  float centerY() {
    return y + height / 2f;
  }

  BoundingBox bbox() {
    return new BoundingBox(x, y, Math.max(0f, width), Math.max(0f, height));
  }
}
