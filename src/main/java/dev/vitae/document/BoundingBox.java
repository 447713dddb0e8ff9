package dev.vitae.document;

/**
 * Axis-aligned region of a page occupied by a text block, in PDF user-space units with the origin
 * at the top-left corner of the page.
 *
 * @param x left edge
 * @param y top edge
 * @param width horizontal extent
 * @param height vertical extent
 */
public record BoundingBox(float x, float y, float width, float height) {

  public BoundingBox {
    if (width < 0 || height < 0) {
      throw new IllegalArgumentException("width and height must not be negative");
    }
  }

  public float right() {
    return x + width;
  }

  public float bottom() {
    return y + height;
  }

  /** Returns the smallest box containing both this box and {@code other}. */
  public BoundingBox union(BoundingBox other) {
    float left = Math.min(x, other.x);
    float top = Math.min(y, other.y);
    float right = Math.max(right(), other.right());
    float bottom = Math.max(bottom(), other.bottom());
    return new BoundingBox(left, top, right - left, bottom - top);
  }
}
