package dev.vitae.document;

import java.util.Objects;

/**
 * Typographic style of a text block.
 *
 * @param fontSizeBucket size class relative to the document median
 * @param bold whether the dominant font of the block is bold
 */
public record BlockStyle(FontSizeBucket fontSizeBucket, boolean bold) {

  public static final BlockStyle BODY = new BlockStyle(FontSizeBucket.BODY, false);

  public BlockStyle {
    Objects.requireNonNull(fontSizeBucket, "fontSizeBucket must not be null");
  }

  /** True when the block stands out from body text, either by weight or by size. */
  public boolean isEmphasized() {
    return bold || fontSizeBucket.isEmphasized();
  }
}
