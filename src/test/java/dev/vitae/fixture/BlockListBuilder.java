package dev.vitae.fixture;

import dev.vitae.document.BlockStyle;
import dev.vitae.document.BoundingBox;
import dev.vitae.document.FontSizeBucket;
import dev.vitae.document.TextBlock;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight test builder for a document's block sequence. Blocks are indexed in the order they
 * are added and laid out one line below the other on page 1.
 *
 * <pre>{@code
 * List<TextBlock> blocks =
 *     new BlockListBuilder().title("Jane Doe").header("EXPERIENCE").line("Engineer").build();
 * }</pre>
 */
public final class BlockListBuilder {

  private static final BlockStyle BOLD = new BlockStyle(FontSizeBucket.BODY, true);
  private static final BlockStyle TITLE = new BlockStyle(FontSizeBucket.TITLE, true);

  private final List<TextBlock> blocks = new ArrayList<>();
  private int startIndex;

  /** Index of the first block; later blocks follow consecutively. */
  public BlockListBuilder startIndex(int startIndex) {
    this.startIndex = startIndex;
    return this;
  }

  /** A bold body-size line, as section headers are usually set. */
  public BlockListBuilder header(String text) {
    return add(text, BOLD);
  }

  /** A large bold line, as the candidate's name usually is. */
  public BlockListBuilder title(String text) {
    return add(text, TITLE);
  }

  public BlockListBuilder line(String text) {
    return add(text, BlockStyle.BODY);
  }

  public BlockListBuilder lines(String... texts) {
    for (String text : texts) {
      line(text);
    }
    return this;
  }

  public BlockListBuilder add(String text, BlockStyle style) {
    int index = startIndex + blocks.size();
    BoundingBox bbox = new BoundingBox(50f, 40f + 14f * blocks.size(), 300f, 12f);
    blocks.add(new TextBlock(index, text, 1, bbox, style));
    return this;
  }

  public List<TextBlock> build() {
    return List.copyOf(blocks);
  }
}
