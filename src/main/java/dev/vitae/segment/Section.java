package dev.vitae.segment;

import dev.vitae.document.TextBlock;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * A labelled, contiguous run of blocks. The sections of a document partition its block sequence:
 * no gaps, no overlaps.
 *
 * @param id zero-based position of the section in document order; doubles as the document-order
 *     tie-breaker during synthesis
 * @param kind section label
 * @param heading text of the header block that opened the section; null for the leading section
 *     and for collapsed headers
 * @param blocks the section's blocks, in document order
 * @param startIndex block index of the first block (inclusive)
 * @param endIndex block index after the last block (exclusive); equals {@code startIndex} for an
 *     empty section
 */
public record Section(
    int id,
    SectionKind kind,
    @Nullable String heading,
    List<TextBlock> blocks,
    int startIndex,
    int endIndex) {

  public Section {
    Objects.requireNonNull(kind, "kind must not be null");
    blocks = List.copyOf(blocks);
    if (endIndex - startIndex != blocks.size()) {
      throw new IllegalArgumentException(
          "span [%d, %d) does not match %d blocks".formatted(startIndex, endIndex, blocks.size()));
    }
  }

  /** Block texts joined by newlines, header included. */
  public String text() {
    return blocks.stream().map(TextBlock::text).collect(Collectors.joining("\n"));
  }

  /** Blocks after the header block, or all blocks when the section has no header. */
  public List<TextBlock> bodyBlocks() {
    if (heading == null || blocks.isEmpty()) {
      return blocks;
    }
    return blocks.subList(1, blocks.size());
  }

  public boolean isEmpty() {
    return blocks.isEmpty();
  }
}
