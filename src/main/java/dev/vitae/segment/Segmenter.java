package dev.vitae.segment;

import dev.vitae.document.TextBlock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits a document's blocks into labelled sections using layout and lexical cues.
 *
 * <p>A block is a header candidate when its whole text is a known header phrase ({@link
 * HeaderVocabulary}) and it is visually emphasized: bold, set in a larger font, written in
 * capitals, or terminated by a colon. Every header opens a section that runs until the next
 * header; blocks before the first header form an {@link SectionKind#OTHER} section.
 *
 * <p>When two header candidates follow each other with no body text between them, the later one
 * wins and the earlier one becomes a single-block OTHER section.
 *
 * <p>The output always partitions the input: every block belongs to exactly one section, in
 * order. An empty input yields one empty OTHER section. Segmentation never fails.
 */
@Component
public class Segmenter {

  private static final Logger log = LoggerFactory.getLogger(Segmenter.class);

  /**
   * Segments blocks into sections.
   *
   * @param blocks blocks in reading order
   * @return non-empty list of sections in document order, ids numbered from 0
   */
  public List<Section> segment(List<TextBlock> blocks) {
    if (blocks.isEmpty()) {
      return List.of(new Section(0, SectionKind.OTHER, null, List.of(), 0, 0));
    }

    List<Optional<SectionKind>> candidates = new ArrayList<>(blocks.size());
    for (TextBlock block : blocks) {
      candidates.add(headerKind(block));
    }

    List<Section> sections = new ArrayList<>();
    int start = 0;
    SectionKind kind = SectionKind.OTHER;
    @Nullable String heading = null;

    for (int i = 0; i < blocks.size(); i++) {
      Optional<SectionKind> candidate = candidates.get(i);
      if (candidate.isEmpty()) {
        continue;
      }
      close(sections, blocks, start, i, kind, heading);
      boolean followedByHeader = i + 1 < blocks.size() && candidates.get(i + 1).isPresent();
      if (followedByHeader) {
        log.debug(
            "Collapsing header '{}' followed directly by another header", blocks.get(i).text());
        close(sections, blocks, i, i + 1, SectionKind.OTHER, null);
        start = i + 1;
        kind = SectionKind.OTHER;
        heading = null;
      } else {
        start = i;
        kind = candidate.get();
        heading = blocks.get(i).text();
      }
    }
    close(sections, blocks, start, blocks.size(), kind, heading);

    log.debug("Segmented {} blocks into {} sections", blocks.size(), sections.size());
    return List.copyOf(sections);
  }

  /** Returns the section kind a block would open if it is a header candidate. */
  static Optional<SectionKind> headerKind(TextBlock block) {
    Optional<SectionKind> kind = HeaderVocabulary.lookup(block.text());
    if (kind.isEmpty()) {
      return Optional.empty();
    }
    String text = block.text().strip();
    boolean emphasized =
        block.style().isEmphasized() || isAllCaps(text) || text.endsWith(":");
    return emphasized ? kind : Optional.empty();
  }

  private static boolean isAllCaps(String text) {
    boolean hasLetter = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isLetter(c)) {
        hasLetter = true;
        if (Character.isLowerCase(c)) {
          return false;
        }
      }
    }
    return hasLetter;
  }

  private static void close(
      List<Section> sections,
      List<TextBlock> blocks,
      int start,
      int end,
      SectionKind kind,
      @Nullable String heading) {
    if (end <= start) {
      return;
    }
    sections.add(
        new Section(sections.size(), kind, heading, blocks.subList(start, end), start, end));
  }
}
