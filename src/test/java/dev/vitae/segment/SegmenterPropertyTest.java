package dev.vitae.segment;

import static org.assertj.core.api.Assertions.assertThat;

import dev.vitae.document.BlockStyle;
import dev.vitae.document.FontSizeBucket;
import dev.vitae.document.TextBlock;
import dev.vitae.fixture.BlockListBuilder;
import java.util.ArrayList;
import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based tests for the partition guarantee of {@link Segmenter}: whatever mix of header
 * and body lines a document contains, its sections cover every block exactly once, in order.
 */
class SegmenterPropertyTest {

  private final Segmenter segmenter = new Segmenter();

  private record Line(String text, BlockStyle style) {}

  @Provide
  Arbitrary<List<TextBlock>> documents() {
    Arbitrary<String> texts =
        Arbitraries.oneOf(
            Arbitraries.of(
                "EXPERIENCE", "Education", "Skills:", "PROJECTS", "Summary", "Contact",
                "Certifications", "Work History"),
            Arbitraries.of(
                "Jane Doe", "Software Engineer at Google", "Java, SQL, Docker",
                "Jan 2020 - Present", "Stanford University", "jane@example.com",
                "• Built a payment platform"));
    Arbitrary<BlockStyle> styles =
        Arbitraries.of(
            BlockStyle.BODY,
            new BlockStyle(FontSizeBucket.BODY, true),
            new BlockStyle(FontSizeBucket.LARGE, false),
            new BlockStyle(FontSizeBucket.SMALL, false));
    return Combinators.combine(texts, styles)
        .as(Line::new)
        .list()
        .ofMinSize(0)
        .ofMaxSize(40)
        .map(
            lines -> {
              BlockListBuilder builder = new BlockListBuilder();
              lines.forEach(line -> builder.add(line.text(), line.style()));
              return builder.build();
            });
  }

  @Property
  void sectionsPartitionTheBlockSequence(@ForAll("documents") List<TextBlock> blocks) {
    List<Section> sections = segmenter.segment(blocks);

    assertThat(sections).isNotEmpty();
    List<TextBlock> covered = new ArrayList<>();
    int expectedStart = 0;
    for (int i = 0; i < sections.size(); i++) {
      Section section = sections.get(i);
      assertThat(section.id()).isEqualTo(i);
      assertThat(section.startIndex()).isEqualTo(expectedStart);
      expectedStart = section.endIndex();
      covered.addAll(section.blocks());
    }
    assertThat(expectedStart).isEqualTo(blocks.size());
    assertThat(covered).containsExactlyElementsOf(blocks);
  }

  @Property
  void onlyEmptyInputProducesAnEmptySection(@ForAll("documents") List<TextBlock> blocks) {
    List<Section> sections = segmenter.segment(blocks);

    if (blocks.isEmpty()) {
      assertThat(sections).singleElement().extracting(Section::isEmpty).isEqualTo(true);
    } else {
      assertThat(sections).noneMatch(Section::isEmpty);
    }
  }

  @Property
  void segmentationIsDeterministic(@ForAll("documents") List<TextBlock> blocks) {
    assertThat(segmenter.segment(blocks)).isEqualTo(segmenter.segment(blocks));
  }
}
