package dev.vitae.segment;

import static org.assertj.core.api.Assertions.assertThat;

import dev.vitae.document.TextBlock;
import dev.vitae.fixture.BlockListBuilder;
import java.util.List;
import org.junit.jupiter.api.Test;

class SegmenterTest {

  private final Segmenter segmenter = new Segmenter();

  @Test
  void headersOpenSectionsAndLeadingBlocksFormOtherSection() {
    List<TextBlock> blocks =
        new BlockListBuilder()
            .title("Jane Doe")
            .line("jane.doe@example.com")
            .header("EXPERIENCE")
            .line("Software Engineer at Google")
            .header("Education")
            .line("Stanford University")
            .line("Skills:")
            .line("Java, SQL")
            .build();

    List<Section> sections = segmenter.segment(blocks);

    assertThat(sections).extracting(Section::kind)
        .containsExactly(
            SectionKind.OTHER, SectionKind.EXPERIENCE, SectionKind.EDUCATION, SectionKind.SKILLS);
    assertThat(sections).extracting(Section::heading)
        .containsExactly(null, "EXPERIENCE", "Education", "Skills:");
    assertThat(sections).extracting(Section::startIndex).containsExactly(0, 2, 4, 6);
    assertThat(sections).extracting(Section::endIndex).containsExactly(2, 4, 6, 8);
    assertThat(sections).extracting(Section::id).containsExactly(0, 1, 2, 3);
  }

  @Test
  void headerBlockIsFirstBlockOfItsSection() {
    List<TextBlock> blocks =
        new BlockListBuilder().header("Technical Skills").line("Java").line("Kotlin").build();

    Section skills = segmenter.segment(blocks).get(0);

    assertThat(skills.kind()).isEqualTo(SectionKind.SKILLS);
    assertThat(skills.blocks().get(0).text()).isEqualTo("Technical Skills");
    assertThat(skills.bodyBlocks()).extracting(TextBlock::text).containsExactly("Java", "Kotlin");
  }

  @Test
  void headerPhraseWithoutEmphasisIsBodyText() {
    List<TextBlock> blocks =
        new BlockListBuilder().line("Jane Doe").line("Experience").line("Java").build();

    List<Section> sections = segmenter.segment(blocks);

    assertThat(sections).singleElement().satisfies(section -> {
      assertThat(section.kind()).isEqualTo(SectionKind.OTHER);
      assertThat(section.blocks()).hasSize(3);
    });
  }

  @Test
  void lineThatOnlyStartsWithHeaderPhraseIsNotHeader() {
    List<TextBlock> blocks =
        new BlockListBuilder().header("Experience with Kafka and Spark").line("Java").build();

    assertThat(segmenter.segment(blocks)).singleElement()
        .extracting(Section::kind)
        .isEqualTo(SectionKind.OTHER);
  }

  @Test
  void earlierOfTwoAdjacentHeadersCollapsesIntoOtherSection() {
    List<TextBlock> blocks =
        new BlockListBuilder()
            .line("Jane Doe")
            .header("PROJECTS")
            .header("WORK EXPERIENCE")
            .line("Analyst at Deloitte")
            .build();

    List<Section> sections = segmenter.segment(blocks);

    assertThat(sections).extracting(Section::kind)
        .containsExactly(SectionKind.OTHER, SectionKind.OTHER, SectionKind.EXPERIENCE);
    assertThat(sections.get(1).blocks()).extracting(TextBlock::text).containsExactly("PROJECTS");
    assertThat(sections.get(1).heading()).isNull();
    assertThat(sections.get(2).heading()).isEqualTo("WORK EXPERIENCE");
  }

  @Test
  void unmodelledHeadersOpenOtherSections() {
    List<TextBlock> blocks =
        new BlockListBuilder()
            .header("SKILLS")
            .line("Java")
            .header("CERTIFICATIONS")
            .line("AWS Certified Developer")
            .build();

    List<Section> sections = segmenter.segment(blocks);

    assertThat(sections).extracting(Section::kind)
        .containsExactly(SectionKind.SKILLS, SectionKind.OTHER);
    assertThat(sections.get(1).heading()).isEqualTo("CERTIFICATIONS");
  }

  @Test
  void emptyInputYieldsOneEmptyOtherSection() {
    List<Section> sections = segmenter.segment(List.of());

    assertThat(sections).singleElement().satisfies(section -> {
      assertThat(section.kind()).isEqualTo(SectionKind.OTHER);
      assertThat(section.isEmpty()).isTrue();
      assertThat(section.startIndex()).isZero();
      assertThat(section.endIndex()).isZero();
    });
  }

  @Test
  void headerVocabularyIgnoresCaseDecorationAndAmpersand() {
    assertThat(HeaderVocabulary.lookup("WORK EXPERIENCE:")).contains(SectionKind.EXPERIENCE);
    assertThat(HeaderVocabulary.lookup("  Tools & Technologies ")).contains(SectionKind.SKILLS);
    assertThat(HeaderVocabulary.lookup("• Education •")).contains(SectionKind.EDUCATION);
    assertThat(HeaderVocabulary.lookup("Experience with Kafka")).isEmpty();
    assertThat(HeaderVocabulary.lookup("")).isEmpty();
  }
}
