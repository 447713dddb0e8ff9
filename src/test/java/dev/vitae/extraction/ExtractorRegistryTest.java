package dev.vitae.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.vitae.fixture.SectionBuilder;
import dev.vitae.segment.SectionKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExtractorRegistryTest {

  private final Lexicons lexicons = Lexicons.defaults();

  @Test
  void selectsExtractorsByKindInRegistrationOrder() {
    ExtractorRegistry registry =
        new ExtractorRegistry(
            List.of(
                new ContactExtractor(),
                new DateRangeExtractor(),
                new OrganizationTitleExtractor(lexicons),
                new SkillTermExtractor(lexicons)));

    assertThat(
            registry.forSection(new SectionBuilder().kind(SectionKind.EXPERIENCE).build()))
        .extracting(EntityExtractor::id)
        .containsExactly("date-range", "org-title", "skill-term");
    assertThat(registry.forSection(new SectionBuilder().build()))
        .extracting(EntityExtractor::id)
        .containsExactly("contact");
    assertThat(registry.forSection(new SectionBuilder().kind(SectionKind.SKILLS).build()))
        .extracting(EntityExtractor::id)
        .containsExactly("skill-term");
  }

  @Test
  void rejectsDuplicateIds() {
    assertThatThrownBy(
            () -> new ExtractorRegistry(List.of(new ContactExtractor(), new ContactExtractor())))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("contact");
  }
}
