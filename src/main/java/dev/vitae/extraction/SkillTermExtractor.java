package dev.vitae.extraction;

import dev.vitae.document.TextBlock;
import dev.vitae.segment.Section;
import dev.vitae.segment.SectionKind;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Extracts skill terms.
 *
 * <p>In a skills section every list item is a candidate: items the lexicon knows score {@link
 * #KNOWN_TERM} under their canonical spelling, short unknown items score {@link #UNKNOWN_ITEM}, and
 * longer phrases contribute the known terms they mention. In summary and experience sections only
 * lexicon mentions are proposed, at {@link #MENTION}.
 */
@Component
@Order(4)
public class SkillTermExtractor implements EntityExtractor {

  public static final String ID = "skill-term";

  static final double KNOWN_TERM = 0.95;
  static final double PHRASE_MENTION = 0.8;
  static final double UNKNOWN_ITEM = 0.6;
  static final double MENTION = 0.5;

  private static final int MAX_ITEM_WORDS = 4;
  private static final int MAX_ITEM_LENGTH = 40;

  private final SkillLexicon lexicon;

  public SkillTermExtractor(Lexicons lexicons) {
    this.lexicon = lexicons.skills();
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public Set<SectionKind> supportedKinds() {
    return EnumSet.of(SectionKind.SKILLS, SectionKind.SUMMARY, SectionKind.EXPERIENCE);
  }

  @Override
  public Set<FieldType> emittedFields() {
    return EnumSet.of(FieldType.SKILL);
  }

  @Override
  public List<CandidateSpan> extract(Section section) {
    SpanCollector spans = new SpanCollector(ID, section);
    for (TextBlock block : section.bodyBlocks()) {
      if (section.kind() == SectionKind.SKILLS) {
        extractList(spans, block);
      } else {
        Set<String> seen = new LinkedHashSet<>();
        for (String term : lexicon.findMentions(block.text())) {
          if (seen.add(term)) {
            spans.add(FieldType.SKILL, term, block, MENTION, term);
          }
        }
      }
    }
    return spans.spans();
  }

  private void extractList(SpanCollector spans, TextBlock block) {
    Set<String> seen = new LinkedHashSet<>();
    for (String item : SkillListParser.items(block.text())) {
      Optional<String> known = lexicon.canonicalize(item);
      if (known.isPresent()) {
        if (seen.add(known.get())) {
          spans.add(FieldType.SKILL, known.get(), block, KNOWN_TERM, item);
        }
      } else if (isShortItem(item)) {
        if (seen.add(item)) {
          spans.add(
              FieldType.SKILL,
              FieldNormalizer.canonical(FieldType.SKILL, item),
              block,
              UNKNOWN_ITEM,
              item);
        }
      } else {
        for (String term : lexicon.findMentions(item)) {
          if (seen.add(term)) {
            spans.add(FieldType.SKILL, term, block, PHRASE_MENTION, item);
          }
        }
      }
    }
  }

  static boolean isShortItem(String item) {
    return item.length() <= MAX_ITEM_LENGTH && item.split("\\s+").length <= MAX_ITEM_WORDS;
  }
}
