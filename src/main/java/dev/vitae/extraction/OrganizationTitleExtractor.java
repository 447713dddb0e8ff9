package dev.vitae.extraction;

import dev.vitae.document.TextBlock;
import dev.vitae.segment.Section;
import dev.vitae.segment.SectionKind;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Extracts who and what from entry headlines: organization and job title in experience sections,
 * institution and degree in education sections. Bullet and prose lines of an experience section
 * become description candidates.
 *
 * <p>Organization confidence is the lexicon similarity when the name is known, {@link
 * #ORG_SUFFIX} when the name carries a company suffix ("Ltd", "Technologies"), and {@link
 * #ORG_POSITIONAL} when only its position in the headline suggests it.
 */
@Component
@Order(3)
public class OrganizationTitleExtractor implements EntityExtractor {

  public static final String ID = "org-title";

  static final double ORG_SUFFIX = 0.7;
  static final double ORG_POSITIONAL = 0.6;
  static final double TITLE_KEYWORD = 0.8;
  static final double TITLE_POSITIONAL = 0.5;
  static final double DESCRIPTION = 0.6;
  static final double DEGREE = 0.9;
  static final double INSTITUTION_KEYWORD = 0.85;

  private static final int MAX_HEADLINE_WORDS = 12;
  private static final int MAX_HEADLINE_LENGTH = 90;

  private static final Pattern BULLET = Pattern.compile("^\\s*[•·▪◦●○■□*\\-–—>]\\s*");
  private static final Pattern AT_SEPARATOR =
      Pattern.compile("\\s+(?:at|@)\\s+|\\s*@\\s*", Pattern.CASE_INSENSITIVE);
  private static final Pattern PART_SEPARATOR = Pattern.compile("\\s*[|,–—]\\s*|\\s+-\\s+");

  private static final Pattern TITLE_WORDS =
      Pattern.compile(
          "\\b(?:engineer|developer|programmer|manager|intern|internship|analyst|consultant"
              + "|architect|lead|director|scientist|designer|administrator|specialist|officer"
              + "|associate|head|president|founder|co-founder|tester|trainee|executive"
              + "|coordinator|researcher|assistant|technician|supervisor|cto|ceo|cfo|vp"
              + "|sde|swe|devops|fellow|professor|lecturer|teacher)\\b",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern ORG_WORDS =
      Pattern.compile(
          "\\b(?:inc|incorporated|llc|ltd|limited|corp|corporation|company|co|gmbh|ag|plc|pvt"
              + "|llp|technologies|technology|solutions|systems|labs|software|services|group"
              + "|consulting|bank|networks|industries|enterprises|ventures|studios"
              + "|partners)\\b\\.?",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern DEGREE_ABBREVIATION =
      Pattern.compile(
          "(?<![\\p{L}])(?:B\\.?\\s?Tech|M\\.?\\s?Tech|B\\.\\s?E\\.?|M\\.\\s?E\\.?"
              + "|B\\.?\\s?Sc|M\\.?\\s?Sc|B\\.\\s?S\\.?|M\\.\\s?S\\.?|B\\.\\s?A\\.?|M\\.\\s?A\\.?"
              + "|BCA|MCA|MBA|BBA|Ph\\.?\\s?D"
              + "|BS|MS|BA|MA|BE|ME)(?![\\p{L}])");
  private static final Pattern DEGREE_PHRASE =
      Pattern.compile(
          "\\b(?:bachelor|master|doctor(?:ate)?|associate(?:'s)?\\s+degree|diploma"
              + "|higher\\s+secondary|senior\\s+secondary|high\\s+school|secondary\\s+school"
              + "|hsc|ssc|sslc|a-levels?|gcse)",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern INSTITUTION_WORDS =
      Pattern.compile(
          "\\b(?:university|universit[eéä]t|college|school|institute|institution|academy"
              + "|polytechnic|iit|nit|cusat|conservatory|faculty)\\b",
          Pattern.CASE_INSENSITIVE);

  private final NameLexicon organizations;
  private final NameLexicon institutions;

  public OrganizationTitleExtractor(Lexicons lexicons) {
    this.organizations = lexicons.organizations();
    this.institutions = lexicons.institutions();
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public Set<SectionKind> supportedKinds() {
    return EnumSet.of(SectionKind.EDUCATION, SectionKind.EXPERIENCE);
  }

  @Override
  public Set<FieldType> emittedFields() {
    return EnumSet.of(
        FieldType.ORG,
        FieldType.TITLE,
        FieldType.DESCRIPTION,
        FieldType.INSTITUTION,
        FieldType.DEGREE);
  }

  @Override
  public List<CandidateSpan> extract(Section section) {
    SpanCollector spans = new SpanCollector(ID, section);
    for (TextBlock block : section.bodyBlocks()) {
      if (section.kind() == SectionKind.EDUCATION) {
        extractEducation(spans, block);
      } else {
        extractExperience(spans, block);
      }
    }
    return spans.spans();
  }

  private void extractExperience(SpanCollector spans, TextBlock block) {
    String line = block.text();
    if (isProse(line)) {
      String text = BULLET.matcher(line).replaceFirst("");
      spans.add(
          FieldType.DESCRIPTION,
          FieldNormalizer.canonical(FieldType.DESCRIPTION, text),
          block,
          DESCRIPTION,
          line);
      return;
    }
    String headline = DatePatterns.strip(line);
    if (headline.isEmpty()) {
      return;
    }

    String[] around = AT_SEPARATOR.split(headline, 2);
    if (around.length == 2 && !around[0].isBlank() && !around[1].isBlank()) {
      String title = firstPart(around[0]);
      String org = firstPart(around[1]);
      emitTitle(spans, block, title, hasTitleWord(title) ? TITLE_KEYWORD : TITLE_POSITIONAL);
      emitOrganization(spans, block, org, organizationConfidence(org).orElse(ORG_POSITIONAL));
      return;
    }

    List<String> parts = parts(headline);
    String title = null;
    String org = null;
    double orgConfidence = 0.0;
    List<String> unlabelled = new ArrayList<>();
    for (String part : parts) {
      Optional<NameLexicon.Match> known = organizations.match(part);
      if (org == null && known.isPresent()) {
        org = part;
        orgConfidence = known.get().similarity();
      } else if (title == null && hasTitleWord(part)) {
        title = part;
      } else if (org == null && ORG_WORDS.matcher(part).find()) {
        org = part;
        orgConfidence = ORG_SUFFIX;
      } else {
        unlabelled.add(part);
      }
    }
    double titleConfidence = TITLE_KEYWORD;
    if (org == null && !unlabelled.isEmpty()) {
      org = unlabelled.remove(0);
      orgConfidence = ORG_POSITIONAL;
    }
    if (title == null && org != null && !unlabelled.isEmpty() && parts.size() > 1) {
      title = unlabelled.remove(0);
      titleConfidence = TITLE_POSITIONAL;
    }
    if (title != null) {
      emitTitle(spans, block, title, titleConfidence);
    }
    if (org != null) {
      emitOrganization(spans, block, org, orgConfidence);
    }
  }

  private void extractEducation(SpanCollector spans, TextBlock block) {
    String headline = DatePatterns.strip(BULLET.matcher(block.text()).replaceFirst(""));
    if (headline.isEmpty()) {
      return;
    }
    for (String part : educationParts(headline)) {
      if (isDegree(part)) {
        spans.add(
            FieldType.DEGREE,
            FieldNormalizer.canonical(FieldType.DEGREE, part),
            block,
            DEGREE,
            part);
        continue;
      }
      Optional<NameLexicon.Match> known = institutions.match(part);
      if (known.isPresent()) {
        spans.add(
            FieldType.INSTITUTION,
            FieldNormalizer.canonical(FieldType.INSTITUTION, known.get().canonical()),
            block,
            known.get().similarity(),
            part);
      } else if (INSTITUTION_WORDS.matcher(part).find()) {
        spans.add(
            FieldType.INSTITUTION,
            FieldNormalizer.canonical(FieldType.INSTITUTION, part),
            block,
            INSTITUTION_KEYWORD,
            part);
      }
    }
  }

  private void emitTitle(SpanCollector spans, TextBlock block, String title, double confidence) {
    spans.add(
        FieldType.TITLE,
        FieldNormalizer.canonical(FieldType.TITLE, title),
        block,
        confidence,
        title);
  }

  private void emitOrganization(
      SpanCollector spans, TextBlock block, String org, double confidence) {
    String value = organizations.match(org).map(NameLexicon.Match::canonical).orElse(org);
    spans.add(
        FieldType.ORG, FieldNormalizer.canonical(FieldType.ORG, value), block, confidence, org);
  }

  /** Lexicon similarity, or the suffix score, or empty when nothing marks the text as a company. */
  private Optional<Double> organizationConfidence(String text) {
    Optional<NameLexicon.Match> known = organizations.match(text);
    if (known.isPresent()) {
      return Optional.of(known.get().similarity());
    }
    return ORG_WORDS.matcher(text).find() ? Optional.of(ORG_SUFFIX) : Optional.empty();
  }

  static boolean isDegree(String text) {
    return DEGREE_ABBREVIATION.matcher(text).find() || DEGREE_PHRASE.matcher(text).find();
  }

  static boolean hasTitleWord(String text) {
    return TITLE_WORDS.matcher(text).find();
  }

  /** Bullet lines, sentences, and lines too long to be a headline. */
  static boolean isProse(String line) {
    if (BULLET.matcher(line).find()) {
      return true;
    }
    String stripped = line.strip();
    int words = stripped.split("\\s+").length;
    if (words > MAX_HEADLINE_WORDS || stripped.length() > MAX_HEADLINE_LENGTH) {
      return true;
    }
    return Character.isLowerCase(stripped.charAt(0)) || (stripped.endsWith(".") && words >= 4);
  }

  private static List<String> parts(String headline) {
    return Arrays.stream(PART_SEPARATOR.split(headline))
        .map(String::strip)
        .filter(part -> part.chars().anyMatch(Character::isLetter))
        .toList();
  }

  private static List<String> educationParts(String headline) {
    List<String> parts = new ArrayList<>();
    for (String part : parts(headline)) {
      for (String piece : AT_SEPARATOR.split(part)) {
        if (piece.chars().anyMatch(Character::isLetter)) {
          parts.add(piece.strip());
        }
      }
    }
    return parts;
  }

  private static String firstPart(String text) {
    List<String> parts = parts(text);
    return parts.isEmpty() ? text.strip() : parts.get(0);
  }
}
