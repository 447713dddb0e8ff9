package dev.vitae.extraction;

import dev.vitae.document.TextBlock;
import dev.vitae.segment.HeaderVocabulary;
import dev.vitae.segment.Section;
import dev.vitae.segment.SectionKind;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Extracts contact details: name, email, phone, LinkedIn profile and personal website.
 *
 * <p>Strict pattern matches score high (an RFC-shaped email address scores 1.0); obfuscated or
 * loosely formatted matches score lower. A personal name is only proposed for the leading section
 * of the document or a contact section, from a line that looks like a name.
 */
@Component
@Order(1)
public class ContactExtractor implements EntityExtractor {

  public static final String ID = "contact";

  static final double STRICT_EMAIL = 1.0;
  static final double OBFUSCATED_EMAIL = 0.6;
  static final double FORMATTED_PHONE = 0.9;
  static final double LOOSE_PHONE = 0.6;
  static final double LINKEDIN = 0.95;
  static final double WEBSITE = 0.7;
  static final double LABELLED_NAME = 0.9;
  static final double EMPHASIZED_NAME = 0.8;
  static final double PLAIN_NAME = 0.5;

  private static final Pattern EMAIL =
      Pattern.compile("(?<![\\w.+-])[\\w.%+-]+@[\\w-]+(?:\\.[\\w-]+)*\\.[A-Za-z]{2,}(?![\\w-])");
  private static final Pattern OBFUSCATED_EMAIL_PATTERN =
      Pattern.compile(
          "([\\w.+-]+)\\s*[\\[(]\\s*at\\s*[\\])]\\s*"
              + "([\\w-]+(?:\\s*(?:[\\[(]\\s*dot\\s*[\\])]|\\.)\\s*[\\w-]+)+)",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern OBFUSCATED_DOT =
      Pattern.compile("\\s*[\\[(]\\s*dot\\s*[\\])]\\s*", Pattern.CASE_INSENSITIVE);
  private static final Pattern PHONE =
      Pattern.compile("(?<![\\w+])(\\+|00)?\\d[\\d\\s().-]{6,}\\d(?!\\w)");
  private static final Pattern PHONE_LABEL =
      Pattern.compile("\\b(?:phone|mobile|mob|tel|cell|contact)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern LINKEDIN_URL =
      Pattern.compile(
          "(?:https?://)?(?:[a-z]{2,3}\\.)?linkedin\\.com/in/[\\w-]+/?", Pattern.CASE_INSENSITIVE);
  private static final Pattern WEBSITE_URL =
      Pattern.compile(
          "(?:https?://|www\\.)[^\\s,;|()<>]+"
              + "|(?<![\\w@.])(?:github|gitlab|bitbucket)\\.(?:com|org)/[\\w.-]+",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern NAME_LABEL =
      Pattern.compile("^(?:full\\s+)?name\\s*[:\\-]\\s*(.+)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern NAME_WORD = Pattern.compile("\\p{Lu}[\\p{L}'’.-]*");

  private static final int NAME_SEARCH_DEPTH = 3;

  @Override
  public String id() {
    return ID;
  }

  @Override
  public Set<SectionKind> supportedKinds() {
    return EnumSet.of(SectionKind.CONTACT, SectionKind.OTHER);
  }

  @Override
  public Set<FieldType> emittedFields() {
    return EnumSet.of(
        FieldType.NAME, FieldType.EMAIL, FieldType.PHONE, FieldType.LINKEDIN, FieldType.WEBSITE);
  }

  @Override
  public List<CandidateSpan> extract(Section section) {
    SpanCollector spans = new SpanCollector(ID, section);
    boolean nameFound = false;
    int inspected = 0;
    boolean mayHoldName = section.id() == 0 || section.kind() == SectionKind.CONTACT;
    for (TextBlock block : section.bodyBlocks()) {
      String line = block.text();
      boolean hasContactDetail = extractDetails(spans, block, line);
      if (mayHoldName && !nameFound && inspected < NAME_SEARCH_DEPTH) {
        nameFound = extractName(spans, block, line, hasContactDetail);
        inspected++;
      }
    }
    return spans.spans();
  }

  private boolean extractDetails(SpanCollector spans, TextBlock block, String line) {
    int before = spans.size();
    Matcher email = EMAIL.matcher(line);
    while (email.find()) {
      spans.add(
          FieldType.EMAIL,
          FieldNormalizer.canonical(FieldType.EMAIL, email.group()),
          block,
          STRICT_EMAIL,
          email.group());
    }
    if (spans.size() == before) {
      Matcher obfuscated = OBFUSCATED_EMAIL_PATTERN.matcher(line);
      while (obfuscated.find()) {
        String domain = OBFUSCATED_DOT.matcher(obfuscated.group(2)).replaceAll(".");
        String address = obfuscated.group(1) + "@" + domain.replaceAll("\\s+", "");
        spans.add(
            FieldType.EMAIL,
            FieldNormalizer.canonical(FieldType.EMAIL, address),
            block,
            OBFUSCATED_EMAIL,
            obfuscated.group());
      }
    }

    String withoutUrls = LINKEDIN_URL.matcher(line).replaceAll(" ");
    Matcher linkedIn = LINKEDIN_URL.matcher(line);
    while (linkedIn.find()) {
      spans.add(
          FieldType.LINKEDIN,
          FieldNormalizer.canonical(FieldType.LINKEDIN, linkedIn.group()),
          block,
          LINKEDIN,
          linkedIn.group());
    }
    Matcher website = WEBSITE_URL.matcher(withoutUrls);
    while (website.find()) {
      String url = website.group().replaceAll("[.,;:]+$", "");
      spans.add(
          FieldType.WEBSITE,
          FieldNormalizer.canonical(FieldType.WEBSITE, url),
          block,
          WEBSITE,
          url);
    }

    String withoutEmails =
        EMAIL.matcher(WEBSITE_URL.matcher(withoutUrls).replaceAll(" ")).replaceAll(" ");
    Matcher phone = PHONE.matcher(withoutEmails);
    while (phone.find()) {
      String raw = phone.group();
      if (DatePatterns.RANGE.matcher(raw).find()) {
        continue;
      }
      int digits = raw.replaceAll("\\D", "").length();
      if (digits < 10 || digits > 15) {
        continue;
      }
      boolean formatted = phone.group(1) != null || PHONE_LABEL.matcher(line).find();
      spans.add(
          FieldType.PHONE,
          FieldNormalizer.canonical(FieldType.PHONE, raw),
          block,
          formatted ? FORMATTED_PHONE : LOOSE_PHONE,
          raw);
    }
    return spans.size() > before;
  }

  private boolean extractName(
      SpanCollector spans, TextBlock block, String line, boolean hasContactDetail) {
    Matcher labelled = NAME_LABEL.matcher(line.strip());
    if (labelled.matches() && looksLikeName(labelled.group(1))) {
      spans.add(
          FieldType.NAME,
          FieldNormalizer.canonical(FieldType.NAME, labelled.group(1)),
          block,
          LABELLED_NAME,
          line);
      return true;
    }
    if (hasContactDetail || !looksLikeName(line)) {
      return false;
    }
    double confidence = block.style().isEmphasized() ? EMPHASIZED_NAME : PLAIN_NAME;
    spans.add(
        FieldType.NAME, FieldNormalizer.canonical(FieldType.NAME, line), block, confidence, line);
    return true;
  }

  /** Two to four capitalized words, no digits, and not a section heading. */
  static boolean looksLikeName(String text) {
    String candidate = text.strip();
    if (candidate.isEmpty() || candidate.matches(".*[\\d@/:|,].*")) {
      return false;
    }
    if (HeaderVocabulary.lookup(candidate).isPresent()) {
      return false;
    }
    String[] words = candidate.split("\\s+");
    if (words.length < 2 || words.length > 4) {
      return false;
    }
    for (String word : words) {
      if (!NAME_WORD.matcher(word).matches()) {
        return false;
      }
    }
    return !candidate.toLowerCase(Locale.ROOT).matches(".*\\b(?:resume|curriculum|vitae|cv)\\b.*");
  }
}
