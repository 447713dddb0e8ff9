package dev.vitae.segment;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps résumé section header phrases to section kinds.
 *
 * <p>A phrase matches only when it is the entire (normalized) text of a line: "Experience" and
 * "WORK EXPERIENCE:" match, "Experience with Kafka" does not. Headers of sections the pipeline
 * does not model (projects, awards, ...) map to {@link SectionKind#OTHER}.
 */
public final class HeaderVocabulary {

  static final int MAX_HEADER_WORDS = 5;

  private static final Map<String, SectionKind> PHRASES =
      Map.ofEntries(
          Map.entry("contact", SectionKind.CONTACT),
          Map.entry("contact information", SectionKind.CONTACT),
          Map.entry("contact details", SectionKind.CONTACT),
          Map.entry("personal details", SectionKind.CONTACT),
          Map.entry("personal information", SectionKind.CONTACT),
          Map.entry("summary", SectionKind.SUMMARY),
          Map.entry("professional summary", SectionKind.SUMMARY),
          Map.entry("career summary", SectionKind.SUMMARY),
          Map.entry("profile", SectionKind.SUMMARY),
          Map.entry("professional profile", SectionKind.SUMMARY),
          Map.entry("objective", SectionKind.SUMMARY),
          Map.entry("career objective", SectionKind.SUMMARY),
          Map.entry("about me", SectionKind.SUMMARY),
          Map.entry("education", SectionKind.EDUCATION),
          Map.entry("education and training", SectionKind.EDUCATION),
          Map.entry("academic background", SectionKind.EDUCATION),
          Map.entry("academic qualifications", SectionKind.EDUCATION),
          Map.entry("qualifications", SectionKind.EDUCATION),
          Map.entry("experience", SectionKind.EXPERIENCE),
          Map.entry("work experience", SectionKind.EXPERIENCE),
          Map.entry("professional experience", SectionKind.EXPERIENCE),
          Map.entry("employment", SectionKind.EXPERIENCE),
          Map.entry("employment history", SectionKind.EXPERIENCE),
          Map.entry("work history", SectionKind.EXPERIENCE),
          Map.entry("career history", SectionKind.EXPERIENCE),
          Map.entry("relevant experience", SectionKind.EXPERIENCE),
          Map.entry("skills", SectionKind.SKILLS),
          Map.entry("technical skills", SectionKind.SKILLS),
          Map.entry("additional skills", SectionKind.SKILLS),
          Map.entry("core competencies", SectionKind.SKILLS),
          Map.entry("competencies", SectionKind.SKILLS),
          Map.entry("technologies", SectionKind.SKILLS),
          Map.entry("tools and technologies", SectionKind.SKILLS),
          Map.entry("skills and tools", SectionKind.SKILLS),
          Map.entry("projects", SectionKind.OTHER),
          Map.entry("personal projects", SectionKind.OTHER),
          Map.entry("awards", SectionKind.OTHER),
          Map.entry("honors and awards", SectionKind.OTHER),
          Map.entry("certifications", SectionKind.OTHER),
          Map.entry("certificates", SectionKind.OTHER),
          Map.entry("publications", SectionKind.OTHER),
          Map.entry("languages", SectionKind.OTHER),
          Map.entry("interests", SectionKind.OTHER),
          Map.entry("hobbies", SectionKind.OTHER),
          Map.entry("volunteering", SectionKind.OTHER),
          Map.entry("references", SectionKind.OTHER),
          Map.entry("additional information", SectionKind.OTHER));

  private HeaderVocabulary() {
    // static utility
  }

  /**
   * Looks up the section kind named by a candidate header line.
   *
   * @param line the full text of a block
   * @return the kind, or empty when the line is not a known header phrase
   */
  public static Optional<SectionKind> lookup(String line) {
    String normalized = normalize(line);
    if (normalized.isEmpty() || normalized.split(" ").length > MAX_HEADER_WORDS) {
      return Optional.empty();
    }
    return Optional.ofNullable(PHRASES.get(normalized));
  }

  /** Lower-cases, folds "&amp;" to "and", and strips decoration such as colons and bullets. */
  static String normalize(String line) {
    String folded = Normalizer.normalize(line, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
    folded = folded.replace("&", " and ");
    folded = folded.replaceAll("[^\\p{L}\\s]", " ");
    return folded.replaceAll("\\s+", " ").strip();
  }
}
