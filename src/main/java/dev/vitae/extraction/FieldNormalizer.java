package dev.vitae.extraction;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Field-specific normalization shared by the extractors and the synthesizer.
 *
 * <p>{@link #canonical} produces the value stored in a profile; it is idempotent, so the
 * synthesizer can re-apply it to spans that an extractor already normalized. {@link
 * #comparisonKey} is a coarser form used only to decide whether two values agree.
 */
public final class FieldNormalizer {

  private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s,;:|\\-–—•·]+$");
  private static final Pattern LEADING_PUNCTUATION = Pattern.compile("^[\\s,;:|\\-–—•·*▪◦]+");
  private static final Pattern NON_KEY_CHARS = Pattern.compile("[^\\p{L}\\p{Nd}+#]+");

  private static final Set<String> LEGAL_SUFFIXES =
      Set.of(
          "inc", "incorporated", "llc", "ltd", "limited", "corp", "corporation", "co", "company",
          "gmbh", "ag", "plc", "pvt", "private", "sa", "bv", "llp");

  private FieldNormalizer() {
    // static utility
  }

  /**
   * Canonical form of a value for a field.
   *
   * @param field the field the value belongs to
   * @param value the value as extracted
   * @return the canonical value; may be empty when nothing meaningful remains
   */
  public static String canonical(FieldType field, String value) {
    String text = value.strip();
    return switch (field) {
      case EMAIL -> canonicalEmail(text);
      case PHONE -> canonicalPhone(text);
      case LINKEDIN -> canonicalLinkedIn(text);
      case WEBSITE -> canonicalWebsite(text);
      case DATE_START -> DateNormalizer.normalize(text, false).orElse(text);
      case DATE_END -> DateNormalizer.normalize(text, true).orElse(text);
      case SKILL -> collapse(text);
      default -> canonicalText(text);
    };
  }

  /**
   * Coarse key under which two values of a field are considered equal.
   *
   * @param field the field the value belongs to
   * @param value the value as extracted
   * @return lower-case key without punctuation
   */
  public static String comparisonKey(FieldType field, String value) {
    String canonical = canonical(field, value);
    return switch (field) {
      case EMAIL, PHONE, LINKEDIN, WEBSITE, DATE_START, DATE_END ->
          canonical.toLowerCase(Locale.ROOT);
      case ORG, INSTITUTION -> dropLegalSuffixes(textKey(canonical));
      default -> textKey(canonical);
    };
  }

  /** Decomposes accented characters and removes the combining marks. */
  public static String deaccent(String text) {
    String decomposed = Normalizer.normalize(text, Normalizer.Form.NFKD);
    return Normalizer.normalize(
        COMBINING_MARKS.matcher(decomposed).replaceAll(""), Normalizer.Form.NFC);
  }

  static String collapse(String text) {
    return WHITESPACE.matcher(text).replaceAll(" ").strip();
  }

  static String canonicalText(String text) {
    String cleaned = collapse(deaccent(text));
    cleaned = LEADING_PUNCTUATION.matcher(cleaned).replaceAll("");
    cleaned = TRAILING_PUNCTUATION.matcher(cleaned).replaceAll("");
    return cleaned.strip();
  }

  private static String textKey(String canonical) {
    return NON_KEY_CHARS.matcher(canonical.toLowerCase(Locale.ROOT)).replaceAll(" ").strip();
  }

  private static String dropLegalSuffixes(String key) {
    String[] tokens = key.split(" ");
    int end = tokens.length;
    while (end > 1 && LEGAL_SUFFIXES.contains(tokens[end - 1])) {
      end--;
    }
    return String.join(" ", Arrays.copyOf(tokens, end));
  }

  /** Lower-cases the address and drops dots from the local part. */
  private static String canonicalEmail(String text) {
    String email = text.toLowerCase(Locale.ROOT);
    if (email.startsWith("mailto:")) {
      email = email.substring("mailto:".length());
    }
    email = email.replaceAll("\\s+", "");
    int at = email.indexOf('@');
    if (at <= 0) {
      return email;
    }
    String local = email.substring(0, at).replace(".", "");
    return local + email.substring(at);
  }

  private static String canonicalPhone(String text) {
    String digits = text.replaceAll("\\D", "");
    boolean international = text.strip().startsWith("+") || text.strip().startsWith("00");
    if (text.strip().startsWith("00") && digits.startsWith("00")) {
      digits = digits.substring(2);
    }
    return international ? "+" + digits : digits;
  }

  private static String canonicalLinkedIn(String text) {
    String url = stripScheme(text.toLowerCase(Locale.ROOT));
    url = url.replaceAll("/+$", "");
    int index = url.indexOf("linkedin.com/in/");
    if (index >= 0) {
      String handle = url.substring(index + "linkedin.com/in/".length());
      int slash = handle.indexOf('/');
      if (slash >= 0) {
        handle = handle.substring(0, slash);
      }
      return "linkedin.com/in/" + handle;
    }
    return url;
  }

  private static String canonicalWebsite(String text) {
    return stripScheme(text.toLowerCase(Locale.ROOT)).replaceAll("/+$", "");
  }

  private static String stripScheme(String url) {
    String stripped = url.strip().replaceFirst("^https?://", "");
    return stripped.startsWith("www.") ? stripped.substring(4) : stripped;
  }
}
