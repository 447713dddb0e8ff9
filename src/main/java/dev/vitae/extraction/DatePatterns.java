package dev.vitae.extraction;

import java.util.regex.Pattern;

/** Regular expressions locating dates and date ranges inside a line of text. */
final class DatePatterns {

  private static final String MONTH =
      "(?:jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?"
          + "|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)\\.?";

  static final String DATE =
      "(?:"
          + "(?<!\\p{L})"
          + MONTH
          + ",?\\s*'?\\d{4}"
          + "|(?<!\\d)\\d{4}\\s*[/.\\-]\\s*\\d{1,2}(?!\\d)"
          + "|(?<!\\d)\\d{1,2}\\s*[/.\\-]\\s*\\d{4}(?!\\d)"
          + "|(?<!\\d)(?:19|20)\\d{2}(?!\\d))";

  static final String OPEN_END =
      "(?:present|current(?:ly)?|now|ongoing|today|till\\s+date|to\\s+date|till\\s+now)";

  private static final String SEPARATOR = "\\s*(?:-|–|—|~|to|until|till|through)\\s*";

  /** A start date, a separator, and an end date or open-ended marker; groups 1 and 2. */
  static final Pattern RANGE =
      Pattern.compile(
          "(" + DATE + ")" + SEPARATOR + "(" + DATE + "|" + OPEN_END + ")(?![\\p{L}\\d])",
          Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

  /** A single date anywhere in a line. */
  static final Pattern SINGLE =
      Pattern.compile(DATE + "(?![\\p{L}\\d])", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

  private DatePatterns() {}

  /** Removes every date range and single date from a line, leaving the surrounding words. */
  static String strip(String line) {
    String withoutRanges = RANGE.matcher(line).replaceAll(" ");
    String withoutDates = SINGLE.matcher(withoutRanges).replaceAll(" ");
    return withoutDates.replaceAll("[()\\[\\]]", " ").replaceAll("\\s+", " ").strip();
  }
}
