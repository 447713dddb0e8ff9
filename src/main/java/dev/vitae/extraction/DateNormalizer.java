package dev.vitae.extraction;

import java.time.DateTimeException;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes free-form résumé dates to {@code YYYY-MM} or {@link #PRESENT}.
 *
 * <p>Accepted shapes: month name and year ({@code Jan 2020}, {@code September 2019}), numeric month
 * and year in either order ({@code 01/2020}, {@code 2020-01}, {@code 2020.1}), a bare year, and
 * open-ended markers ({@code Present}, {@code Current}, {@code till date}, ...). A bare year
 * normalizes to January when it starts a range and to December when it ends one.
 */
public final class DateNormalizer {

  public static final String PRESENT = "PRESENT";

  static final int MIN_YEAR = 1950;
  static final int MAX_YEAR = 2100;

  private static final Map<String, Integer> MONTHS =
      Map.ofEntries(
          Map.entry("jan", 1),
          Map.entry("feb", 2),
          Map.entry("mar", 3),
          Map.entry("apr", 4),
          Map.entry("may", 5),
          Map.entry("jun", 6),
          Map.entry("jul", 7),
          Map.entry("aug", 8),
          Map.entry("sep", 9),
          Map.entry("oct", 10),
          Map.entry("nov", 11),
          Map.entry("dec", 12));

  private static final Pattern CANONICAL = Pattern.compile("(\\d{4})-(\\d{2})");
  private static final Pattern MONTH_NAME_YEAR =
      Pattern.compile("([a-z]{3,9})\\.?,?\\s*'?(\\d{4})");
  private static final Pattern MONTH_YEAR = Pattern.compile("(\\d{1,2})\\s*[/.\\-]\\s*(\\d{4})");
  private static final Pattern YEAR_MONTH = Pattern.compile("(\\d{4})\\s*[/.\\-]\\s*(\\d{1,2})");
  private static final Pattern YEAR = Pattern.compile("(\\d{4})");
  private static final Pattern OPEN_ENDED =
      Pattern.compile("present|current|currently|now|ongoing|today|till date|to date|till now");

  /** Orders canonical values chronologically, with {@link #PRESENT} after every month. */
  public static final Comparator<String> CHRONOLOGICAL =
      Comparator.comparing(DateNormalizer::sortKey);

  private DateNormalizer() {
    // static utility
  }

  /**
   * Normalizes a date string.
   *
   * @param raw the date as written
   * @param endOfRange whether the date closes a range (decides the month of a bare year)
   * @return {@code YYYY-MM}, {@link #PRESENT}, or empty when the text is not a date
   */
  public static Optional<String> normalize(String raw, boolean endOfRange) {
    if (raw == null) {
      return Optional.empty();
    }
    String text = raw.strip().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    if (text.isEmpty()) {
      return Optional.empty();
    }
    if (OPEN_ENDED.matcher(text).matches()) {
      return Optional.of(PRESENT);
    }
    Matcher m = CANONICAL.matcher(text);
    if (m.matches()) {
      return format(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }
    m = MONTH_NAME_YEAR.matcher(text);
    if (m.matches()) {
      Integer month = monthOf(m.group(1));
      return month == null ? Optional.empty() : format(Integer.parseInt(m.group(2)), month);
    }
    m = MONTH_YEAR.matcher(text);
    if (m.matches()) {
      return format(Integer.parseInt(m.group(2)), Integer.parseInt(m.group(1)));
    }
    m = YEAR_MONTH.matcher(text);
    if (m.matches()) {
      return format(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }
    m = YEAR.matcher(text);
    if (m.matches()) {
      return format(Integer.parseInt(m.group(1)), endOfRange ? 12 : 1);
    }
    return Optional.empty();
  }

  /** True when the raw date names a month, false when it is a bare year or open-ended. */
  public static boolean hasMonthPrecision(String raw) {
    String text = raw.strip().toLowerCase(Locale.ROOT);
    return !YEAR.matcher(text).matches() && !OPEN_ENDED.matcher(text).matches();
  }

  /**
   * Resolves a canonical value to a month.
   *
   * @param canonical {@code YYYY-MM} or {@link #PRESENT}
   * @param asOf the month {@link #PRESENT} stands for
   * @return the month, or empty when the value is not canonical
   */
  public static Optional<YearMonth> toYearMonth(String canonical, YearMonth asOf) {
    if (PRESENT.equals(canonical)) {
      return Optional.of(asOf);
    }
    Matcher m = CANONICAL.matcher(canonical);
    if (!m.matches()) {
      return Optional.empty();
    }
    try {
      return Optional.of(YearMonth.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))));
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }

  public static boolean isCanonical(String value) {
    return PRESENT.equals(value) || CANONICAL.matcher(value).matches();
  }

  private static Integer monthOf(String word) {
    if (word.length() < 3) {
      return null;
    }
    Integer month = MONTHS.get(word.substring(0, 3));
    if (month == null) {
      return null;
    }
    // Reject words that merely start like a month ("marketing", "decade").
    return MonthNames.isMonthWord(word) ? month : null;
  }

  private static Optional<String> format(int year, int month) {
    if (year < MIN_YEAR || year > MAX_YEAR || month < 1 || month > 12) {
      return Optional.empty();
    }
    return Optional.of("%04d-%02d".formatted(year, month));
  }

  private static String sortKey(String canonical) {
    return PRESENT.equals(canonical) ? "9999-99" : canonical;
  }

  /** Spellings accepted as month names. */
  static final class MonthNames {

    private static final Pattern WORD =
        Pattern.compile(
            "jan(uary)?|feb(ruary)?|mar(ch)?|apr(il)?|may|june?|july?|aug(ust)?"
                + "|sep(t(ember)?)?|oct(ober)?|nov(ember)?|dec(ember)?");

    private MonthNames() {}

    static boolean isMonthWord(String word) {
      return WORD.matcher(word).matches();
    }
  }
}
