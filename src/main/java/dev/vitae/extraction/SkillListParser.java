package dev.vitae.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Splits the lines of a skills section into individual skill items. */
final class SkillListParser {

  private static final Pattern BULLET = Pattern.compile("^\\s*[•·▪◦●○■□*\\-–—>]\\s*");
  private static final Pattern CATEGORY = Pattern.compile("^([^:]{1,40}):\\s*(.+)$");
  private static final Pattern PARENTHETICAL = Pattern.compile("\\([^)]*\\)|\\[[^\\]]*\\]");
  private static final Pattern SEPARATOR = Pattern.compile("\\s*[,;|•·▪◦●]\\s*|\\s+/\\s+");
  private static final int MAX_CATEGORY_WORDS = 4;

  private SkillListParser() {}

  /**
   * Items of one line. A {@code Category: a, b} prefix is dropped; bracketed qualifiers such as
   * versions are removed.
   */
  static List<String> items(String line) {
    String text = BULLET.matcher(line).replaceFirst("");
    Matcher category = CATEGORY.matcher(text);
    if (category.matches()
        && category.group(1).strip().split("\\s+").length <= MAX_CATEGORY_WORDS) {
      text = category.group(2);
    }
    text = PARENTHETICAL.matcher(text).replaceAll(" ");
    List<String> items = new ArrayList<>();
    for (String item : SEPARATOR.split(text)) {
      String cleaned = FieldNormalizer.canonicalText(item);
      if (!cleaned.isEmpty() && cleaned.chars().anyMatch(Character::isLetter)) {
        items.add(cleaned);
      }
    }
    return items;
  }
}
