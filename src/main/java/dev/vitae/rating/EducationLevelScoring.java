package dev.vitae.rating;

import dev.vitae.synthesis.EducationEntry;
import dev.vitae.synthesis.ProfileRecord;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Scores the highest degree held: doctorate 1.0, master 0.8, bachelor 0.6, associate or diploma
 * 0.4, secondary school 0.2, nothing recognizable 0.
 */
@Component
public class EducationLevelScoring implements ScoringFunction {

  public static final String REF = "education_level";

  private record Level(Pattern pattern, double score) {}

  private static final List<Level> LEVELS =
      List.of(
          new Level(
              Pattern.compile(
                  "\\b(?:ph\\.?\\s?d|doctor(?:ate)?|d\\.?\\s?phil)\\b", Pattern.CASE_INSENSITIVE),
              1.0),
          new Level(
              Pattern.compile(
                  "\\b(?:master|m\\.?\\s?tech|m\\.?\\s?sc|mba|mca|m\\.\\s?s|m\\.\\s?e|m\\.\\s?a"
                      + "|ms|me|ma)\\b",
                  Pattern.CASE_INSENSITIVE),
              0.8),
          new Level(
              Pattern.compile(
                  "\\b(?:bachelor|b\\.?\\s?tech|b\\.?\\s?sc|bca|bba|b\\.\\s?s|b\\.\\s?e|b\\.\\s?a"
                      + "|bs|be|ba)\\b",
                  Pattern.CASE_INSENSITIVE),
              0.6),
          new Level(Pattern.compile("\\b(?:associate|diploma)", Pattern.CASE_INSENSITIVE), 0.4),
          new Level(
              Pattern.compile(
                  "\\b(?:high\\s+school|secondary|hsc|ssc|sslc|a-levels?|gcse)",
                  Pattern.CASE_INSENSITIVE),
              0.2));

  @Override
  public String ref() {
    return REF;
  }

  @Override
  public String contributingField() {
    return ProfileFields.EDUCATION;
  }

  @Override
  public double score(ProfileRecord profile, Map<String, Object> params) {
    double best = 0.0;
    for (EducationEntry entry : profile.education()) {
      if (entry.degree() != null) {
        best = Math.max(best, level(entry.degree().value()));
      }
    }
    return best;
  }

  static double level(String degree) {
    for (Level level : LEVELS) {
      if (level.pattern().matcher(degree).find()) {
        return level.score();
      }
    }
    return 0.0;
  }
}
