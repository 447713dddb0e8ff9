package dev.vitae.rating;

import dev.vitae.extraction.FieldNormalizer;
import dev.vitae.extraction.FieldType;
import dev.vitae.synthesis.ProfileRecord;
import dev.vitae.synthesis.SkillEntry;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** Scores the share of target skills the profile lists, compared case-insensitively. */
@Component
public class SkillCoverageScoring implements ScoringFunction {

  public static final String REF = "skill_coverage";
  static final String TARGET_SKILLS = "target_skills";

  @Override
  public String ref() {
    return REF;
  }

  @Override
  public String contributingField() {
    return ProfileFields.SKILLS;
  }

  @Override
  public List<String> validate(Map<String, Object> params) {
    return ScoringParams.strings(params, TARGET_SKILLS)
        .filter(skills -> !skills.isEmpty())
        .map(skills -> List.<String>of())
        .orElse(List.of("params.target_skills must be a non-empty list of strings"));
  }

  @Override
  public double score(ProfileRecord profile, Map<String, Object> params) {
    Set<String> targets =
        ScoringParams.strings(params, TARGET_SKILLS).orElse(List.of()).stream()
            .map(SkillCoverageScoring::key)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    if (targets.isEmpty()) {
      return 0.0;
    }
    Set<String> held =
        profile.skills().stream()
            .map(SkillEntry::term)
            .map(SkillCoverageScoring::key)
            .collect(Collectors.toSet());
    long covered = targets.stream().filter(held::contains).count();
    return (double) covered / targets.size();
  }

  private static String key(String skill) {
    return FieldNormalizer.comparisonKey(FieldType.SKILL, skill);
  }
}
