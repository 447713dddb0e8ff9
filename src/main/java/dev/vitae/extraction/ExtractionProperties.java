package dev.vitae.extraction;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for entity extraction, bound from {@code vitae.extraction.*}.
 *
 * <ul>
 *   <li>{@code skills} - additional skill terms recognized besides the built-in lexicon
 *   <li>{@code organizations} - additional known employers
 *   <li>{@code institutions} - additional known universities and schools
 *   <li>{@code semantic-skills.enabled} - run the embedding-based skill extractor (default false)
 *   <li>{@code semantic-skills.min-similarity} - cosine similarity a skill item needs to map to a
 *       lexicon term (default 0.82, bounded (0.0, 1.0))
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "vitae.extraction")
public class ExtractionProperties {

  private List<String> skills = new ArrayList<>();
  private List<String> organizations = new ArrayList<>();
  private List<String> institutions = new ArrayList<>();
  private final SemanticSkills semanticSkills = new SemanticSkills();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    double minSimilarity = semanticSkills.getMinSimilarity();
    if (minSimilarity <= 0.0 || minSimilarity >= 1.0) {
      throw new IllegalStateException(
          "vitae.extraction.semantic-skills.min-similarity must be in (0.0, 1.0), got: "
              + minSimilarity);
    }
  }

  public List<String> getSkills() {
    return skills;
  }

  public void setSkills(List<String> skills) {
    this.skills = skills;
  }

  public List<String> getOrganizations() {
    return organizations;
  }

  public void setOrganizations(List<String> organizations) {
    this.organizations = organizations;
  }

  public List<String> getInstitutions() {
    return institutions;
  }

  public void setInstitutions(List<String> institutions) {
    this.institutions = institutions;
  }

  public SemanticSkills getSemanticSkills() {
    return semanticSkills;
  }

  /** Settings of the embedding-based skill extractor. */
  public static class SemanticSkills {

    private boolean enabled;
    private double minSimilarity = 0.82;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public double getMinSimilarity() {
      return minSimilarity;
    }

    public void setMinSimilarity(double minSimilarity) {
      this.minSimilarity = minSimilarity;
    }
  }
}
