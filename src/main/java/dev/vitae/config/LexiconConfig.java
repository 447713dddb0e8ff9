package dev.vitae.config;

import dev.vitae.extraction.ExtractionProperties;
import dev.vitae.extraction.Lexicons;
import dev.vitae.extraction.SkillLexicon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Builds the extraction lexicons: the built-in entries plus those configured. */
@Configuration
public class LexiconConfig {

  private static final Logger log = LoggerFactory.getLogger(LexiconConfig.class);

  @Bean
  public Lexicons lexicons(ExtractionProperties properties) {
    Lexicons defaults = Lexicons.defaults();
    Lexicons lexicons =
        new Lexicons(
            SkillLexicon.withAdditionalTerms(properties.getSkills()),
            defaults.organizations().with(properties.getOrganizations()),
            defaults.institutions().with(properties.getInstitutions()));
    log.info(
        "Lexicons: {} skill terms, {} extra organizations, {} extra institutions",
        lexicons.skills().terms().size(),
        properties.getOrganizations().size(),
        properties.getInstitutions().size());
    return lexicons;
  }
}
