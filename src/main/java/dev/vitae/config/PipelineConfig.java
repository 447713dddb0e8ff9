package dev.vitae.config;

import dev.vitae.pipeline.PipelineProperties;
import dev.vitae.rating.Rubric;
import dev.vitae.rating.RubricLoader;
import dev.vitae.synthesis.Synthesizer;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/** Wires the synthesizer and the default rubric from {@code vitae.pipeline.*}. */
@Configuration
public class PipelineConfig {

  @Bean
  public Synthesizer synthesizer(PipelineProperties properties, Clock clock) {
    return new Synthesizer(properties.getResolutionThreshold(), clock);
  }

  /**
   * The rubric used when the caller supplies none. Loaded and validated at startup, so a broken
   * default rubric fails the application before any document is processed.
   */
  @Bean
  public Rubric defaultRubric(
      PipelineProperties properties, RubricLoader rubricLoader, ResourceLoader resourceLoader) {
    return rubricLoader.load(resourceLoader.getResource(properties.getRubricLocation()));
  }
}
