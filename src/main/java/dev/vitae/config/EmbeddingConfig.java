package dev.vitae.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.vitae.extraction.ExtractionProperties;
import dev.vitae.extraction.Lexicons;
import dev.vitae.extraction.SemanticSkillExtractor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

/**
 * Configures embedding-based skill matching.
 *
 * <p>Uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) running in-process, so
 * no external embedding API is called. Only active with {@code
 * vitae.extraction.semantic-skills.enabled=true}; loading the model takes a few seconds.
 */
@Configuration
@ConditionalOnProperty(prefix = "vitae.extraction.semantic-skills", name = "enabled")
public class EmbeddingConfig {

  /**
   * Provides the in-process ONNX embedding model (bge-small-en-v1.5 quantized, 384 dimensions).
   *
   * @return a ready-to-use embedding model requiring no external API
   */
  @Bean
  public EmbeddingModel embeddingModel() {
    return new BgeSmallEnV15QuantizedEmbeddingModel();
  }

  /** Registers the semantic skill extractor after the lexicon-based extractors. */
  @Bean
  @Order(5)
  public SemanticSkillExtractor semanticSkillExtractor(
      EmbeddingModel embeddingModel, Lexicons lexicons, ExtractionProperties properties) {
    return new SemanticSkillExtractor(
        embeddingModel, lexicons.skills(), properties.getSemanticSkills().getMinSimilarity());
  }
}
