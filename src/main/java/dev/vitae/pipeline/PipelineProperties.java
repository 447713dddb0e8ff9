package dev.vitae.pipeline;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the document pipeline.
 *
 * <p>Properties are bound from {@code vitae.pipeline.*} in application.yml.
 *
 * <ul>
 *   <li>{@code resolution-threshold} - summed confidence a field value needs to be accepted
 *       (default 0.5, bounded (0.0, 1.0])
 *   <li>{@code extraction-threads} - size of the extractor worker pool; 0 uses one thread per
 *       available processor (default 0)
 *   <li>{@code document-concurrency} - documents processed in parallel by batch runs (default 2,
 *       at least 1)
 *   <li>{@code rubric-location} - resource the default rubric is loaded from
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "vitae.pipeline")
public class PipelineProperties {

  private double resolutionThreshold = 0.5;
  private int extractionThreads;
  private int documentConcurrency = 2;
  private String rubricLocation = "classpath:rubric/default-rubric.json";

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (resolutionThreshold <= 0.0 || resolutionThreshold > 1.0) {
      throw new IllegalStateException(
          "vitae.pipeline.resolution-threshold must be in (0.0, 1.0], got: "
              + resolutionThreshold);
    }
    if (extractionThreads < 0) {
      throw new IllegalStateException(
          "vitae.pipeline.extraction-threads must be >= 0, got: " + extractionThreads);
    }
    if (documentConcurrency < 1) {
      throw new IllegalStateException(
          "vitae.pipeline.document-concurrency must be >= 1, got: " + documentConcurrency);
    }
    if (rubricLocation == null || rubricLocation.isBlank()) {
      throw new IllegalStateException("vitae.pipeline.rubric-location must not be blank");
    }
  }

  /** Extractor pool size with the processor default applied. */
  public int effectiveExtractionThreads() {
    return extractionThreads > 0 ? extractionThreads : Runtime.getRuntime().availableProcessors();
  }

  public double getResolutionThreshold() {
    return resolutionThreshold;
  }

  public void setResolutionThreshold(double resolutionThreshold) {
    this.resolutionThreshold = resolutionThreshold;
  }

  public int getExtractionThreads() {
    return extractionThreads;
  }

  public void setExtractionThreads(int extractionThreads) {
    this.extractionThreads = extractionThreads;
  }

  public int getDocumentConcurrency() {
    return documentConcurrency;
  }

  public void setDocumentConcurrency(int documentConcurrency) {
    this.documentConcurrency = documentConcurrency;
  }

  public String getRubricLocation() {
    return rubricLocation;
  }

  public void setRubricLocation(String rubricLocation) {
    this.rubricLocation = rubricLocation;
  }
}
