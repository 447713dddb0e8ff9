package dev.vitae.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.EnvironmentAware;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Sizes the ONNX Runtime thread pools for semantic skill matching.
 *
 * <p>Every extractor thread may run an inference at the same time, so the processors are shared
 * out between them: each inference gets {@code processors / extraction-threads} intra-op
 * threads, at least one. The environment is a process-wide singleton that the embedding model
 * creates on first use, so it is set up here, before any bean is instantiated.
 */
@Configuration
@ConditionalOnProperty(prefix = "vitae.extraction.semantic-skills", name = "enabled")
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor, EnvironmentAware {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  static final String EXTRACTION_THREADS = "vitae.pipeline.extraction-threads";

  private int extractionThreads;

  @Override
  public void setEnvironment(Environment environment) {
    this.extractionThreads = environment.getProperty(EXTRACTION_THREADS, Integer.class, 0);
  }

  /**
   * Intra-op threads per inference.
   *
   * @param processors available processors
   * @param extractionThreads configured extractor pool size; 0 means one per processor
   */
  static int intraOpThreads(int processors, int extractionThreads) {
    int workers = extractionThreads > 0 ? extractionThreads : processors;
    return Math.max(1, processors / workers);
  }

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    int intraOp = intraOpThreads(Runtime.getRuntime().availableProcessors(), extractionThreads);
    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(false);
      threadingOptions.setGlobalIntraOpNumThreads(intraOp);
      threadingOptions.setGlobalInterOpNumThreads(1);
      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "vitae", threadingOptions);
      log.info("ONNX Runtime: {} intra-op thread(s) per inference", intraOp);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      // a second application context in the same JVM finds the environment already built
      log.warn("ONNX Runtime already initialized, keeping its threading: {}", e.getMessage());
    }
  }
}
