package dev.vitae.config;

import dev.vitae.pipeline.PipelineProperties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Provides the two worker pools of the pipeline.
 *
 * <p>Extractor tasks and whole documents run on separate pools: a document thread blocks while
 * its extractor tasks run, so sharing one bounded pool could starve it.
 */
@Configuration
public class ExecutorConfig {

  private static final Logger log = LoggerFactory.getLogger(ExecutorConfig.class);

  @Bean(name = "extractionExecutor", destroyMethod = "shutdownNow")
  public ExecutorService extractionExecutor(PipelineProperties properties) {
    int threads = properties.effectiveExtractionThreads();
    log.info("Extraction pool: {} threads", threads);
    return pool(threads, "vitae-extract-");
  }

  @Bean(name = "documentExecutor", destroyMethod = "shutdownNow")
  public ExecutorService documentExecutor(PipelineProperties properties) {
    int threads = properties.getDocumentConcurrency();
    log.info("Document pool: {} threads", threads);
    return pool(threads, "vitae-document-");
  }

  private static ExecutorService pool(int threads, String namePrefix) {
    CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(namePrefix);
    threadFactory.setDaemon(true);
    return new MdcAwareExecutorService(Executors.newFixedThreadPool(threads, threadFactory));
  }
}
