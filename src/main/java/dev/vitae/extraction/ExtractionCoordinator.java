package dev.vitae.extraction;

import dev.vitae.segment.Section;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs every applicable extractor against every section of a document, concurrently, and joins
 * the results into the document's candidate pool.
 *
 * <p>Spans enter the pool in section order, then extractor registration order, regardless of the
 * order in which tasks complete. Interrupting the calling thread cancels the in-flight tasks and
 * discards their output.
 */
@Service
public class ExtractionCoordinator {

  private static final Logger log = LoggerFactory.getLogger(ExtractionCoordinator.class);

  private final ExtractorRegistry registry;
  private final ExecutorService executor;

  public ExtractionCoordinator(
      ExtractorRegistry registry, @Qualifier("extractionExecutor") ExecutorService executor) {
    this.registry = registry;
    this.executor = executor;
  }

  /**
   * Extracts candidate spans from a segmented document.
   *
   * @param sections the document's sections
   * @return the document's candidate pool
   * @throws CancellationException if the calling thread is interrupted while waiting
   * @throws IllegalStateException if an extractor throws
   */
  public CandidatePool extract(List<Section> sections) {
    List<Task> tasks = new ArrayList<>();
    for (Section section : sections) {
      for (EntityExtractor extractor : registry.forSection(section)) {
        tasks.add(
            new Task(extractor, section, executor.submit(() -> extractor.extract(section))));
      }
    }

    List<CandidateSpan> spans = new ArrayList<>();
    for (int i = 0; i < tasks.size(); i++) {
      Task task = tasks.get(i);
      try {
        List<CandidateSpan> result = task.future().get();
        log.debug(
            "Extractor {} found {} candidates in section {} ({})",
            task.extractor().id(),
            result.size(),
            task.section().id(),
            task.section().kind());
        spans.addAll(result);
      } catch (InterruptedException e) {
        cancelFrom(tasks, i);
        Thread.currentThread().interrupt();
        CancellationException cancelled = new CancellationException("Extraction cancelled");
        cancelled.initCause(e);
        throw cancelled;
      } catch (ExecutionException e) {
        cancelFrom(tasks, i + 1);
        throw new IllegalStateException(
            "Extractor %s failed on section %d"
                .formatted(task.extractor().id(), task.section().id()),
            e.getCause());
      }
    }
    return CandidatePool.of(spans);
  }

  private static void cancelFrom(List<Task> tasks, int start) {
    for (int i = start; i < tasks.size(); i++) {
      tasks.get(i).future().cancel(true);
    }
  }

  private record Task(
      EntityExtractor extractor, Section section, Future<List<CandidateSpan>> future) {}
}
