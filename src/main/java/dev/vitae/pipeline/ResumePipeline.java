package dev.vitae.pipeline;

import dev.vitae.document.DocumentLoader;
import dev.vitae.document.TextBlock;
import dev.vitae.document.UnreadableDocumentException;
import dev.vitae.extraction.CandidatePool;
import dev.vitae.extraction.ExtractionCoordinator;
import dev.vitae.rating.InvalidRubricException;
import dev.vitae.rating.Rating;
import dev.vitae.rating.RatingEngine;
import dev.vitae.rating.Rubric;
import dev.vitae.segment.Section;
import dev.vitae.segment.Segmenter;
import dev.vitae.synthesis.ProfileRecord;
import dev.vitae.synthesis.Synthesizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs documents through loading, segmentation, extraction, synthesis and rating.
 *
 * <p>Each document is processed linearly; extraction inside a document runs in parallel on the
 * extractor pool. Independent documents run in parallel on a separate document pool, so a batch
 * never competes with its own extractor tasks for threads. An unreadable document aborts only
 * itself. A rejected rubric never prevents the profile from being produced.
 */
@Service
public class ResumePipeline {

  private static final Logger log = LoggerFactory.getLogger(ResumePipeline.class);

  static final String MDC_DOCUMENT_ID = "documentId";

  private final DocumentLoader loader;
  private final Segmenter segmenter;
  private final ExtractionCoordinator extraction;
  private final Synthesizer synthesizer;
  private final RatingEngine ratingEngine;
  private final ExecutorService documentExecutor;

  public ResumePipeline(
      DocumentLoader loader,
      Segmenter segmenter,
      ExtractionCoordinator extraction,
      Synthesizer synthesizer,
      RatingEngine ratingEngine,
      @Qualifier("documentExecutor") ExecutorService documentExecutor) {
    this.loader = loader;
    this.segmenter = segmenter;
    this.extraction = extraction;
    this.synthesizer = synthesizer;
    this.ratingEngine = ratingEngine;
    this.documentExecutor = documentExecutor;
  }

  /**
   * Loads, segments, extracts and synthesizes one document.
   *
   * @param documentId identifier used in logs and the output
   * @param bytes the raw PDF
   * @return the analysis, including the synthesized profile
   * @throws UnreadableDocumentException if no text can be extracted
   * @throws CancellationException if the calling thread is interrupted during extraction
   */
  public DocumentAnalysis process(String documentId, byte[] bytes) {
    MDC.put(MDC_DOCUMENT_ID, documentId);
    try {
      List<TextBlock> blocks = loader.load(bytes);
      log.info("Loaded {} text blocks", blocks.size());

      List<Section> sections = segmenter.segment(blocks);
      log.info("Segmented into {} sections", sections.size());

      CandidatePool candidates = extraction.extract(sections);
      log.info("Extracted {} candidate spans", candidates.size());

      ProfileRecord profile = synthesizer.synthesize(candidates);
      return new DocumentAnalysis(documentId, blocks.size(), sections, candidates, profile);
    } finally {
      MDC.remove(MDC_DOCUMENT_ID);
    }
  }

  /**
   * Processes one document and rates the resulting profile.
   *
   * @param documentId identifier used in logs and the output
   * @param bytes the raw PDF
   * @param rubric the rubric to rate against; if invalid, the report carries its violations
   *     instead of a rating
   * @return the report
   * @throws UnreadableDocumentException if no text can be extracted
   */
  public ProfileReport report(String documentId, byte[] bytes, Rubric rubric) {
    DocumentAnalysis analysis = process(documentId, bytes);
    @Nullable Rating rating = null;
    List<String> ratingErrors = List.of();
    try {
      rating = ratingEngine.rate(analysis.profile(), rubric);
    } catch (InvalidRubricException e) {
      log.warn("Document {} not rated: {}", documentId, e.getMessage());
      ratingErrors = e.getViolations();
    }
    return new ProfileReport(
        documentId, analysis.profile(), rating, ratingErrors, analysis.candidates());
  }

  /**
   * Schedules a report on the document pool. Cancelling the returned future with interruption
   * abandons the document's in-flight extractor tasks.
   */
  public Future<ProfileReport> submit(String documentId, byte[] bytes, Rubric rubric) {
    return documentExecutor.submit(() -> report(documentId, bytes, rubric));
  }

  /**
   * Reports on independent documents in parallel.
   *
   * @param documents raw PDFs by document id, in the order outcomes are returned
   * @param rubric the rubric every profile is rated against
   * @return one outcome per document; unreadable documents are reported, not thrown
   * @throws CancellationException if the calling thread is interrupted while waiting
   * @throws IllegalStateException if processing a document fails for any other reason
   */
  public List<DocumentOutcome> processAll(Map<String, byte[]> documents, Rubric rubric) {
    Map<String, Future<ProfileReport>> futures = new LinkedHashMap<>();
    documents.forEach((id, bytes) -> futures.put(id, submit(id, bytes, rubric)));

    List<DocumentOutcome> outcomes = new ArrayList<>();
    try {
      for (Map.Entry<String, Future<ProfileReport>> entry : futures.entrySet()) {
        outcomes.add(await(entry.getKey(), entry.getValue()));
      }
    } catch (RuntimeException e) {
      futures.values().forEach(future -> future.cancel(true));
      throw e;
    }
    log.info(
        "Processed {} documents, {} unreadable",
        outcomes.size(),
        outcomes.stream().filter(outcome -> !outcome.succeeded()).count());
    return outcomes;
  }

  private static DocumentOutcome await(String documentId, Future<ProfileReport> future) {
    try {
      return DocumentOutcome.completed(documentId, future.get());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      CancellationException cancelled = new CancellationException("Batch cancelled");
      cancelled.initCause(e);
      throw cancelled;
    } catch (ExecutionException e) {
      if (e.getCause() instanceof UnreadableDocumentException unreadable) {
        log.warn(
            "Document {} is unreadable ({}): {}",
            documentId,
            unreadable.getReason(),
            unreadable.getMessage());
        return DocumentOutcome.unreadable(documentId, unreadable);
      }
      throw new IllegalStateException("Processing failed for document " + documentId, e.getCause());
    }
  }
}
