package dev.vitae.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.vitae.config.MdcAwareExecutorService;
import dev.vitae.document.DocumentLoader;
import dev.vitae.document.TextBlock;
import dev.vitae.document.UnreadableDocumentException;
import dev.vitae.document.UnreadableDocumentException.Reason;
import dev.vitae.extraction.ContactExtractor;
import dev.vitae.extraction.ExtractionCoordinator;
import dev.vitae.extraction.ExtractorRegistry;
import dev.vitae.extraction.Lexicons;
import dev.vitae.extraction.SkillTermExtractor;
import dev.vitae.fixture.BlockListBuilder;
import dev.vitae.rating.Criterion;
import dev.vitae.rating.RatingEngine;
import dev.vitae.rating.Rubric;
import dev.vitae.rating.RubricLoader;
import dev.vitae.rating.ScoringFunctionRegistry;
import dev.vitae.rating.SkillCoverageScoring;
import dev.vitae.segment.Segmenter;
import dev.vitae.synthesis.SkillEntry;
import dev.vitae.synthesis.Synthesizer;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.core.io.ClassPathResource;

@ExtendWith(MockitoExtension.class)
class ResumePipelineTest {

  private static final byte[] RESUME = {1};
  private static final byte[] SCANNED = {2};

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-06-15T00:00:00Z"), ZoneOffset.UTC);

  @Mock private DocumentLoader loader;

  private ExecutorService extractionExecutor;
  private ExecutorService documentExecutor;
  private ResumePipeline pipeline;
  private Rubric rubric;

  @BeforeEach
  void setUp() {
    extractionExecutor = new MdcAwareExecutorService(Executors.newFixedThreadPool(2));
    documentExecutor = new MdcAwareExecutorService(Executors.newFixedThreadPool(2));
    ExtractorRegistry registry =
        new ExtractorRegistry(
            List.of(new ContactExtractor(), new SkillTermExtractor(Lexicons.defaults())));
    pipeline =
        new ResumePipeline(
            loader,
            new Segmenter(),
            new ExtractionCoordinator(registry, extractionExecutor),
            new Synthesizer(0.5, CLOCK),
            new RatingEngine(ScoringFunctionRegistry.defaults()),
            documentExecutor);
    rubric =
        new RubricLoader(new ObjectMapper(), ScoringFunctionRegistry.defaults())
            .load(new ClassPathResource("rubric/default-rubric.json"));
  }

  @AfterEach
  void tearDown() {
    documentExecutor.shutdownNow();
    extractionExecutor.shutdownNow();
  }

  private static List<TextBlock> resumeBlocks() {
    return new BlockListBuilder()
        .title("Jane Doe")
        .line("jane.doe@example.com")
        .header("SKILLS")
        .line("Java, Kafka")
        .build();
  }

  // --- Single document ---

  @Test
  void processSynthesizesProfileFromLoadedBlocks() {
    when(loader.load(RESUME)).thenReturn(resumeBlocks());

    DocumentAnalysis analysis = pipeline.process("jane.pdf", RESUME);

    assertThat(analysis.documentId()).isEqualTo("jane.pdf");
    assertThat(analysis.blockCount()).isEqualTo(4);
    assertThat(analysis.sections()).hasSize(2);
    assertThat(analysis.profile().contact().name().value()).isEqualTo("Jane Doe");
    assertThat(analysis.profile().contact().email().value()).isEqualTo("janedoe@example.com");
    assertThat(analysis.profile().skills())
        .extracting(SkillEntry::term)
        .containsExactly("Java", "Kafka");
    assertThat(analysis.profile().asOf()).hasToString("2024-06");
  }

  @Test
  void reportRatesTheProfile() {
    when(loader.load(RESUME)).thenReturn(resumeBlocks());

    ProfileReport report = pipeline.report("jane.pdf", RESUME, rubric);

    assertThat(report.isRated()).isTrue();
    assertThat(report.rating().profileVersion()).isEqualTo(1);
    assertThat(report.rating().subScores()).containsOnlyKeys(
        rubric.criteria().stream().map(Criterion::name).toList());
    assertThat(report.ratingErrors()).isEmpty();
    assertThat(report.candidates().size()).isPositive();
  }

  @Test
  void invalidRubricStillYieldsProfile() {
    when(loader.load(RESUME)).thenReturn(resumeBlocks());
    Rubric underweight =
        new Rubric(
            List.of(
                new Criterion(
                    "skills",
                    0.5,
                    SkillCoverageScoring.REF,
                    List.of(),
                    Map.of("target_skills", List.of("Java")))));

    ProfileReport report = pipeline.report("jane.pdf", RESUME, underweight);

    assertThat(report.isRated()).isFalse();
    assertThat(report.rating()).isNull();
    assertThat(report.ratingErrors()).containsExactly("weights must sum to 1.0, got 0.5");
    assertThat(report.profile().contact().name().value()).isEqualTo("Jane Doe");
  }

  @Test
  void documentIdIsInMdcWhileProcessingAndRemovedAfter() {
    AtomicReference<String> seen = new AtomicReference<>();
    when(loader.load(RESUME))
        .thenAnswer(
            invocation -> {
              seen.set(MDC.get(ResumePipeline.MDC_DOCUMENT_ID));
              return resumeBlocks();
            });

    pipeline.process("jane.pdf", RESUME);

    assertThat(seen.get()).isEqualTo("jane.pdf");
    assertThat(MDC.get(ResumePipeline.MDC_DOCUMENT_ID)).isNull();
  }

  @Test
  void unreadableDocumentPropagatesFromProcess() {
    when(loader.load(SCANNED))
        .thenThrow(new UnreadableDocumentException(Reason.NO_EXTRACTABLE_TEXT, "no text"));

    assertThatThrownBy(() -> pipeline.process("scan.pdf", SCANNED))
        .isInstanceOf(UnreadableDocumentException.class);
    assertThat(MDC.get(ResumePipeline.MDC_DOCUMENT_ID)).isNull();
  }

  // --- Batches ---

  @Test
  void unreadableDocumentDoesNotAbortTheBatch() {
    when(loader.load(RESUME)).thenReturn(resumeBlocks());
    when(loader.load(SCANNED))
        .thenThrow(
            new UnreadableDocumentException(Reason.NO_EXTRACTABLE_TEXT, "No extractable text"));
    Map<String, byte[]> documents = new LinkedHashMap<>();
    documents.put("scan.pdf", SCANNED);
    documents.put("jane.pdf", RESUME);

    List<DocumentOutcome> outcomes = pipeline.processAll(documents, rubric);

    assertThat(outcomes).extracting(DocumentOutcome::documentId)
        .containsExactly("scan.pdf", "jane.pdf");
    assertThat(outcomes.get(0).succeeded()).isFalse();
    assertThat(outcomes.get(0).failure()).isEqualTo(Reason.NO_EXTRACTABLE_TEXT);
    assertThat(outcomes.get(0).message()).isEqualTo("No extractable text");
    assertThat(outcomes.get(1).succeeded()).isTrue();
    assertThat(outcomes.get(1).report().profile().contact().email().value())
        .isEqualTo("janedoe@example.com");
  }

  @Test
  void unexpectedFailureFailsTheBatch() {
    when(loader.load(RESUME)).thenThrow(new IllegalArgumentException("corrupt font table"));

    assertThatThrownBy(() -> pipeline.processAll(Map.of("jane.pdf", RESUME), rubric))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Processing failed for document jane.pdf")
        .hasRootCauseMessage("corrupt font table");
  }

  @Test
  void emptyBatchYieldsNoOutcomes() {
    assertThat(pipeline.processAll(Map.of(), rubric)).isEmpty();
  }
}
