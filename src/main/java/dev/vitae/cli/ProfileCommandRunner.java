package dev.vitae.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import dev.vitae.pipeline.DocumentOutcome;
import dev.vitae.pipeline.ResumePipeline;
import dev.vitae.rating.InvalidRubricException;
import dev.vitae.rating.Rubric;
import dev.vitae.rating.RubricLoader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Command-line entry: {@code vitae [--rubric=path] resume1.pdf resume2.pdf ...}.
 *
 * <p>Prints one JSON report per document to standard output. Unreadable documents are reported
 * with their reason and do not stop the others. The exit code is 0 when every document was
 * processed, 1 when any was unreadable or missing, and 2 on usage or rubric errors.
 */
@Component
@ConditionalOnProperty(prefix = "vitae.cli", name = "enabled", matchIfMissing = true)
public class ProfileCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger log = LoggerFactory.getLogger(ProfileCommandRunner.class);

  static final String RUBRIC_OPTION = "rubric";
  static final int EXIT_DOCUMENT_FAILED = 1;
  static final int EXIT_USAGE = 2;

  private final ResumePipeline pipeline;
  private final RubricLoader rubricLoader;
  private final Rubric defaultRubric;
  private final ObjectWriter writer;
  private final PrintStream out;
  private int exitCode;

  public ProfileCommandRunner(
      ResumePipeline pipeline,
      RubricLoader rubricLoader,
      Rubric defaultRubric,
      ObjectMapper objectMapper) {
    this(pipeline, rubricLoader, defaultRubric, objectMapper, System.out);
  }

  ProfileCommandRunner(
      ResumePipeline pipeline,
      RubricLoader rubricLoader,
      Rubric defaultRubric,
      ObjectMapper objectMapper,
      PrintStream out) {
    this.pipeline = pipeline;
    this.rubricLoader = rubricLoader;
    this.defaultRubric = defaultRubric;
    this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    this.out = out;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> files = args.getNonOptionArgs();
    if (files.isEmpty()) {
      log.error("usage: vitae [--rubric=path] resume.pdf [resume.pdf ...]");
      exitCode = EXIT_USAGE;
      return;
    }
    Rubric rubric;
    try {
      rubric = rubric(args);
    } catch (InvalidRubricException e) {
      log.error("Rubric rejected: {}", e.getViolations());
      exitCode = EXIT_USAGE;
      return;
    }

    Map<String, byte[]> documents = new LinkedHashMap<>();
    for (String file : files) {
      try {
        documents.put(file, Files.readAllBytes(Path.of(file)));
      } catch (IOException e) {
        log.error("Cannot read {}: {}", file, e.getMessage());
        exitCode = EXIT_DOCUMENT_FAILED;
      }
    }
    for (DocumentOutcome outcome : pipeline.processAll(documents, rubric)) {
      if (!outcome.succeeded()) {
        exitCode = EXIT_DOCUMENT_FAILED;
      }
      print(outcome.succeeded() ? outcome.report() : outcome);
    }
  }

  private Rubric rubric(ApplicationArguments args) {
    List<String> values = args.getOptionValues(RUBRIC_OPTION);
    if (values == null || values.isEmpty()) {
      return defaultRubric;
    }
    return rubricLoader.load(Path.of(values.get(values.size() - 1)));
  }

  private void print(Object value) {
    try {
      out.println(writer.writeValueAsString(value));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
