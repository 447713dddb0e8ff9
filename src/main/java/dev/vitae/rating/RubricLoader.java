package dev.vitae.rating;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * Reads rubrics from JSON and validates them at load time.
 *
 * <pre>{@code
 * {"criteria": [
 *   {"name": "experience", "weight": 0.6, "scoring_fn_ref": "years_of_experience",
 *    "required_fields": ["years_of_experience"], "params": {"thresholds": [2, 5, 10]}},
 *   {"name": "skills", "weight": 0.4, "scoring_fn_ref": "skill_coverage",
 *    "params": {"target_skills": ["Java", "SQL"]}}
 * ]}
 * }</pre>
 */
@Component
public class RubricLoader {

  private static final Logger log = LoggerFactory.getLogger(RubricLoader.class);

  private final ObjectMapper objectMapper;
  private final ScoringFunctionRegistry functions;

  public RubricLoader(ObjectMapper objectMapper, ScoringFunctionRegistry functions) {
    this.objectMapper = objectMapper;
    this.functions = functions;
  }

  /**
   * Parses and validates a rubric.
   *
   * @throws InvalidRubricException if the JSON is malformed or the rubric is invalid
   */
  public Rubric load(InputStream json) {
    Rubric rubric;
    try {
      rubric = objectMapper.readValue(json, Rubric.class);
    } catch (JsonProcessingException e) {
      throw new InvalidRubricException("malformed rubric JSON: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new InvalidRubricException("cannot read rubric: " + e.getMessage(), e);
    }
    if (rubric == null) {
      throw new InvalidRubricException(List.of("rubric document is empty"));
    }
    RubricValidator.validate(rubric, functions);
    log.info("Loaded rubric with {} criteria", rubric.criteria().size());
    return rubric;
  }

  public Rubric load(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      return load(in);
    } catch (IOException e) {
      throw new InvalidRubricException("cannot read rubric " + path + ": " + e.getMessage(), e);
    }
  }

  public Rubric load(Resource resource) {
    try (InputStream in = resource.getInputStream()) {
      return load(in);
    } catch (IOException e) {
      throw new InvalidRubricException(
          "cannot read rubric " + resource.getDescription() + ": " + e.getMessage(), e);
    }
  }
}
