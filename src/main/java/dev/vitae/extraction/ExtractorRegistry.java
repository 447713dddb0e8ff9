package dev.vitae.extraction;

import dev.vitae.segment.Section;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The ordered set of extractors consulted for every section. Order is the bean order and decides
 * the order in which spans enter the candidate pool.
 */
@Component
public class ExtractorRegistry {

  private static final Logger log = LoggerFactory.getLogger(ExtractorRegistry.class);

  private final List<EntityExtractor> extractors;

  public ExtractorRegistry(List<EntityExtractor> extractors) {
    Set<String> ids = new HashSet<>();
    for (EntityExtractor extractor : extractors) {
      if (!ids.add(extractor.id())) {
        throw new IllegalStateException("Duplicate extractor id: " + extractor.id());
      }
    }
    this.extractors = List.copyOf(extractors);
    log.info(
        "Registered extractors: {}", this.extractors.stream().map(EntityExtractor::id).toList());
  }

  public List<EntityExtractor> all() {
    return extractors;
  }

  /** Extractors that run against the given section, in registration order. */
  public List<EntityExtractor> forSection(Section section) {
    return extractors.stream().filter(extractor -> extractor.supports(section)).toList();
  }
}
