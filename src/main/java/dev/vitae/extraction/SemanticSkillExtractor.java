package dev.vitae.extraction;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.vitae.document.TextBlock;
import dev.vitae.segment.Section;
import dev.vitae.segment.SectionKind;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps skill-list items the lexicon does not know to the closest lexicon term by embedding
 * similarity, using the in-process embedding model.
 *
 * <p>Confidence is the cosine similarity, capped below 1.0. Lexicon term embeddings are computed
 * once, on first use.
 */
public class SemanticSkillExtractor implements EntityExtractor {

  public static final String ID = "semantic-skill";

  static final double MAX_CONFIDENCE = 0.99;

  private static final Logger log = LoggerFactory.getLogger(SemanticSkillExtractor.class);

  private final EmbeddingModel embeddingModel;
  private final SkillLexicon lexicon;
  private final double minSimilarity;
  private volatile List<TermEmbedding> termEmbeddings;

  private record TermEmbedding(String term, Embedding embedding) {}

  public SemanticSkillExtractor(
      EmbeddingModel embeddingModel, SkillLexicon lexicon, double minSimilarity) {
    this.embeddingModel = embeddingModel;
    this.lexicon = lexicon;
    this.minSimilarity = minSimilarity;
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public Set<SectionKind> supportedKinds() {
    return EnumSet.of(SectionKind.SKILLS);
  }

  @Override
  public Set<FieldType> emittedFields() {
    return EnumSet.of(FieldType.SKILL);
  }

  @Override
  public List<CandidateSpan> extract(Section section) {
    List<TextBlock> itemBlocks = new ArrayList<>();
    List<String> items = new ArrayList<>();
    for (TextBlock block : section.bodyBlocks()) {
      for (String item : new LinkedHashSet<>(SkillListParser.items(block.text()))) {
        if (lexicon.canonicalize(item).isEmpty() && SkillTermExtractor.isShortItem(item)) {
          itemBlocks.add(block);
          items.add(item);
        }
      }
    }
    SpanCollector spans = new SpanCollector(ID, section);
    if (items.isEmpty()) {
      return spans.spans();
    }

    List<TermEmbedding> terms = termEmbeddings();
    List<Embedding> embedded =
        embeddingModel.embedAll(items.stream().map(TextSegment::from).toList()).content();
    for (int i = 0; i < items.size(); i++) {
      TermEmbedding best = null;
      double bestSimilarity = 0.0;
      for (TermEmbedding term : terms) {
        double similarity = CosineSimilarity.between(embedded.get(i), term.embedding());
        if (similarity > bestSimilarity) {
          bestSimilarity = similarity;
          best = term;
        }
      }
      if (best != null && bestSimilarity >= minSimilarity) {
        log.debug("'{}' matched skill '{}' ({})", items.get(i), best.term(), bestSimilarity);
        spans.add(
            FieldType.SKILL,
            best.term(),
            itemBlocks.get(i),
            Math.min(bestSimilarity, MAX_CONFIDENCE),
            items.get(i));
      }
    }
    return spans.spans();
  }

  private List<TermEmbedding> termEmbeddings() {
    List<TermEmbedding> cached = termEmbeddings;
    if (cached == null) {
      synchronized (this) {
        cached = termEmbeddings;
        if (cached == null) {
          List<String> terms = List.copyOf(lexicon.terms());
          List<Embedding> embeddings =
              embeddingModel.embedAll(terms.stream().map(TextSegment::from).toList()).content();
          List<TermEmbedding> computed = new ArrayList<>();
          for (int i = 0; i < terms.size(); i++) {
            computed.add(new TermEmbedding(terms.get(i), embeddings.get(i)));
          }
          cached = List.copyOf(computed);
          termEmbeddings = cached;
          log.info("Embedded {} lexicon skill terms", cached.size());
        }
      }
    }
    return cached;
  }
}
