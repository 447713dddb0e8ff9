package dev.vitae.pipeline;

import dev.vitae.extraction.CandidatePool;
import dev.vitae.segment.Section;
import dev.vitae.synthesis.ProfileRecord;
import java.util.List;

/**
 * Everything the pipeline derived from one document, up to and including the synthesized profile.
 *
 * @param documentId caller-supplied document identifier
 * @param blockCount number of text blocks the loader produced
 * @param sections the document's sections, partitioning the blocks
 * @param candidates every candidate span, retained for audit
 * @param profile the synthesized profile
 */
public record DocumentAnalysis(
    String documentId,
    int blockCount,
    List<Section> sections,
    CandidatePool candidates,
    ProfileRecord profile) {

  public DocumentAnalysis {
    sections = List.copyOf(sections);
  }
}
