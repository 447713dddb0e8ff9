package dev.vitae.fixture;

import dev.vitae.extraction.CandidateSpan;
import dev.vitae.extraction.FieldType;

/**
 * Lightweight test builder for {@link CandidateSpan}. Provides sensible defaults so tests only
 * override what they care about.
 *
 * <pre>{@code
 * CandidateSpan span =
 *     new SpanBuilder().id("contact:0:0").field(FieldType.EMAIL).value("a@b.com").build();
 * }</pre>
 */
public final class SpanBuilder {

  private String id = "test:0:0";
  private FieldType field = FieldType.NAME;
  private String value = "Jane Doe";
  private int section;
  private int block;
  private double confidence = 0.9;
  private String extractorId = "test";

  public SpanBuilder id(String id) {
    this.id = id;
    return this;
  }

  public SpanBuilder field(FieldType field) {
    this.field = field;
    return this;
  }

  public SpanBuilder value(String value) {
    this.value = value;
    return this;
  }

  public SpanBuilder section(int section) {
    this.section = section;
    return this;
  }

  public SpanBuilder block(int block) {
    this.block = block;
    return this;
  }

  public SpanBuilder confidence(double confidence) {
    this.confidence = confidence;
    return this;
  }

  public SpanBuilder extractor(String extractorId) {
    this.extractorId = extractorId;
    return this;
  }

  public CandidateSpan build() {
    return new CandidateSpan(id, field, value, section, block, confidence, extractorId, value);
  }
}
