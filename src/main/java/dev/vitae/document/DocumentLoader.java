package dev.vitae.document;

import java.util.List;

/**
 * Converts a raw document byte stream into text blocks in reading order.
 *
 * <p>Implementations are stateless so a single instance can be shared across concurrent
 * document-processing threads. They never drop a block because its text looks unreliable; pages
 * without extractable text simply contribute no blocks.
 */
public interface DocumentLoader {

  /**
   * Loads the document.
   *
   * @param bytes the raw document
   * @return blocks in reading order, indexed from 0; never empty
   * @throws UnreadableDocumentException if the bytes are not a readable document or contain no
   *     extractable text at all
   */
  List<TextBlock> load(byte[] bytes);
}
