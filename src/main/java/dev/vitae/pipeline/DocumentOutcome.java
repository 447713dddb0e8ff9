package dev.vitae.pipeline;

import dev.vitae.document.UnreadableDocumentException;
import org.jspecify.annotations.Nullable;

/**
 * Result of one document in a batch: either a report or the reason the document was unreadable.
 *
 * @param documentId caller-supplied document identifier
 * @param report the report, null when the document failed
 * @param failure why the document could not be read, null on success
 * @param message failure detail, null on success
 */
public record DocumentOutcome(
    String documentId,
    @Nullable ProfileReport report,
    UnreadableDocumentException.@Nullable Reason failure,
    @Nullable String message) {

  static DocumentOutcome completed(String documentId, ProfileReport report) {
    return new DocumentOutcome(documentId, report, null, null);
  }

  static DocumentOutcome unreadable(String documentId, UnreadableDocumentException e) {
    return new DocumentOutcome(documentId, null, e.getReason(), e.getMessage());
  }

  public boolean succeeded() {
    return report != null;
  }
}
