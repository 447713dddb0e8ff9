package dev.vitae.document;

/**
 * Thrown when a byte stream cannot be turned into text blocks. Fatal for the document it concerns;
 * the pipeline does not retry.
 */
public class UnreadableDocumentException extends RuntimeException {

  /** Why the document could not be read. */
  public enum Reason {
    NOT_A_PDF,
    ENCRYPTED,
    NO_EXTRACTABLE_TEXT
  }

  private final Reason reason;

  public UnreadableDocumentException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public UnreadableDocumentException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
