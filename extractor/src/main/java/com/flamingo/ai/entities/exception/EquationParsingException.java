package com.flamingo.ai.entities.exception;

/**
 * Exception thrown when the external equation parser cannot produce results for a document: the
 * process failed to start, timed out, exited with a nonzero status or printed unreadable output.
 */
public class EquationParsingException extends RuntimeException {

  private final String documentId;

  public EquationParsingException(String documentId, String message) {
    super(message);
    this.documentId = documentId;
  }

  public EquationParsingException(String documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
