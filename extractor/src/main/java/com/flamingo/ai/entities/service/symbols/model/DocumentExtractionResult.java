package com.flamingo.ai.entities.service.symbols.model;

/**
 * What happened to one document during a run.
 *
 * @param documentId the document
 * @param status how processing ended
 * @param equations equations reported by the parser
 * @param symbols symbol rows written
 * @param tokens token rows written
 */
public record DocumentExtractionResult(
    String documentId, Status status, int equations, int symbols, int tokens) {

  public enum Status {
    SUCCEEDED,
    /** No equations were detected for the document. */
    SKIPPED,
    FAILED
  }

  public static DocumentExtractionResult skipped(String documentId) {
    return new DocumentExtractionResult(documentId, Status.SKIPPED, 0, 0, 0);
  }

  public static DocumentExtractionResult failed(String documentId) {
    return new DocumentExtractionResult(documentId, Status.FAILED, 0, 0, 0);
  }
}
