package com.flamingo.ai.entities.exception;

/**
 * Exception thrown when the symbol forest of one equation cannot be turned into a relational graph,
 * e.g. a symbol names a child that is not part of the forest.
 */
public class MalformedSymbolForestException extends RuntimeException {

  private final String documentId;
  private final int equationIndex;
  private final String texPath;

  public MalformedSymbolForestException(
      String documentId, int equationIndex, String texPath, String message) {
    super(message);
    this.documentId = documentId;
    this.equationIndex = equationIndex;
    this.texPath = texPath;
  }

  public MalformedSymbolForestException(
      String documentId, int equationIndex, String texPath, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.equationIndex = equationIndex;
    this.texPath = texPath;
  }

  public String getDocumentId() {
    return documentId;
  }

  public int getEquationIndex() {
    return equationIndex;
  }

  public String getTexPath() {
    return texPath;
  }
}
