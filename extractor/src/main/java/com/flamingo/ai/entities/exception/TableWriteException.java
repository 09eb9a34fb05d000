package com.flamingo.ai.entities.exception;

import java.nio.file.Path;

/** Exception thrown when a row cannot be appended to a relational output table. */
public class TableWriteException extends RuntimeException {

  private final Path path;

  public TableWriteException(Path path, Throwable cause) {
    super("Failed to write table " + path + ": " + cause.getMessage(), cause);
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}
