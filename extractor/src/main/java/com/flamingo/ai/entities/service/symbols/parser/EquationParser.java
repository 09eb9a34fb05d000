package com.flamingo.ai.entities.service.symbols.parser;

import com.flamingo.ai.entities.exception.EquationParsingException;
import com.flamingo.ai.entities.service.symbols.model.ParseOutcome;
import java.nio.file.Path;
import java.util.List;

/** Parses all equations of a document in one batch. */
public interface EquationParser {

  /**
   * Parses the equations listed in a document's equations table.
   *
   * @param documentId document the equations belong to
   * @param equationsFile table of equations written by the equation detection stage
   * @return one outcome per equation, in the order the parser reported them
   * @throws EquationParsingException if the batch as a whole could not be parsed
   */
  List<ParseOutcome> parse(String documentId, Path equationsFile);
}
