package com.flamingo.ai.entities.service.symbols.parser;

import com.flamingo.ai.entities.service.symbols.model.ParsedSymbol;
import java.util.List;

/** Extracts the symbol forest of an equation from the MathML the equation parser produced. */
public interface SymbolForestExtractor {

  /**
   * Extracts symbols in document order. Children of a symbol are members of the returned list.
   *
   * @param mathMl MathML of one equation
   * @return the equation's symbols; empty if it has none
   * @throws IllegalArgumentException if {@code mathMl} cannot be read
   */
  List<ParsedSymbol> extract(String mathMl);
}
