package com.flamingo.ai.entities.service.symbols.model;

import java.util.List;

/**
 * Normalized symbols and tokens of one equation, ready to be written as relational rows.
 *
 * @param equation the equation the graph was built from
 * @param symbols retained symbols in forest order
 * @param tokens every token covered by a retained symbol, once each, ordered by index
 */
public record SymbolGraph(Equation equation, List<GraphSymbol> symbols, List<Token> tokens) {

  public boolean isEmpty() {
    return symbols.isEmpty();
  }

  /** Builds the identifier used downstream for a symbol or token of this graph's equation. */
  public String entityId(int localIndex) {
    return equation.index() + "-" + localIndex;
  }
}
