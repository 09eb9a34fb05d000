package com.flamingo.ai.entities.service.symbols;

import com.flamingo.ai.entities.exception.MalformedSymbolForestException;
import com.flamingo.ai.entities.service.symbols.model.Equation;
import com.flamingo.ai.entities.service.symbols.model.GraphSymbol;
import com.flamingo.ai.entities.service.symbols.model.ParsedSymbol;
import com.flamingo.ai.entities.service.symbols.model.SymbolGraph;
import com.flamingo.ai.entities.service.symbols.model.TexSpan;
import com.flamingo.ai.entities.service.symbols.model.Token;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns the symbol forest of one equation into a {@link SymbolGraph}.
 *
 * <ul>
 *   <li>symbols without tokens are dropped
 *   <li>each retained symbol gets its TeX span and absolute offsets
 *   <li>tokens shared by several symbols are kept once, keyed by token index
 *   <li>child symbols are replaced by their position in the forest; children without tokens are
 *       left out along with the symbols themselves
 * </ul>
 *
 * <p>Stateless: all state lives in local variables of {@link #normalize}.
 */
@Component
@Slf4j
public class SymbolGraphNormalizer {

  /**
   * Normalizes a forest.
   *
   * @param documentId document the equation belongs to, for error reporting
   * @param equation the equation the forest was parsed from
   * @param forest symbols of the equation; a symbol's position is its index
   * @return the graph of retained symbols and their tokens
   * @throws MalformedSymbolForestException if a symbol's child is not a member of {@code forest}
   */
  public SymbolGraph normalize(String documentId, Equation equation, List<ParsedSymbol> forest) {
    Map<ParsedSymbol, Integer> positions = new IdentityHashMap<>();
    for (int i = 0; i < forest.size(); i++) {
      positions.putIfAbsent(forest.get(i), i);
    }

    List<GraphSymbol> symbols = new ArrayList<>();
    Map<Integer, Token> tokensByIndex = new TreeMap<>();

    for (int symbolIndex = 0; symbolIndex < forest.size(); symbolIndex++) {
      ParsedSymbol symbol = forest.get(symbolIndex);
      if (symbol.tokens().isEmpty()) {
        continue;
      }

      TexSpan span = TexSpanReconstructor.reconstruct(symbol.tokens(), equation.tex());

      List<Integer> tokenIndices = new ArrayList<>(symbol.tokens().size());
      for (Token token : symbol.tokens()) {
        tokensByIndex.putIfAbsent(token.index(), token);
        tokenIndices.add(token.index());
      }

      List<Integer> childIndices = new ArrayList<>(symbol.children().size());
      for (ParsedSymbol child : symbol.children()) {
        Integer childIndex = positions.get(child);
        if (childIndex == null) {
          throw new MalformedSymbolForestException(
              documentId,
              equation.index(),
              equation.texPath(),
              String.format(
                  "Symbol %d of equation %d has a child that is not in the equation's forest",
                  symbolIndex, equation.index()));
        }
        // Token-less children are not emitted, so an edge to one would dangle.
        if (!child.tokens().isEmpty()) {
          childIndices.add(childIndex);
        }
      }

      symbols.add(
          new GraphSymbol(
              symbolIndex,
              symbol.mathml(),
              symbol.defined(),
              span,
              equation.start() + span.start(),
              equation.start() + span.end(),
              List.copyOf(tokenIndices),
              List.copyOf(childIndices)));
    }

    log.debug(
        "Equation {} of {}: kept {} of {} symbols covering {} tokens",
        equation.index(),
        documentId,
        symbols.size(),
        forest.size(),
        tokensByIndex.size());

    return new SymbolGraph(equation, List.copyOf(symbols), List.copyOf(tokensByIndex.values()));
  }
}
