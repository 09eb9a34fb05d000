package com.flamingo.ai.entities.service.symbols;

import com.flamingo.ai.entities.service.symbols.model.Equation;
import com.flamingo.ai.entities.service.symbols.model.GraphSymbol;
import com.flamingo.ai.entities.service.symbols.model.ParseOutcome;
import com.flamingo.ai.entities.service.symbols.model.SymbolGraph;
import com.flamingo.ai.entities.service.symbols.model.Token;
import com.flamingo.ai.entities.service.symbols.table.CsvTableWriter;
import com.flamingo.ai.entities.service.symbols.table.ParseResultRow;
import com.flamingo.ai.entities.service.symbols.table.SymbolChildRow;
import com.flamingo.ai.entities.service.symbols.table.SymbolRow;
import com.flamingo.ai.entities.service.symbols.table.SymbolTokenRow;
import com.flamingo.ai.entities.service.symbols.table.TokenRow;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Writes parse results and symbol graphs of a document as append-only CSV tables.
 *
 * <p>Tables of one document:
 *
 * <ul>
 *   <li>{@code detected-equation-tokens/<id>/parse_results.csv}: one row per equation
 *   <li>{@code detected-equation-tokens/<id>/entities.csv}: tokens
 *   <li>{@code detected-symbols/<id>/entities.csv}: symbols
 *   <li>{@code detected-symbols/<id>/symbol_tokens.csv}: symbol to token membership
 *   <li>{@code detected-symbols/<id>/symbol_children.csv}: symbol to child symbol containment
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class SymbolTableWriter {

  static final String PARSE_RESULTS_FILE = "parse_results.csv";
  static final String SYMBOL_TOKENS_FILE = "symbol_tokens.csv";
  static final String SYMBOL_CHILDREN_FILE = "symbol_children.csv";

  private final DocumentDirectories directories;
  private final CsvTableWriter csvTableWriter;

  public void writeParseResult(String documentId, ParseOutcome outcome) {
    Equation equation = outcome.equation();
    ParseResultRow row =
        ParseResultRow.builder()
            .documentId(documentId)
            .success(outcome.success())
            .equationIndex(equation.index())
            .texPath(equation.texPath())
            .equation(equation.tex())
            .errorMessage(outcome.errorMessage())
            .build();
    csvTableWriter.append(
        directories.equationTokensDirectory(documentId).resolve(PARSE_RESULTS_FILE),
        ParseResultRow.class,
        List.of(row));
  }

  /**
   * Creates the symbol children table if no child rows have been written. Later stages read it even
   * for documents with no nested symbols.
   */
  public void ensureSymbolChildrenTable(String documentId) {
    csvTableWriter.ensureExists(symbolChildrenTable(documentId));
  }

  /** Appends the rows of one equation's graph to the document's tables. */
  public void writeGraph(String documentId, SymbolGraph graph) {
    ensureSymbolChildrenTable(documentId);
    if (graph.isEmpty()) {
      return;
    }

    Equation equation = graph.equation();
    List<SymbolRow> symbolRows = new ArrayList<>();
    List<SymbolTokenRow> symbolTokenRows = new ArrayList<>();
    List<SymbolChildRow> childRows = new ArrayList<>();

    for (GraphSymbol symbol : graph.symbols()) {
      symbolRows.add(
          SymbolRow.builder()
              .id(graph.entityId(symbol.index()))
              .texPath(equation.texPath())
              .equationIndex(equation.index())
              .equation(equation.tex())
              .symbolIndex(symbol.index())
              .start(symbol.start())
              .end(symbol.end())
              .tex(symbol.span().tex())
              .contextTex(equation.contextTex())
              .mathml(symbol.mathml())
              .definition(symbol.defined())
              .relativeStart(symbol.span().start())
              .relativeEnd(symbol.span().end())
              .build());

      for (int tokenIndex : symbol.tokenIndices()) {
        symbolTokenRows.add(
            SymbolTokenRow.builder()
                .texPath(equation.texPath())
                .equationIndex(equation.index())
                .symbolIndex(symbol.index())
                .tokenIndex(tokenIndex)
                .build());
      }

      for (int childIndex : symbol.childIndices()) {
        childRows.add(
            SymbolChildRow.builder()
                .texPath(equation.texPath())
                .equationIndex(equation.index())
                .equation(equation.tex())
                .symbolIndex(symbol.index())
                .childIndex(childIndex)
                .build());
      }
    }

    List<TokenRow> tokenRows = new ArrayList<>();
    for (Token token : graph.tokens()) {
      tokenRows.add(
          TokenRow.builder()
              .texPath(equation.texPath())
              .id(graph.entityId(token.index()))
              .equationIndex(equation.index())
              .tokenIndex(token.index())
              .start(equation.start() + token.start())
              .end(equation.start() + token.end())
              .relativeStart(token.start())
              .relativeEnd(token.end())
              .tex(TexSpanReconstructor.slice(equation.tex(), token.start(), token.end()))
              .contextTex(equation.contextTex())
              .text(token.text())
              .equation(equation.tex())
              .equationDepth(equation.depth())
              .build());
    }

    Path symbolsDirectory = directories.symbolsDirectory(documentId);
    csvTableWriter.append(
        symbolsDirectory.resolve(DocumentDirectories.ENTITIES_FILE), SymbolRow.class, symbolRows);
    csvTableWriter.append(
        symbolsDirectory.resolve(SYMBOL_TOKENS_FILE), SymbolTokenRow.class, symbolTokenRows);
    csvTableWriter.append(symbolChildrenTable(documentId), SymbolChildRow.class, childRows);
    csvTableWriter.append(
        directories.equationTokensDirectory(documentId).resolve(DocumentDirectories.ENTITIES_FILE),
        TokenRow.class,
        tokenRows);
  }

  private Path symbolChildrenTable(String documentId) {
    return directories.symbolsDirectory(documentId).resolve(SYMBOL_CHILDREN_FILE);
  }
}
