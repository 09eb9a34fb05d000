package com.flamingo.ai.entities.service.symbols;

import com.flamingo.ai.entities.exception.EquationParsingException;
import com.flamingo.ai.entities.exception.MalformedSymbolForestException;
import com.flamingo.ai.entities.service.symbols.model.DocumentExtractionResult;
import com.flamingo.ai.entities.service.symbols.model.DocumentExtractionResult.Status;
import com.flamingo.ai.entities.service.symbols.model.Equation;
import com.flamingo.ai.entities.service.symbols.model.ParseOutcome;
import com.flamingo.ai.entities.service.symbols.model.ParsedSymbol;
import com.flamingo.ai.entities.service.symbols.model.SymbolGraph;
import com.flamingo.ai.entities.service.symbols.parser.EquationParser;
import com.flamingo.ai.entities.service.symbols.parser.SymbolForestExtractor;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Extracts symbols and the tokens within them from the detected equations of documents.
 *
 * <p>For each document: clear earlier output, parse all of its equations with one call to the
 * {@link EquationParser}, then build a {@link SymbolGraph} per parsed equation and append it to the
 * document's tables. Documents are independent and run in parallel on the document processing
 * executor; a failed document never stops the others, and a failed equation never stops its
 * document.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SymbolExtractionService {

  private final DocumentDirectories directories;
  private final EquationParser equationParser;
  private final SymbolForestExtractor forestExtractor;
  private final SymbolGraphNormalizer graphNormalizer;
  private final SymbolTableWriter tableWriter;
  private final MeterRegistry meterRegistry;
  private final ThreadPoolTaskExecutor documentProcessingExecutor;

  /**
   * Processes documents on the worker pool and waits for all of them.
   *
   * @param documentIds documents to process
   * @return one result per document, in the order of {@code documentIds}
   */
  @Timed(value = "symbols.extract", description = "Time to extract symbols for documents")
  public List<DocumentExtractionResult> extractAll(List<String> documentIds) {
    List<CompletableFuture<DocumentExtractionResult>> futures =
        documentIds.stream()
            .map(
                documentId ->
                    submit(documentId)
                        .exceptionally(
                            e -> {
                              log.error(
                                  "Symbol extraction for {} failed: {}",
                                  documentId,
                                  e.getMessage(),
                                  e);
                              meterRegistry
                                  .counter("symbols.documents", "status", "failed")
                                  .increment();
                              return DocumentExtractionResult.failed(documentId);
                            }))
            .toList();

    List<DocumentExtractionResult> results =
        futures.stream().map(CompletableFuture::join).toList();

    log.info(
        "Symbol extraction finished for {} documents: {} succeeded, {} skipped, {} failed",
        results.size(),
        count(results, Status.SUCCEEDED),
        count(results, Status.SKIPPED),
        count(results, Status.FAILED));
    return results;
  }

  private CompletableFuture<DocumentExtractionResult> submit(String documentId) {
    try {
      return CompletableFuture.supplyAsync(
          () -> processDocument(documentId), documentProcessingExecutor);
    } catch (TaskRejectedException e) {
      log.debug("Worker pool is saturated, processing {} on the calling thread", documentId);
      return CompletableFuture.supplyAsync(() -> processDocument(documentId), Runnable::run);
    }
  }

  /**
   * Processes one document. Writes nothing if the equation parser fails.
   *
   * @param documentId the document to process
   * @return what happened to the document
   */
  public DocumentExtractionResult processDocument(String documentId) {
    directories.clearOutput(documentId);

    Path equationsFile = directories.equationsFile(documentId);
    if (!Files.exists(equationsFile)) {
      log.warn("No equations detected for {} at {}. Skipping.", documentId, equationsFile);
      meterRegistry.counter("symbols.documents", "status", "skipped").increment();
      return DocumentExtractionResult.skipped(documentId);
    }

    List<ParseOutcome> outcomes;
    try {
      outcomes = equationParser.parse(documentId, equationsFile);
    } catch (EquationParsingException e) {
      log.error("Could not parse equations of {}: {}", documentId, e.getMessage(), e);
      meterRegistry.counter("symbols.documents", "status", "failed").increment();
      return DocumentExtractionResult.failed(documentId);
    }

    int symbols = 0;
    int tokens = 0;
    for (ParseOutcome outcome : outcomes) {
      tableWriter.writeParseResult(documentId, outcome);
      Equation equation = outcome.equation();

      if (!outcome.success()) {
        log.warn(
            "Could not parse equation {} of {} ({}): {}",
            equation.index(),
            documentId,
            equation.texPath(),
            outcome.errorMessage());
        meterRegistry.counter("symbols.equations", "outcome", "unparsed").increment();
        continue;
      }

      try {
        SymbolGraph graph = buildGraph(documentId, outcome);
        tableWriter.writeGraph(documentId, graph);
        symbols += graph.symbols().size();
        tokens += graph.tokens().size();
        meterRegistry.counter("symbols.equations", "outcome", "parsed").increment();
      } catch (MalformedSymbolForestException e) {
        log.error(
            "Skipping symbols of equation {} of {} ({}): {}",
            e.getEquationIndex(),
            e.getDocumentId(),
            e.getTexPath(),
            e.getMessage());
        meterRegistry.counter("symbols.equations", "outcome", "malformed").increment();
      }
    }
    tableWriter.ensureSymbolChildrenTable(documentId);

    log.info(
        "Extracted {} symbols and {} tokens from {} equations of {}",
        symbols,
        tokens,
        outcomes.size(),
        documentId);
    meterRegistry.counter("symbols.documents", "status", "succeeded").increment();
    return new DocumentExtractionResult(
        documentId, Status.SUCCEEDED, outcomes.size(), symbols, tokens);
  }

  private SymbolGraph buildGraph(String documentId, ParseOutcome outcome) {
    Equation equation = outcome.equation();
    if (outcome.mathMl() == null) {
      throw new MalformedSymbolForestException(
          documentId, equation.index(), equation.texPath(), "Parser reported no MathML");
    }

    List<ParsedSymbol> forest;
    try {
      forest = forestExtractor.extract(outcome.mathMl());
    } catch (IllegalArgumentException e) {
      throw new MalformedSymbolForestException(
          documentId, equation.index(), equation.texPath(), e.getMessage(), e);
    }
    log.debug(
        "Found {} symbols in equation {} of {}: {}",
        forest.size(),
        equation.index(),
        documentId,
        equation.tex());
    return graphNormalizer.normalize(documentId, equation, forest);
  }

  private static long count(List<DocumentExtractionResult> results, Status status) {
    return results.stream().filter(result -> result.status() == status).count();
  }
}
