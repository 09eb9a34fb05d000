package com.flamingo.ai.entities.runner;

import com.flamingo.ai.entities.service.symbols.DocumentDirectories;
import com.flamingo.ai.entities.service.symbols.SymbolExtractionService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs symbol extraction once on startup.
 *
 * <p>Non-option arguments are the ids of the documents to process. Without any, every document the
 * equation detection stage produced output for is processed.
 */
@Component
@ConditionalOnProperty(
    name = "extractor.run-on-startup",
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SymbolExtractionRunner implements ApplicationRunner {

  private final SymbolExtractionService symbolExtractionService;
  private final DocumentDirectories directories;

  @Override
  public void run(ApplicationArguments args) {
    List<String> documentIds = args.getNonOptionArgs();
    if (documentIds.isEmpty()) {
      documentIds = directories.detectedDocumentIds();
    }
    if (documentIds.isEmpty()) {
      log.info("No documents to extract symbols from");
      return;
    }

    log.info("Extracting symbols from {} documents", documentIds.size());
    symbolExtractionService.extractAll(documentIds);
  }
}
